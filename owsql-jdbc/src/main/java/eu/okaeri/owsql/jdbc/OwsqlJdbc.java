package eu.okaeri.owsql.jdbc;

import eu.okaeri.owsql.OwsqlConnection;
import lombok.NonNull;

/**
 * Shortcuts for opening a connection with default settings.
 * <pre>{@code
 * try (OwsqlConnection owsql = OwsqlJdbc.sqlite("app.db")) {
 *     owsql.execute(owsql.ow("DELETE FROM sessions WHERE user =") + userName);
 * }
 * }</pre>
 * Use the driver builders and {@link OwsqlConnection#builder()} for anything else.
 */
public final class OwsqlJdbc {

    private OwsqlJdbc() {
    }

    /**
     * @param path database file, or {@code :memory:}
     */
    public static OwsqlConnection sqlite(@NonNull String path) {
        return open(SqliteDriver.builder().path(path).build());
    }

    public static OwsqlConnection postgres(@NonNull String jdbcUrl, @NonNull String username, @NonNull String password) {
        return open(PostgresDriver.builder()
            .hikariConfig(PostgresDriver.configureHikari(jdbcUrl, username, password))
            .build());
    }

    public static OwsqlConnection mysql(@NonNull String jdbcUrl, @NonNull String username, @NonNull String password) {
        return open(MySqlDriver.builder()
            .hikariConfig(MySqlDriver.configureHikari(jdbcUrl, username, password))
            .build());
    }

    private static OwsqlConnection open(JdbcDriver driver) {
        return OwsqlConnection.builder().driver(driver).build();
    }
}
