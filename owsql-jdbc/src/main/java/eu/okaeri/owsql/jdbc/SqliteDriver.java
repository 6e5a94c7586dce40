package eu.okaeri.owsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.jdbc.commons.JdbcHelper;
import lombok.NonNull;

/**
 * SQLite through sqlite-jdbc. The pool is limited to a single connection:
 * SQLite serializes writers anyway, and an in-memory database lives only as
 * long as its connection.
 */
public class SqliteDriver extends JdbcDriver {

    public static final String DRIVER_CLASS = "org.sqlite.JDBC";
    public static final String MEMORY = ":memory:";

    protected SqliteDriver(@NonNull HikariConfig hikariConfig) {
        super(SqlDialect.SQLITE, hikariConfig);
    }

    protected SqliteDriver(@NonNull HikariDataSource dataSource) {
        super(SqlDialect.SQLITE, dataSource);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param path database file, or {@link #MEMORY}
     */
    public static HikariConfig configureHikari(@NonNull String path) {
        HikariConfig config = JdbcHelper.configureHikari("jdbc:sqlite:" + path, DRIVER_CLASS);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        if (MEMORY.equals(path)) {
            // retiring the only connection would drop the database
            config.setMaxLifetime(0);
            config.setIdleTimeout(0);
        }
        return config;
    }

    public static class Builder extends JdbcDriverBuilder<Builder, SqliteDriver> {

        public Builder path(@NonNull String path) {
            return this.hikariConfig(configureHikari(path));
        }

        public Builder memory() {
            return this.path(MEMORY);
        }

        @Override
        public SqliteDriver build() {
            this.checkSource();
            if (this.dataSource != null) {
                return new SqliteDriver(this.dataSource);
            }
            this.hikariConfig.setMaximumPoolSize(1);
            return new SqliteDriver(this.hikariConfig);
        }
    }
}
