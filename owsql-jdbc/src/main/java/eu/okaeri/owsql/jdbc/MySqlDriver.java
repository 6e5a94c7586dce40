package eu.okaeri.owsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.jdbc.commons.JdbcHelper;
import lombok.NonNull;

/**
 * MySQL and MariaDB. Uses the MariaDB connector for {@code jdbc:mariadb:} URLs
 * and whichever driver is registered for {@code jdbc:mysql:}.
 * <p>
 * Literals are escaped for the default SQL mode. With {@code NO_BACKSLASH_ESCAPES}
 * the doubled backslashes would be stored as two characters.
 */
public class MySqlDriver extends JdbcDriver {

    public static final String MARIADB_DRIVER_CLASS = "org.mariadb.jdbc.Driver";

    protected MySqlDriver(@NonNull HikariConfig hikariConfig) {
        super(SqlDialect.MYSQL, hikariConfig);
    }

    protected MySqlDriver(@NonNull HikariDataSource dataSource) {
        super(SqlDialect.MYSQL, dataSource);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl, @NonNull String username, @NonNull String password) {
        return JdbcHelper.configureHikari(jdbcUrl, MARIADB_DRIVER_CLASS, username, password);
    }

    public static class Builder extends JdbcDriverBuilder<Builder, MySqlDriver> {

        @Override
        public MySqlDriver build() {
            this.checkSource();
            if (this.dataSource != null) {
                return new MySqlDriver(this.dataSource);
            }
            return new MySqlDriver(this.hikariConfig);
        }
    }
}
