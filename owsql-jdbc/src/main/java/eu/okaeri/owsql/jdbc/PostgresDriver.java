package eu.okaeri.owsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.owsql.dialect.PostgresDialect;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.jdbc.commons.JdbcHelper;
import lombok.NonNull;

/**
 * PostgreSQL through pgjdbc.
 * <p>
 * Literals are escaped for {@code standard_conforming_strings = on}, the server
 * default. Servers configured otherwise need
 * {@link Builder#standardConformingStrings(boolean)} set to false.
 */
public class PostgresDriver extends JdbcDriver {

    public static final String DRIVER_CLASS = "org.postgresql.Driver";

    protected PostgresDriver(@NonNull SqlDialect dialect, @NonNull HikariConfig hikariConfig) {
        super(dialect, hikariConfig);
    }

    protected PostgresDriver(@NonNull SqlDialect dialect, @NonNull HikariDataSource dataSource) {
        super(dialect, dataSource);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl, @NonNull String username, @NonNull String password) {
        return JdbcHelper.configureHikari(jdbcUrl, DRIVER_CLASS, username, password);
    }

    public static class Builder extends JdbcDriverBuilder<Builder, PostgresDriver> {
        private boolean standardConformingStrings = true;

        public Builder standardConformingStrings(boolean standardConformingStrings) {
            this.standardConformingStrings = standardConformingStrings;
            return this;
        }

        @Override
        public PostgresDriver build() {
            this.checkSource();
            SqlDialect dialect = this.standardConformingStrings ? SqlDialect.POSTGRESQL : new PostgresDialect(false);
            if (this.dataSource != null) {
                return new PostgresDriver(dialect, this.dataSource);
            }
            return new PostgresDriver(dialect, this.hikariConfig);
        }
    }
}
