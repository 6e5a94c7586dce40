package eu.okaeri.owsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.NonNull;

/**
 * Shared options of the JDBC driver builders. Exactly one of {@link #hikariConfig}
 * (the pool is opened with retries) and {@link #dataSource} (an already open pool)
 * has to be given.
 */
public abstract class JdbcDriverBuilder<B extends JdbcDriverBuilder<B, D>, D extends JdbcDriver> {

    protected HikariConfig hikariConfig;
    protected HikariDataSource dataSource;

    @SuppressWarnings("unchecked")
    protected B self() {
        return (B) this;
    }

    public B hikariConfig(@NonNull HikariConfig hikariConfig) {
        this.hikariConfig = hikariConfig;
        return this.self();
    }

    public B dataSource(@NonNull HikariDataSource dataSource) {
        this.dataSource = dataSource;
        return this.self();
    }

    protected void checkSource() {
        if ((this.hikariConfig == null) && (this.dataSource == null)) {
            throw new IllegalStateException("hikariConfig or dataSource is required");
        }
        if ((this.hikariConfig != null) && (this.dataSource != null)) {
            throw new IllegalStateException("hikariConfig and dataSource are mutually exclusive");
        }
    }

    public abstract D build();
}
