package eu.okaeri.owsqltest.containers;

import com.zaxxer.hikari.HikariConfig;
import eu.okaeri.owsql.ErrorLevel;
import eu.okaeri.owsql.OwsqlConnection;
import eu.okaeri.owsql.jdbc.PostgresDriver;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * PostgreSQL database backend container using testcontainers.
 * The container is started on first use and shared by all tests.
 */
public class PostgresBackendContainer implements BackendContainer {

    private static final class Holder {

        private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("okaeri_owsql")
            .withUsername("postgres")
            .withPassword("test")
            .withReuse(true);

        static {
            POSTGRES.start();
        }
    }

    @Override
    public String getName() {
        return "PostgreSQL 16";
    }

    @Override
    public OwsqlConnection createConnection() {
        HikariConfig hikariConfig = PostgresDriver.configureHikari(Holder.POSTGRES.getJdbcUrl(),
            Holder.POSTGRES.getUsername(), Holder.POSTGRES.getPassword());
        hikariConfig.setMaximumPoolSize(2);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(30000);

        return OwsqlConnection.builder()
            .driver(PostgresDriver.builder().hikariConfig(hikariConfig).build())
            .errorLevel(ErrorLevel.DEBUG)
            .build();
    }

    @Override
    public boolean requiresContainer() {
        return true;
    }

    @Override
    public BackendType getType() {
        return BackendType.POSTGRESQL;
    }

    @Override
    public void close() throws Exception {
        // shared container, stopped by the testcontainers reaper
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
