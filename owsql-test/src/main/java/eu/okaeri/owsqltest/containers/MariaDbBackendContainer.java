package eu.okaeri.owsqltest.containers;

import com.zaxxer.hikari.HikariConfig;
import eu.okaeri.owsql.ErrorLevel;
import eu.okaeri.owsql.OwsqlConnection;
import eu.okaeri.owsql.jdbc.MySqlDriver;
import org.testcontainers.containers.MariaDBContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * MariaDB database backend container using testcontainers.
 */
public class MariaDbBackendContainer implements BackendContainer {

    private static final class Holder {

        private static final MariaDBContainer<?> MARIADB = new MariaDBContainer<>(DockerImageName.parse("mariadb:11"))
            .withDatabaseName("okaeri_owsql")
            .withUsername("test")
            .withPassword("test")
            .withReuse(true);

        static {
            MARIADB.start();
        }
    }

    @Override
    public String getName() {
        return "MariaDB 11";
    }

    @Override
    public OwsqlConnection createConnection() {
        HikariConfig hikariConfig = MySqlDriver.configureHikari(Holder.MARIADB.getJdbcUrl(),
            Holder.MARIADB.getUsername(), Holder.MARIADB.getPassword());
        hikariConfig.setMaximumPoolSize(2);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(30000);

        return OwsqlConnection.builder()
            .driver(MySqlDriver.builder().hikariConfig(hikariConfig).build())
            .errorLevel(ErrorLevel.DEBUG)
            .build();
    }

    @Override
    public boolean requiresContainer() {
        return true;
    }

    @Override
    public BackendType getType() {
        return BackendType.MARIADB;
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
