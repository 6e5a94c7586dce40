package eu.okaeri.owsql.jdbc.commons;

import com.zaxxer.hikari.HikariConfig;
import lombok.NonNull;

import java.util.logging.Logger;

public final class JdbcHelper {

    private static final Logger LOGGER = Logger.getLogger(JdbcHelper.class.getSimpleName());

    private JdbcHelper() {
    }

    /**
     * Load a JDBC driver class if present. Drivers registered through
     * {@link java.util.ServiceLoader} work without it.
     */
    public static boolean initDriverQuietly(@NonNull String clazz) {
        try {
            Class.forName(clazz);
            return true;
        } catch (ClassNotFoundException exception) {
            LOGGER.fine("JDBC driver " + clazz + " not on classpath, relying on service loader");
            return false;
        }
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        return config;
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl, @NonNull String driverClazz) {
        initDriverQuietly(driverClazz);
        return configureHikari(jdbcUrl);
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl, @NonNull String driverClazz,
                                               @NonNull String username, @NonNull String password) {
        HikariConfig config = configureHikari(jdbcUrl, driverClazz);
        config.setUsername(username);
        config.setPassword(password);
        return config;
    }
}
