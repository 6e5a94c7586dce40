package eu.okaeri.owsqltest.containers;

import eu.okaeri.owsql.OwsqlConnection;

/**
 * A database the end-to-end suite runs against. Every backend has to behave the
 * same for trusted fragments, raw literals and rejected statements.
 */
public interface BackendContainer extends AutoCloseable {

    /**
     * Display name, used by JUnit for parameterized test names.
     */
    String getName();

    /**
     * Open a new connection. Each call returns its own trust registry.
     */
    OwsqlConnection createConnection();

    /**
     * Whether this backend needs Docker.
     */
    boolean requiresContainer();

    BackendType getType();

    @Override
    void close() throws Exception;

    enum BackendType {
        SQLITE,
        POSTGRESQL,
        MARIADB
    }
}
