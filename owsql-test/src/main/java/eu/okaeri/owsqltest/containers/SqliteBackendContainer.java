package eu.okaeri.owsqltest.containers;

import eu.okaeri.owsql.ErrorLevel;
import eu.okaeri.owsql.OwsqlConnection;
import eu.okaeri.owsql.jdbc.SqliteDriver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite in a temporary database file, removed on close.
 */
public class SqliteBackendContainer implements BackendContainer {

    private final Path dbPath;

    public SqliteBackendContainer() {
        try {
            this.dbPath = Files.createTempFile("owsql_test_", ".db");
        } catch (IOException exception) {
            throw new IllegalStateException("cannot create sqlite database file", exception);
        }
    }

    @Override
    public String getName() {
        return "SQLite";
    }

    @Override
    public OwsqlConnection createConnection() {
        return OwsqlConnection.builder()
            .driver(SqliteDriver.builder().path(this.dbPath.toString()).build())
            .errorLevel(ErrorLevel.DEBUG)
            .build();
    }

    @Override
    public boolean requiresContainer() {
        return false;
    }

    @Override
    public BackendType getType() {
        return BackendType.SQLITE;
    }

    @Override
    public void close() throws Exception {
        Files.deleteIfExists(this.dbPath);
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
