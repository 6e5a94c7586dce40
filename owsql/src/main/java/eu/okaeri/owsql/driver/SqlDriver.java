package eu.okaeri.owsql.driver;

import eu.okaeri.owsql.RowCallback;
import eu.okaeri.owsql.dialect.SqlDialect;

import java.io.Closeable;

/**
 * Backend capability used by {@link eu.okaeri.owsql.OwsqlConnection} to run
 * statements that were already reconstructed and validated.
 * <p>
 * Implementations only ever receive final SQL text; they never see composed text
 * or tokens. Failures are reported as {@link DriverException}.
 */
public interface SqlDriver extends Closeable {

    /**
     * Quoting convention of the backend this driver talks to.
     */
    SqlDialect getDialect();

    /**
     * Run a statement, discarding any rows it produces.
     *
     * @param sql final statement text
     */
    void execute(String sql);

    /**
     * Run a statement and hand its rows to the callback until it returns false.
     *
     * @param sql      final statement text
     * @param callback row consumer
     */
    void iterate(String sql, RowCallback callback);
}
