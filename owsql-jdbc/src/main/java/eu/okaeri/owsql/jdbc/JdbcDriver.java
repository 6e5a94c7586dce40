package eu.okaeri.owsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.owsql.Row;
import eu.okaeri.owsql.RowCallback;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.driver.DriverException;
import eu.okaeri.owsql.driver.SqlDriver;
import eu.okaeri.owsql.util.ConnectionRetry;
import lombok.Getter;
import lombok.NonNull;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * {@link SqlDriver} over a HikariCP pool. Each statement borrows a connection,
 * runs as a plain {@link Statement} and returns it to the pool.
 * Every column is read as text.
 */
public class JdbcDriver implements SqlDriver {

    private static final Logger LOGGER = Logger.getLogger(JdbcDriver.class.getSimpleName());

    @Getter private final SqlDialect dialect;
    @Getter private HikariDataSource dataSource;

    protected JdbcDriver(@NonNull SqlDialect dialect, @NonNull HikariConfig hikariConfig) {
        this.dialect = dialect;
        this.connect(hikariConfig);
    }

    protected JdbcDriver(@NonNull SqlDialect dialect, @NonNull HikariDataSource dataSource) {
        this.dialect = dialect;
        this.dataSource = dataSource;
    }

    private void connect(@NonNull HikariConfig hikariConfig) {
        this.dataSource = ConnectionRetry.of(this.dialect.getName(), () -> new HikariDataSource(hikariConfig)).open();
    }

    @Override
    public void execute(@NonNull String sql) {
        try (Connection connection = this.dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException exception) {
            throw this.failure(exception);
        }
    }

    @Override
    public void iterate(@NonNull String sql, @NonNull RowCallback callback) {
        try (Connection connection = this.dataSource.getConnection();
             Statement statement = connection.createStatement()) {

            if (!statement.execute(sql)) {
                return;
            }

            try (ResultSet resultSet = statement.getResultSet()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columns = metaData.getColumnCount();
                while (resultSet.next()) {
                    Row.Builder row = Row.builder();
                    for (int column = 1; column <= columns; column++) {
                        row.column(metaData.getColumnLabel(column), resultSet.getString(column));
                    }
                    if (!callback.accept(row.build())) {
                        break;
                    }
                }
            }
        } catch (SQLException exception) {
            throw this.failure(exception);
        }
    }

    private DriverException failure(SQLException exception) {
        LOGGER.fine("[" + this.dialect.getName() + "] Statement failed (" + exception.getSQLState() + "): " + exception.getMessage());
        return new DriverException(exception.getMessage(), exception);
    }

    @Override
    public void close() {
        this.dataSource.close();
    }

    @Override
    public String toString() {
        return "JdbcDriver[" + this.dialect.getName() + "]";
    }
}
