package eu.okaeri.owsql.driver;

import eu.okaeri.owsql.OwsqlException;
import lombok.Getter;

import java.sql.SQLException;

/**
 * Backend failure (syntax, connectivity, type mismatch). The backend message is
 * kept as-is, SQLState and vendor code are exposed when the cause is a
 * {@link SQLException}.
 */
public class DriverException extends OwsqlException {

    @Getter private final String sqlState;
    @Getter private final int errorCode;

    public DriverException(String message, Throwable cause) {
        super(message, cause);
        if (cause instanceof SQLException) {
            this.sqlState = ((SQLException) cause).getSQLState();
            this.errorCode = ((SQLException) cause).getErrorCode();
        } else {
            this.sqlState = null;
            this.errorCode = 0;
        }
    }

    public DriverException(String message) {
        this(message, null);
    }
}
