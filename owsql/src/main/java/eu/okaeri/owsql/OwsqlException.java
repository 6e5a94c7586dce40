package eu.okaeri.owsql;

/**
 * Base type of every failure raised by the library.
 */
public class OwsqlException extends RuntimeException {

    public OwsqlException(String message) {
        super(message);
    }

    public OwsqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
