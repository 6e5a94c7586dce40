package eu.okaeri.owsql;

/**
 * Thrown when a runtime value offered to {@link OwsqlConnection#allowlist(Object)}
 * or {@link OwsqlConnection#integer(Object)} does not satisfy the helper's contract.
 */
public class RejectedValueException extends OwsqlException {

    public RejectedValueException(String message) {
        super(message);
    }

    public RejectedValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
