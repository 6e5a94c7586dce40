package eu.okaeri.owsql.registry;

import eu.okaeri.owsql.OwsqlException;

/**
 * Thrown when a trusted fragment leaves a quoted region or a comment open, e.g.
 * {@code "WHERE name = '"} or {@code "WHERE 1 = 1 --"}. Raw text concatenated after
 * such a fragment would end up inside trusted quoting or escape through a newline.
 */
public class MalformedFragmentException extends OwsqlException {

    public MalformedFragmentException(String message) {
        super(message);
    }
}
