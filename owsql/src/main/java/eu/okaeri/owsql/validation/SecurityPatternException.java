package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.OwsqlException;
import lombok.Getter;

/**
 * Thrown on the execution path when a reconstructed statement matches a rule of
 * the connection's security policy. The statement never reaches the driver.
 */
public class SecurityPatternException extends OwsqlException {

    @Getter private final String rule;

    public SecurityPatternException(String rule, String message) {
        super(message);
        this.rule = rule;
    }
}
