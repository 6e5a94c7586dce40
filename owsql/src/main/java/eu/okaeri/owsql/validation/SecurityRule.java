package eu.okaeri.owsql.validation;

import java.util.Optional;

/**
 * A structural predicate over a reconstructed statement.
 */
public interface SecurityRule {

    /**
     * Stable rule name, reported by {@link SecurityPatternException#getRule()}
     * and used by {@link SecurityPolicy.Builder#without(String)}.
     */
    String getName();

    /**
     * @param statement scanned statement
     * @return description of the first violation, or empty when the statement passes
     */
    Optional<String> findViolation(ScannedStatement statement);
}
