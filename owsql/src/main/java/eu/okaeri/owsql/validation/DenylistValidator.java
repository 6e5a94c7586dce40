package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.ErrorLevel;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Second line of defense on the execution path. Reconstruction already keeps raw
 * text inside literals; this refuses statements whose shape is still suspicious.
 */
public class DenylistValidator {

    private static final Logger LOGGER = Logger.getLogger(DenylistValidator.class.getSimpleName());

    @Getter private final SecurityPolicy policy;
    private final SqlScanner scanner;
    private final ErrorLevel errorLevel;

    public DenylistValidator(@NonNull SecurityPolicy policy, @NonNull SqlScanner scanner, @NonNull ErrorLevel errorLevel) {
        this.policy = policy;
        this.scanner = scanner;
        this.errorLevel = errorLevel;
    }

    public void validate(@NonNull String sql) {

        if (this.policy.getRules().isEmpty()) {
            return;
        }

        ScannedStatement statement = this.scanner.scan(sql);
        for (SecurityRule rule : this.policy.getRules()) {
            Optional<String> violation = rule.findViolation(statement);
            if (violation.isEmpty()) {
                continue;
            }
            LOGGER.warning("Statement rejected by " + rule.getName() + ((this.errorLevel == ErrorLevel.DEBUG) ? (": " + sql) : ""));
            throw new SecurityPatternException(rule.getName(),
                this.errorLevel.message("Statement rejected by security policy", rule.getName() + ", " + violation.get(), sql));
        }
    }
}
