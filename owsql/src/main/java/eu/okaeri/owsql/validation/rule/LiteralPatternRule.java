package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.validation.ScannedStatement;
import eu.okaeri.owsql.validation.SecurityRule;
import eu.okaeri.owsql.validation.SqlSpan;
import lombok.NonNull;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches a pattern against the unescaped content of every operand literal.
 */
public abstract class LiteralPatternRule implements SecurityRule {

    protected abstract Pattern pattern(SqlDialect dialect);

    protected abstract String describe();

    @Override
    public Optional<String> findViolation(@NonNull ScannedStatement statement) {
        Pattern pattern = this.pattern(statement.getDialect());
        for (SqlSpan literal : statement.getOperandLiterals()) {
            if (pattern.matcher(literal.getContent()).find()) {
                return Optional.of(this.describe() + " at offset " + literal.getStart());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
