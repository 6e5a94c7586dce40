package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.validation.ScannedStatement;
import eu.okaeri.owsql.validation.SecurityRule;
import eu.okaeri.owsql.validation.SqlSpan;
import lombok.NonNull;

import java.util.Optional;

/**
 * Structure that opens a comment immediately after a literal's closing quote.
 * Some backends end the statement there, dropping whatever followed the literal.
 */
public class CommentAfterLiteralRule implements SecurityRule {

    public static final String NAME = "COMMENT_AFTER_LITERAL";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<String> findViolation(@NonNull ScannedStatement statement) {
        boolean hash = statement.getDialect().isHashComment();
        for (SqlSpan literal : statement.getLiterals()) {
            Optional<SqlSpan> next = statement.next(literal);
            if (next.isEmpty() || !next.get().isStructure()) {
                continue;
            }
            String following = next.get().getText().stripLeading();
            if (following.startsWith("--") || following.startsWith("/*") || (hash && following.startsWith("#"))) {
                return Optional.of("comment after the literal at offset " + literal.getStart());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return NAME;
    }
}
