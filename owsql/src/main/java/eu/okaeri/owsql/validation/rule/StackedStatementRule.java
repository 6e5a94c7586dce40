package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.dialect.SqlDialect;

import java.util.regex.Pattern;

/**
 * A statement separator inside a literal operand, followed by the end of the
 * literal, a comment or another statement: {@code '1; DROP TABLE users'}.
 */
public class StackedStatementRule extends LiteralPatternRule {

    public static final String NAME = "STACKED_STATEMENT";

    private static final String KEYWORDS = "select|insert|update|delete|replace|merge|drop|create|alter|truncate|rename" +
        "|grant|revoke|exec|execute|call|attach|detach|pragma|shutdown|union|with|declare|set|begin|commit|rollback";

    private static final Pattern STANDARD = Pattern.compile(
        ";\\s*(?:$|--|/\\*|(?:" + KEYWORDS + ")\\b)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HASH_COMMENT = Pattern.compile(
        ";\\s*(?:$|--|/\\*|#|(?:" + KEYWORDS + ")\\b)", Pattern.CASE_INSENSITIVE);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Pattern pattern(SqlDialect dialect) {
        return dialect.isHashComment() ? HASH_COMMENT : STANDARD;
    }

    @Override
    protected String describe() {
        return "statement separator inside a literal";
    }
}
