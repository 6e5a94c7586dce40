package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.dialect.SqlDialect;

import java.util.regex.Pattern;

/**
 * A quote inside a literal operand followed by a boolean or set operator,
 * the shape of {@code alice' OR '1'='1}.
 */
public class QuoteBreakoutRule extends LiteralPatternRule {

    public static final String NAME = "QUOTE_BREAKOUT";

    private static final Pattern PATTERN = Pattern.compile(
        "'\\s*(?:;|(?:or|and|union|having|order\\s+by|group\\s+by)\\b)", Pattern.CASE_INSENSITIVE);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Pattern pattern(SqlDialect dialect) {
        return PATTERN;
    }

    @Override
    protected String describe() {
        return "quote followed by an operator inside a literal";
    }
}
