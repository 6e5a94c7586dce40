package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.dialect.SqlDialect;

import java.util.regex.Pattern;

/**
 * A comment opener right after a quote inside a literal operand ({@code admin'--}),
 * or a literal operand that ends with one ({@code 1 OR 1=1 --}).
 */
public class TrailingCommentRule extends LiteralPatternRule {

    public static final String NAME = "TRAILING_COMMENT";

    private static final Pattern STANDARD = Pattern.compile("'\\s*(?:--|/\\*)|(?:--|/\\*)\\s*$");
    private static final Pattern HASH_COMMENT = Pattern.compile("'\\s*(?:--|/\\*|#)|(?:--|/\\*|#)\\s*$");

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
        return "comment opener at the end of a literal";
    }
}
