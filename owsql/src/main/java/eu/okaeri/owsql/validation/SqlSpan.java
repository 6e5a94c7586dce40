package eu.okaeri.owsql.validation;

import lombok.Value;

/**
 * A region of a scanned statement.
 * <p>
 * {@code text} is the region as written (quotes and escapes included),
 * {@code content} is the unescaped text between the quotes for literals and
 * identifiers, and equals {@code text} for structure.
 */
@Value
public class SqlSpan {

    Kind kind;
    String text;
    String content;
    int start;
    int end;
    boolean terminated;

    public boolean isLiteral() {
        return this.kind == Kind.LITERAL;
    }

    public boolean isStructure() {
        return this.kind == Kind.STRUCTURE;
    }

    public enum Kind {
        /** Keywords, operators, identifiers and comments outside of any quotes. */
        STRUCTURE,
        /** A quoted string literal. */
        LITERAL,
        /** A quoted identifier. */
        IDENTIFIER
    }
}
