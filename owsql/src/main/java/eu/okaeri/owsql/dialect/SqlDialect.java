package eu.okaeri.owsql.dialect;

/**
 * Backend quoting convention used to turn untrusted text into a string literal
 * and to scan reconstructed statements for literal boundaries.
 * <p>
 * Selected once, when a connection is opened, from its driver.
 */
public interface SqlDialect {

    SqlDialect SQLITE = new SqliteDialect();
    SqlDialect POSTGRESQL = new PostgresDialect();
    SqlDialect MYSQL = new MySqlDialect();

    /**
     * Display name for logs and test output.
     */
    String getName();

    /**
     * Quote character that delimits string literals produced for raw text.
     */
    default char getQuoteChar() {
        return '\'';
    }

    /**
     * Whether a backslash inside a string literal escapes the following character.
     */
    boolean isBackslashEscaping();

    /**
     * Whether double-quoted text is a string literal rather than an identifier.
     */
    default boolean isDoubleQuoteLiteral() {
        return false;
    }

    /**
     * Whether {@code #} starts a line comment.
     */
    default boolean isHashComment() {
        return false;
    }

    /**
     * Whether {@code $tag$ ... $tag$} delimits a string literal.
     */
    default boolean isDollarQuoting() {
        return false;
    }

    /**
     * Whether {@code E'...'} opens a literal in which backslash escapes the following
     * character, regardless of {@link #isBackslashEscaping()}.
     */
    default boolean isEscapeStringSyntax() {
        return false;
    }

    /**
     * Whether block comments nest, so that every opening needs its own close.
     */
    default boolean isNestedBlockComments() {
        return false;
    }

    /**
     * Escape text so that it can be placed between two quote characters
     * without being able to terminate the literal.
     */
    String escape(String text);

    default String quote(String text) {
        return this.getQuoteChar() + this.escape(text) + this.getQuoteChar();
    }
}
