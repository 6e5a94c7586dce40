package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.dialect.SqlDialect;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into quoted and unquoted regions according to the dialect's
 * quoting rules. This is not a parser: it only knows where literals, quoted
 * identifiers and comments begin and end.
 * <p>
 * Comments belong to structure, so quotes inside them do not open literals.
 * Where the dialect allows them, dollar-quoted text and {@code E'...'} escape strings
 * are literals too, and block comments nest.
 * A line comment without a terminating newline, or a block comment that is never
 * closed, leaves the statement open-ended.
 */
public class SqlScanner {

    @Getter private final SqlDialect dialect;

    public SqlScanner(@NonNull SqlDialect dialect) {
        this.dialect = dialect;
    }

    public ScannedStatement scan(@NonNull String sql) {

        List<SqlSpan> spans = new ArrayList<>();
        int length = sql.length();
        int structureStart = 0;
        int position = 0;
        boolean openComment = false;

        while (position < length) {

            char current = sql.charAt(position);

            if (this.startsLineComment(sql, position)) {
                int newline = sql.indexOf('\n', position);
                openComment = newline < 0;
                position = openComment ? length : (newline + 1);
                continue;
            }

            if (sql.startsWith("/*", position)) {
                int close = this.blockCommentEnd(sql, position);
                openComment = close < 0;
                position = openComment ? length : close;
                continue;
            }

            SqlSpan quoted = null;
            if ((current == '\'') || (current == '"') || (current == '`')) {
                quoted = this.readQuoted(sql, position, current);
            } else if ((current == '$') && this.dialect.isDollarQuoting()) {
                String delimiter = this.dollarDelimiter(sql, position);
                if (delimiter != null) {
                    quoted = this.readDollarQuoted(sql, position, delimiter);
                }
            }

            if (quoted == null) {
                position++;
                continue;
            }

            if (position > structureStart) {
                String structure = sql.substring(structureStart, position);
                spans.add(new SqlSpan(SqlSpan.Kind.STRUCTURE, structure, structure, structureStart, position, true));
            }

            spans.add(quoted);
            position = quoted.getEnd();
            structureStart = position;
        }

        if (structureStart < length) {
            String structure = sql.substring(structureStart);
            spans.add(new SqlSpan(SqlSpan.Kind.STRUCTURE, structure, structure, structureStart, length, true));
        }

        return new ScannedStatement(sql, this.dialect, spans, openComment);
    }

    private boolean startsLineComment(String sql, int position) {
        return sql.startsWith("--", position) || (this.dialect.isHashComment() && (sql.charAt(position) == '#'));
    }

    /**
     * @return index just past the comment that starts at {@code start}, -1 when it is never closed
     */
    private int blockCommentEnd(String sql, int start) {

        if (!this.dialect.isNestedBlockComments()) {
            int close = sql.indexOf("*/", start + 2);
            return (close < 0) ? -1 : (close + 2);
        }

        int depth = 0;
        int position = start;
        while (position < sql.length()) {
            if (sql.startsWith("/*", position)) {
                depth++;
                position += 2;
            } else if (sql.startsWith("*/", position)) {
                depth--;
                position += 2;
                if (depth == 0) {
                    return position;
                }
            } else {
                position++;
            }
        }
        return -1;
    }

    /**
     * @return the {@code $tag$} opening a dollar-quoted literal at {@code start}, or null when there is none
     */
    private String dollarDelimiter(String sql, int start) {

        // $ inside an identifier or after a parameter number is not a quote
        if ((start > 0) && isIdentifierPart(sql.charAt(start - 1))) {
            return null;
        }

        int position = start + 1;
        while ((position < sql.length()) && isIdentifierPart(sql.charAt(position)) && (sql.charAt(position) != '$')) {
            if ((position == (start + 1)) && Character.isDigit(sql.charAt(position))) {
                return null;
            }
            position++;
        }

        if ((position < sql.length()) && (sql.charAt(position) == '$')) {
            return sql.substring(start, position + 1);
        }
        return null;
    }

    private SqlSpan readDollarQuoted(String sql, int start, String delimiter) {

        int contentStart = start + delimiter.length();
        int close = sql.indexOf(delimiter, contentStart);
        if (close < 0) {
            return new SqlSpan(SqlSpan.Kind.LITERAL, sql.substring(start), sql.substring(contentStart), start, sql.length(), false);
        }

        int end = close + delimiter.length();
        return new SqlSpan(SqlSpan.Kind.LITERAL, sql.substring(start, end), sql.substring(contentStart, close), start, end, true);
    }

    private boolean isEscapeString(String sql, int quoteAt) {
        if (!this.dialect.isEscapeStringSyntax() || (quoteAt == 0)) {
            return false;
        }
        char prefix = sql.charAt(quoteAt - 1);
        return ((prefix == 'E') || (prefix == 'e')) && ((quoteAt == 1) || !isIdentifierPart(sql.charAt(quoteAt - 2)));
    }

    private static boolean isIdentifierPart(char value) {
        return Character.isLetterOrDigit(value) || (value == '_') || (value == '$');
    }

    private SqlSpan readQuoted(String sql, int start, char quote) {

        boolean literal = (quote == '\'') || ((quote == '"') && this.dialect.isDoubleQuoteLiteral());
        boolean backslash = literal && (this.dialect.isBackslashEscaping() || ((quote == '\'') && this.isEscapeString(sql, start)));
        StringBuilder content = new StringBuilder();
        int length = sql.length();
        int position = start + 1;

        while (position < length) {
            char current = sql.charAt(position);
            if (backslash && (current == '\\') && ((position + 1) < length)) {
                content.append(sql.charAt(position + 1));
                position += 2;
                continue;
            }
            if (current == quote) {
                if (((position + 1) < length) && (sql.charAt(position + 1) == quote)) {
                    content.append(quote);
                    position += 2;
                    continue;
                }
                SqlSpan.Kind kind = literal ? SqlSpan.Kind.LITERAL : SqlSpan.Kind.IDENTIFIER;
                return new SqlSpan(kind, sql.substring(start, position + 1), content.toString(), start, position + 1, true);
            }
            content.append(current);
            position++;
        }

        SqlSpan.Kind kind = literal ? SqlSpan.Kind.LITERAL : SqlSpan.Kind.IDENTIFIER;
        return new SqlSpan(kind, sql.substring(start), content.toString(), start, length, false);
    }
}
