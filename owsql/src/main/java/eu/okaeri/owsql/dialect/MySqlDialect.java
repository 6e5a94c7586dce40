package eu.okaeri.owsql.dialect;

import lombok.NonNull;

/**
 * MySQL/MariaDB string literals.
 * <p>
 * Both servers treat backslash as an escape character by default, so {@code '\''}
 * is an escaped quote and not a backslash followed by a closing quote.
 * Backslashes are escaped first, then quotes are doubled, so the quote escapes
 * are not escaped again.
 */
public class MySqlDialect extends StandardSqlDialect {

    @Override
    public String getName() {
        return "MySQL";
    }

    @Override
    public boolean isBackslashEscaping() {
        return true;
    }

    @Override
    public boolean isDoubleQuoteLiteral() {
        return true;
    }

    @Override
    public boolean isHashComment() {
        return true;
    }

    @Override
    public String escape(@NonNull String text) {
        return super.escape(text.replace("\\", "\\\\"));
    }
}
