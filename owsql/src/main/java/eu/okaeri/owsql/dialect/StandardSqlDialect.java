package eu.okaeri.owsql.dialect;

import lombok.NonNull;

/**
 * SQL-standard string literals: the quote character is escaped by doubling it
 * and backslashes are ordinary characters.
 */
public abstract class StandardSqlDialect implements SqlDialect {

    @Override
    public boolean isBackslashEscaping() {
        return false;
    }

    @Override
    public String escape(@NonNull String text) {
        String quote = String.valueOf(this.getQuoteChar());
        return text.replace(quote, quote + quote);
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
