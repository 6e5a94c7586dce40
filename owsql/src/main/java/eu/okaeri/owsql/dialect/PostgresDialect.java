package eu.okaeri.owsql.dialect;

import lombok.NonNull;

/**
 * PostgreSQL string literals.
 * <p>
 * With {@code standard_conforming_strings} on (the server default since 9.1)
 * backslashes are literal and only quotes need doubling. Servers running with the
 * setting off treat backslash as an escape, so it has to be doubled as well.
 * <p>
 * Trusted text may also use dollar quoting, {@code E'...'} escape strings and
 * nested block comments, which the scanner has to follow to find where literals end.
 */
public class PostgresDialect extends StandardSqlDialect {

    private final boolean standardConformingStrings;

    public PostgresDialect() {
        this(true);
    }

    public PostgresDialect(boolean standardConformingStrings) {
        this.standardConformingStrings = standardConformingStrings;
    }

    @Override
    public String getName() {
        return "PostgreSQL";
    }

    @Override
    public boolean isBackslashEscaping() {
        return !this.standardConformingStrings;
    }

    @Override
    public boolean isDollarQuoting() {
        return true;
    }

    @Override
    public boolean isEscapeStringSyntax() {
        return true;
    }

    @Override
    public boolean isNestedBlockComments() {
        return true;
    }

    @Override
    public String escape(@NonNull String text) {
        if (this.standardConformingStrings) {
            return super.escape(text);
        }
        return super.escape(text.replace("\\", "\\\\"));
    }
}
