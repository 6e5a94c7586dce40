package eu.okaeri.owsql.util;

import lombok.NonNull;

/**
 * Text helpers for values that end up inside literals.
 */
public final class SqlStrings {

    private SqlStrings() {
    }

    /**
     * Escape {@code %}, {@code _} and the backslash itself with a backslash, so the
     * value matches itself in a LIKE pattern.
     */
    public static String sanitizeLike(@NonNull String pattern) {
        return sanitizeLike(pattern, '\\');
    }

    /**
     * Escape {@code %}, {@code _} and the escape character with the given character.
     * The statement must declare it with {@code ESCAPE} where the backend has no default.
     */
    public static String sanitizeLike(@NonNull String pattern, char escapeChar) {
        StringBuilder escaped = new StringBuilder(pattern.length() + 8);
        for (int i = 0; i < pattern.length(); i++) {
            char current = pattern.charAt(i);
            if ((current == '%') || (current == '_') || (current == escapeChar)) {
                escaped.append(escapeChar);
            }
            escaped.append(current);
        }
        return escaped.toString();
    }

    /**
     * Convert {@code & " ' < >} to HTML entities, for values that are rendered
     * into pages after being read back.
     */
    public static String htmlSpecialChars(@NonNull String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char current = text.charAt(i);
            switch (current) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&#39;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                default:
                    escaped.append(current);
            }
        }
        return escaped.toString();
    }
}
