package eu.okaeri.owsql;

import lombok.NonNull;

/**
 * Controls how much detail exception messages carry.
 * <p>
 * The default is read from the {@code okaeri.owsql.errorLevel} system property
 * and falls back to {@link #DEVELOP}.
 */
public enum ErrorLevel {

    /**
     * Summary only. Never echoes statements or values into messages.
     */
    RELEASE,

    /**
     * Summary and reason (rule name, expected format).
     */
    DEVELOP,

    /**
     * Summary, reason and the offending value or statement.
     */
    DEBUG;

    public static ErrorLevel fromSystemProperty() {
        String value = System.getProperty("okaeri.owsql.errorLevel", DEVELOP.name());
        try {
            return ErrorLevel.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("Unknown okaeri.owsql.errorLevel: " + value, exception);
        }
    }

    public String message(@NonNull String summary, @NonNull String reason, String value) {
        switch (this) {
            case RELEASE:
                return summary;
            case DEVELOP:
                return summary + ": " + reason;
            default:
                return summary + ": " + reason + " [" + value + "]";
        }
    }
}
