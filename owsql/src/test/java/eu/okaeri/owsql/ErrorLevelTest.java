package eu.okaeri.owsql;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorLevelTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("okaeri.owsql.errorLevel");
    }

    @Test
    void release_never_echoes_reason_or_value() {
        String message = ErrorLevel.RELEASE.message("Rejected", "QUOTE_BREAKOUT", "' OR 1=1");

        assertThat(message).isEqualTo("Rejected");
    }

    @Test
    void develop_names_the_reason_only() {
        String message = ErrorLevel.DEVELOP.message("Rejected", "QUOTE_BREAKOUT", "' OR 1=1");

        assertThat(message).isEqualTo("Rejected: QUOTE_BREAKOUT");
    }

    @Test
    void debug_includes_the_value() {
        String message = ErrorLevel.DEBUG.message("Rejected", "QUOTE_BREAKOUT", "' OR 1=1");

        assertThat(message).isEqualTo("Rejected: QUOTE_BREAKOUT [' OR 1=1]");
    }

    @Test
    void system_property_defaults_to_develop() {
        assertThat(ErrorLevel.fromSystemProperty()).isEqualTo(ErrorLevel.DEVELOP);
    }

    @Test
    void system_property_is_case_insensitive() {
        System.setProperty("okaeri.owsql.errorLevel", " release ");

        assertThat(ErrorLevel.fromSystemProperty()).isEqualTo(ErrorLevel.RELEASE);
    }

    @Test
    void system_property_rejects_unknown_level() {
        System.setProperty("okaeri.owsql.errorLevel", "verbose");

        assertThatThrownBy(ErrorLevel::fromSystemProperty)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("verbose");
    }
}
