package eu.okaeri.owsql.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlStringsTest {

    @Test
    void sanitize_like_escapes_wildcards() {
        assertThat(SqlStrings.sanitizeLike("100%_done")).isEqualTo("100\\%\\_done");
    }

    @Test
    void sanitize_like_custom_escape_char() {
        assertThat(SqlStrings.sanitizeLike("a%b_c", '!')).isEqualTo("a!%b!_c");
    }

    @Test
    void sanitize_like_escapes_escape_char() {
        assertThat(SqlStrings.sanitizeLike("50\\%")).isEqualTo("50\\\\\\%");
        assertThat(SqlStrings.sanitizeLike("a!b", '!')).isEqualTo("a!!b");
    }

    @Test
    void sanitize_like_keeps_plain_text() {
        assertThat(SqlStrings.sanitizeLike("alice")).isEqualTo("alice");
        assertThat(SqlStrings.sanitizeLike("")).isEmpty();
    }

    @Test
    void html_special_chars() {
        assertThat(SqlStrings.htmlSpecialChars("<a href=\"x\">Tom & Jerry's</a>"))
            .isEqualTo("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&#39;s&lt;/a&gt;");
    }

    @Test
    void html_special_chars_keeps_plain_text() {
        assertThat(SqlStrings.htmlSpecialChars("plain text 123")).isEqualTo("plain text 123");
    }
}
