package eu.okaeri.owsql.jdbc.commons;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcHelperTest {

    @Test
    void init_driver_reports_presence() {
        assertThat(JdbcHelper.initDriverQuietly("org.sqlite.JDBC")).isTrue();
        assertThat(JdbcHelper.initDriverQuietly("com.example.MissingDriver")).isFalse();
    }

    @Test
    void configure_hikari_sets_url() {
        HikariConfig config = JdbcHelper.configureHikari("jdbc:sqlite::memory:", "com.example.MissingDriver");

        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:sqlite::memory:");
    }
}
