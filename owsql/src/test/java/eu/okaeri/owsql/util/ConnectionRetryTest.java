package eu.okaeri.owsql.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRetryTest {

    @Test
    void open_succeeds_on_first_attempt() {
        String pool = ConnectionRetry.of("sqlite", () -> "pool").open();

        assertThat(pool).isEqualTo("pool");
    }

    @Test
    void open_retries_until_success() {
        AtomicInteger attempts = new AtomicInteger();

        String pool = ConnectionRetry.of("postgres", () -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("connection refused");
                }
                return "pool";
            })
            .initialBackoff(Duration.ofMillis(5))
            .open();

        assertThat(pool).isEqualTo("pool");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void open_gives_up_after_timeout() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> ConnectionRetry.of("mariadb", () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("connection refused");
            })
            .initialBackoff(Duration.ofMillis(40))
            .timeout(Duration.ofMillis(100))
            .open())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("mariadb")
            .hasMessageContaining("attempts")
            .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(attempts.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void zero_timeout_keeps_retrying() {
        AtomicInteger attempts = new AtomicInteger();

        String pool = ConnectionRetry.of("sqlite", () -> {
                if (attempts.incrementAndGet() < 5) {
                    throw new IllegalStateException("busy");
                }
                return "pool";
            })
            .initialBackoff(Duration.ofMillis(2))
            .timeout(Duration.ZERO)
            .open();

        assertThat(pool).isEqualTo("pool");
        assertThat(attempts).hasValue(5);
    }

    @Test
    void on_retry_receives_attempt_numbers() {
        AtomicInteger attempts = new AtomicInteger();
        List<Integer> retries = new ArrayList<>();

        ConnectionRetry.of("sqlite", () -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("busy");
                }
                return "pool";
            })
            .initialBackoff(Duration.ofMillis(2))
            .onRetry(retries::add)
            .open();

        assertThat(retries).containsExactly(1, 2);
    }

    @Test
    void backoff_is_capped() {
        AtomicInteger attempts = new AtomicInteger();
        long started = System.nanoTime();

        ConnectionRetry.of("sqlite", () -> {
                if (attempts.incrementAndGet() < 6) {
                    throw new IllegalStateException("busy");
                }
                return "pool";
            })
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(5))
            .open();

        // capped: 5 ms per retry, uncapped: 5 + 10 + 20 + 40 + 80 ms
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(140));
    }
}
