package eu.okaeri.owsql.util;

import lombok.NonNull;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.IntConsumer;
import java.util.logging.Logger;

/**
 * Opens a backend resource (usually a connection pool), retrying with exponential
 * backoff until it succeeds or the timeout elapses.
 * <p>
 * Defaults come from system properties:
 * <ul>
 *   <li>{@code okaeri.owsql.connectRetry.initialBackoffMs} - first wait (default: 1000)</li>
 *   <li>{@code okaeri.owsql.connectRetry.maxBackoffMs} - longest wait (default: 30000)</li>
 *   <li>{@code okaeri.owsql.connectRetry.timeoutMs} - give up after, 0 to never give up (default: 300000)</li>
 * </ul>
 * The wait doubles after each failed attempt.
 */
public final class ConnectionRetry<T> {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRetry.class.getSimpleName());

    private static final Duration DEFAULT_INITIAL_BACKOFF = durationProperty("okaeri.owsql.connectRetry.initialBackoffMs", 1_000);
    private static final Duration DEFAULT_MAX_BACKOFF = durationProperty("okaeri.owsql.connectRetry.maxBackoffMs", 30_000);
    private static final Duration DEFAULT_TIMEOUT = durationProperty("okaeri.owsql.connectRetry.timeoutMs", 300_000);

    private final String context;
    private final Callable<T> opener;
    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private Duration timeout = DEFAULT_TIMEOUT;
    private IntConsumer onRetry = attempt -> {
    };

    private ConnectionRetry(@NonNull String context, @NonNull Callable<T> opener) {
        this.context = context;
        this.opener = opener;
    }

    public static <T> ConnectionRetry<T> of(@NonNull String context, @NonNull Callable<T> opener) {
        return new ConnectionRetry<>(context, opener);
    }

    public ConnectionRetry<T> initialBackoff(@NonNull Duration backoff) {
        this.initialBackoff = backoff;
        return this;
    }

    public ConnectionRetry<T> maxBackoff(@NonNull Duration backoff) {
        this.maxBackoff = backoff;
        return this;
    }

    /**
     * @param timeout total time to keep retrying, {@link Duration#ZERO} for no limit
     */
    public ConnectionRetry<T> timeout(@NonNull Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public ConnectionRetry<T> onRetry(@NonNull IntConsumer onRetry) {
        this.onRetry = onRetry;
        return this;
    }

    public T open() {

        long started = System.nanoTime();
        Duration backoff = this.initialBackoff;

        for (int attempt = 1; ; attempt++) {
            try {
                return this.opener.call();
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while connecting to " + this.context, exception);
            } catch (Exception exception) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                if (!this.timeout.isZero() && (elapsed.compareTo(this.timeout) >= 0)) {
                    throw new ConnectionException("Cannot connect to " + this.context + " after " +
                        attempt + " attempts (" + elapsed.toMillis() + " ms)", exception);
                }

                String cause = (exception.getCause() == null) ? "" : (" caused by " + exception.getCause().getMessage());
                LOGGER.severe("[" + this.context + "] Cannot connect (attempt " + attempt + ", waiting " +
                    backoff.toMillis() + " ms): " + exception.getMessage() + cause);
                this.onRetry.accept(attempt);

                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ConnectionException("Interrupted while connecting to " + this.context, interrupted);
                }

                Duration doubled = backoff.multipliedBy(2);
                backoff = (doubled.compareTo(this.maxBackoff) > 0) ? this.maxBackoff : doubled;
            }
        }
    }

    private static Duration durationProperty(String name, long defaultMillis) {
        return Duration.ofMillis(Long.parseLong(System.getProperty(name, String.valueOf(defaultMillis))));
    }

    /**
     * Connection could not be established within the timeout, or the attempt was interrupted.
     */
    public static class ConnectionException extends RuntimeException {
        public ConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
