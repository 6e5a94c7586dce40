package eu.okaeri.owsql.registry;

import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Connection-owned mapping of tokens to trusted fragments.
 * <p>
 * Entries are inserted atomically and kept until {@link #clear()}. A token is never
 * reused for a different fragment: registering the same text twice yields two tokens.
 * Allowlisted values are kept as well, each bound once to the token of its literal.
 */
public class TrustRegistry {

    private static final Logger LOGGER = Logger.getLogger(TrustRegistry.class.getSimpleName());

    @Getter private final TokenGenerator tokenGenerator;
    private final int warningThreshold;
    private final AtomicBoolean warned = new AtomicBoolean();

    private final Map<String, String> fragments = new ConcurrentHashMap<>();
    private final Map<String, String> allowlist = new ConcurrentHashMap<>();

    public TrustRegistry(@NonNull TokenGenerator tokenGenerator, int warningThreshold) {
        this.tokenGenerator = tokenGenerator;
        this.warningThreshold = warningThreshold;
    }

    public TrustRegistry(@NonNull TokenGenerator tokenGenerator) {
        this(tokenGenerator, 0);
    }

    /**
     * Store the fragment under a freshly minted token.
     *
     * @param fragment trusted text, stored unescaped
     * @return the token (without padding)
     */
    public String register(@NonNull String fragment) {
        String token;
        do {
            token = this.tokenGenerator.next();
        } while (this.fragments.putIfAbsent(token, fragment) != null);
        this.checkSize();
        return token;
    }

    /**
     * Bind an allowlisted value to the token of its quoted literal.
     * Binding an already allowlisted value keeps the first token.
     *
     * @param value   allowlisted value as text
     * @param literal the value rendered as a quoted, escaped literal
     * @return token standing for the literal
     */
    public String allow(@NonNull String value, @NonNull String literal) {
        return this.allowlist.computeIfAbsent(value, key -> this.register(literal));
    }

    public Optional<String> findAllowed(@NonNull String value) {
        return Optional.ofNullable(this.allowlist.get(value));
    }

    public boolean isAllowed(@NonNull String value) {
        return this.allowlist.containsKey(value);
    }

    public Optional<String> resolve(@NonNull String token) {
        return Optional.ofNullable(this.fragments.get(token));
    }

    public boolean contains(@NonNull String token) {
        return this.fragments.containsKey(token);
    }

    public int size() {
        return this.fragments.size();
    }

    /**
     * Forget all fragments and allowlist bindings. Text composed before the call
     * no longer resolves and reconstructs as quoted data.
     */
    public void clear() {
        this.allowlist.clear();
        this.fragments.clear();
        this.warned.set(false);
    }

    private void checkSize() {
        if ((this.warningThreshold > 0) && (this.fragments.size() > this.warningThreshold) && this.warned.compareAndSet(false, true)) {
            LOGGER.warning("Trust registry holds more than " + this.warningThreshold + " fragments, " +
                "registering fragments in a loop on a long-lived connection grows it without bound");
        }
    }
}
