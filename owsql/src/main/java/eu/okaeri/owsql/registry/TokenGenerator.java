package eu.okaeri.owsql.registry;

import lombok.Getter;
import lombok.NonNull;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Mints the opaque markers that stand in for trusted fragments inside composed text.
 * <p>
 * A token is a fixed prefix followed by a fixed-length random alphanumeric suffix.
 * Suffixes shorter than {@link #MINIMUM_LENGTH} are raised to it.
 */
public class TokenGenerator {

    public static final int MINIMUM_LENGTH = 32;
    public static final String DEFAULT_PREFIX = "OWSQL";

    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final Pattern PREFIX_PATTERN = Pattern.compile("[A-Za-z_]{1,32}");

    @Getter private final String prefix;
    @Getter private final int length;
    private final Pattern tokenPattern;
    private final SecureRandom random = new SecureRandom();

    public TokenGenerator(@NonNull String prefix, int length) {
        if (!PREFIX_PATTERN.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Token prefix must be 1-32 letters or underscores: " + prefix);
        }
        this.prefix = prefix;
        this.length = Math.max(length, MINIMUM_LENGTH);
        this.tokenPattern = Pattern.compile(Pattern.quote(prefix) + "[A-Za-z0-9]{" + this.length + "}");
    }

    public TokenGenerator() {
        this(DEFAULT_PREFIX, MINIMUM_LENGTH);
    }

    public String next() {
        StringBuilder token = new StringBuilder(this.prefix.length() + this.length).append(this.prefix);
        for (int i = 0; i < this.length; i++) {
            token.append(ALPHABET[this.random.nextInt(ALPHABET.length)]);
        }
        return token.toString();
    }

    /**
     * Whether the word has token syntax. Says nothing about it being registered.
     */
    public boolean matches(@NonNull String word) {
        return (word.length() == (this.prefix.length() + this.length)) && this.tokenPattern.matcher(word).matches();
    }
}
