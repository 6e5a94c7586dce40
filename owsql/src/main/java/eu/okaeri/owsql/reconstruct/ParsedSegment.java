package eu.okaeri.owsql.reconstruct;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * One piece of composed text: a registered token or a run of untrusted text.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParsedSegment {

    Kind kind;
    String token;
    String text;

    public static ParsedSegment trusted(@NonNull String token, @NonNull String fragment) {
        return new ParsedSegment(Kind.TRUSTED, token, fragment);
    }

    public static ParsedSegment raw(@NonNull String text) {
        return new ParsedSegment(Kind.RAW, null, text);
    }

    public boolean isTrusted() {
        return this.kind == Kind.TRUSTED;
    }

    public enum Kind {
        TRUSTED,
        RAW
    }
}
