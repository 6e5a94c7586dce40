package eu.okaeri.owsql.reconstruct;

import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.registry.TokenGenerator;
import eu.okaeri.owsql.registry.TrustRegistry;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns composed text back into a statement.
 * <p>
 * Composed text is read as whitespace-separated words. A word that is a token
 * registered in the registry is replaced by its fragment, verbatim. Every maximal
 * run of other words is one raw span: the original text from the start of its first
 * word to the end of its last word, escaped and quoted as a single literal.
 * Each emitted piece is followed by one space.
 * <p>
 * Token-shaped words that the registry does not know (forged, truncated, minted by
 * another connection) are data like any other raw text.
 * <p>
 * Reading only; never mutates the registry.
 */
public class Reconstructor {

    private static final Logger LOGGER = Logger.getLogger(Reconstructor.class.getSimpleName());

    @Getter private final TrustRegistry registry;
    @Getter private final SqlDialect dialect;

    public Reconstructor(@NonNull TrustRegistry registry, @NonNull SqlDialect dialect) {
        this.registry = registry;
        this.dialect = dialect;
    }

    public List<ParsedSegment> segment(@NonNull String composed) {

        List<ParsedSegment> segments = new ArrayList<>();
        int length = composed.length();
        int rawStart = -1;
        int rawEnd = -1;
        int position = 0;

        while (position < length) {

            while ((position < length) && Character.isWhitespace(composed.charAt(position))) {
                position++;
            }
            if (position >= length) {
                break;
            }

            int wordStart = position;
            while ((position < length) && !Character.isWhitespace(composed.charAt(position))) {
                position++;
            }

            String word = composed.substring(wordStart, position);
            Optional<String> fragment = this.resolve(word);

            if (fragment.isPresent()) {
                if (rawStart >= 0) {
                    segments.add(ParsedSegment.raw(composed.substring(rawStart, rawEnd)));
                    rawStart = -1;
                }
                segments.add(ParsedSegment.trusted(word, fragment.get()));
                continue;
            }

            if (rawStart < 0) {
                rawStart = wordStart;
            }
            rawEnd = position;
        }

        if (rawStart >= 0) {
            segments.add(ParsedSegment.raw(composed.substring(rawStart, rawEnd)));
        }

        // empty input is still one (empty) literal
        if (segments.isEmpty()) {
            segments.add(ParsedSegment.raw(""));
        }

        return segments;
    }

    public String reconstruct(@NonNull String composed) {
        StringBuilder sql = new StringBuilder(composed.length() + 16);
        for (ParsedSegment segment : this.segment(composed)) {
            sql.append(segment.isTrusted() ? segment.getText() : this.dialect.quote(segment.getText()));
            sql.append(' ');
        }
        return sql.toString();
    }

    private Optional<String> resolve(String word) {

        TokenGenerator tokens = this.registry.getTokenGenerator();
        if (!tokens.matches(word)) {
            return Optional.empty();
        }

        Optional<String> fragment = this.registry.resolve(word);
        if (fragment.isEmpty()) {
            LOGGER.fine("Token-shaped word is not registered on this connection, treating it as data");
        }

        return fragment;
    }
}
