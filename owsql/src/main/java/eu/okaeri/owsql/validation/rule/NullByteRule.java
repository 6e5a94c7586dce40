package eu.okaeri.owsql.validation.rule;

import eu.okaeri.owsql.validation.ScannedStatement;
import eu.okaeri.owsql.validation.SecurityRule;
import lombok.NonNull;

import java.util.Optional;

/**
 * A NUL character anywhere in the statement. Drivers passing SQL as C strings
 * would see the statement end there.
 */
public class NullByteRule implements SecurityRule {

    public static final String NAME = "NULL_BYTE";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<String> findViolation(@NonNull ScannedStatement statement) {
        int index = statement.getSql().indexOf('\0');
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of("null byte at offset " + index);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
