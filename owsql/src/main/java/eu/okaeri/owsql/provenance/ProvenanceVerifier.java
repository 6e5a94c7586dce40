package eu.okaeri.owsql.provenance;

import eu.okaeri.owsql.ErrorLevel;
import lombok.NonNull;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Runtime check that a value offered as trusted SQL was written in program source.
 * <p>
 * A value passes when it is one of the string constants of the class that called
 * into the library, and is the very instance the JVM interned for that constant.
 * Values read from input, formatted or concatenated at runtime are neither.
 * Classes listed as internal are skipped when looking for the caller, so the caller
 * is the first frame outside of them.
 * <p>
 * The check fails closed: when the caller's class file cannot be read, every value
 * is rejected.
 */
public class ProvenanceVerifier {

    private static final Logger LOGGER = Logger.getLogger(ProvenanceVerifier.class.getSimpleName());
    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private final Set<Class<?>> internalClasses;
    private final ErrorLevel errorLevel;

    public ProvenanceVerifier(@NonNull Set<Class<?>> internalClasses, @NonNull ErrorLevel errorLevel) {
        this.internalClasses = Set.copyOf(internalClasses);
        this.errorLevel = errorLevel;
    }

    public void verify(@NonNull String value) {

        Class<?> caller = WALKER.walk(frames -> frames
            .map(StackWalker.StackFrame::getDeclaringClass)
            .filter(type -> (type != ProvenanceVerifier.class) && !this.internalClasses.contains(type))
            .findFirst()
            .orElse(null));

        if (caller == null) {
            throw this.reject("no calling class", value);
        }

        if (!ClassConstants.of(caller).contains(value)) {
            LOGGER.warning("Rejected trusted fragment registered from " + caller.getName() + ": not a string constant of that class");
            throw this.reject("not a string constant of " + caller.getName(), value);
        }

        // constants are interned, an equal copy built at runtime is a different instance
        if (value != value.intern()) {
            LOGGER.warning("Rejected trusted fragment registered from " + caller.getName() + ": runtime copy of a constant");
            throw this.reject("runtime copy of a string constant of " + caller.getName(), value);
        }
    }

    private ProvenanceRejectedException reject(String reason, String value) {
        return new ProvenanceRejectedException(this.errorLevel.message("Fragment is not fixed in program source", reason, value));
    }
}
