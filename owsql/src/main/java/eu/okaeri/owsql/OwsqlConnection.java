package eu.okaeri.owsql;

import com.google.errorprone.annotations.CompileTimeConstant;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.driver.SqlDriver;
import eu.okaeri.owsql.provenance.ProvenanceVerifier;
import eu.okaeri.owsql.reconstruct.ParsedSegment;
import eu.okaeri.owsql.reconstruct.Reconstructor;
import eu.okaeri.owsql.registry.MalformedFragmentException;
import eu.okaeri.owsql.registry.TokenGenerator;
import eu.okaeri.owsql.registry.TrustRegistry;
import eu.okaeri.owsql.validation.DenylistValidator;
import eu.okaeri.owsql.validation.SecurityPolicy;
import eu.okaeri.owsql.validation.SqlScanner;
import lombok.Getter;
import lombok.NonNull;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Statement composition over a single backend.
 * <p>
 * Trusted SQL enters only through {@link #ow(String)}, which returns an opaque token
 * padded with spaces. Everything else concatenated into the statement is data:
 * on {@link #actualSql(String)} tokens are replaced by their fragments and all other
 * text is escaped and quoted as literals.
 * <pre>{@code
 * String sql = owsql.ow("SELECT name FROM users WHERE") + owsql.ow("age <") + userInput;
 * List<Row> rows = owsql.rows(sql);
 * }</pre>
 * Tokens are valid only on the connection that minted them and stay valid until
 * {@link #clearTrustedFragments()} or {@link #close()}.
 */
public class OwsqlConnection implements Closeable {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.owsql.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(OwsqlConnection.class.getSimpleName());
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    @Getter private final SqlDriver driver;
    @Getter private final ErrorLevel errorLevel;
    private final TrustRegistry registry;
    private final SqlScanner scanner;
    private final Reconstructor reconstructor;
    private final DenylistValidator validator;
    private final ProvenanceVerifier verifier;

    protected OwsqlConnection(@NonNull SqlDriver driver, @NonNull TrustRegistry registry, @NonNull SecurityPolicy policy,
                              @NonNull ErrorLevel errorLevel, boolean verifyProvenance) {
        SqlDialect dialect = driver.getDialect();
        this.driver = driver;
        this.errorLevel = errorLevel;
        this.registry = registry;
        this.scanner = new SqlScanner(dialect);
        this.reconstructor = new Reconstructor(registry, dialect);
        this.validator = new DenylistValidator(policy, this.scanner, errorLevel);
        this.verifier = verifyProvenance ? new ProvenanceVerifier(Set.of(OwsqlConnection.class), errorLevel) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SqlDialect getDialect() {
        return this.reconstructor.getDialect();
    }

    public SecurityPolicy getSecurityPolicy() {
        return this.validator.getPolicy();
    }

    // ==================== REGISTRATION ====================

    /**
     * Register a fragment of trusted SQL.
     *
     * @param fragment SQL written in program source, never built from input
     * @return the fragment's token, with a leading and a trailing space
     * @throws eu.okaeri.owsql.provenance.ProvenanceRejectedException when the fragment was produced at runtime
     * @throws MalformedFragmentException                            when the fragment leaves a quote or comment open
     */
    public String ow(@CompileTimeConstant @NonNull String fragment) {

        if (this.verifier != null) {
            this.verifier.verify(fragment);
        }

        if (this.scanner.scan(fragment).isOpenEnded()) {
            throw new MalformedFragmentException(this.errorLevel.message("Fragment is malformed",
                "unterminated quote or comment would swallow the text that follows", fragment));
        }

        return pad(this.registry.register(fragment));
    }

    /**
     * Allow values to be emitted through {@link #allowlist(Object)}. Values may come
     * from anywhere; they are stored as quoted literals.
     */
    public void addAllowlist(@NonNull Object... values) {
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("allowlisted value cannot be null");
            }
            String text = String.valueOf(value);
            this.registry.allow(text, this.getDialect().quote(text));
        }
    }

    public boolean isAllowlisted(Object value) {
        return (value != null) && this.registry.isAllowed(String.valueOf(value));
    }

    /**
     * @return padded token standing for the quoted value
     * @throws RejectedValueException when the value was not allowlisted
     * @throws IllegalArgumentException when the value is null
     */
    public String allowlist(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("allowlisted value cannot be null");
        }
        String text = String.valueOf(value);
        return this.registry.findAllowed(text)
            .map(OwsqlConnection::pad)
            .orElseThrow(() -> new RejectedValueException(this.errorLevel.message("Value is not allowlisted",
                "not added with addAllowlist", text)));
    }

    /**
     * Emit a signed 64-bit integer as an unquoted number.
     *
     * @return padded token standing for the canonical decimal text
     * @throws RejectedValueException when the value is not an integer in range
     */
    public String integer(Object value) {

        String text = String.valueOf(value).trim();
        long parsed;
        try {
            BigInteger number = new BigInteger(text);
            if ((number.compareTo(LONG_MIN) < 0) || (number.compareTo(LONG_MAX) > 0)) {
                throw new RejectedValueException(this.errorLevel.message("Value is not an integer",
                    "outside of the signed 64-bit range", text));
            }
            parsed = number.longValueExact();
        } catch (NumberFormatException exception) {
            throw new RejectedValueException(this.errorLevel.message("Value is not an integer",
                "expected optional sign followed by decimal digits", text), exception);
        }

        return pad(this.registry.register(Long.toString(parsed)));
    }

    // ==================== RECONSTRUCTION ====================

    /**
     * Statement that would be executed for the composed text. Never throws for
     * non-null input and never validates.
     */
    public String actualSql(@NonNull String composed) {
        return this.reconstructor.reconstruct(composed);
    }

    public List<ParsedSegment> segments(@NonNull String composed) {
        return Collections.unmodifiableList(this.reconstructor.segment(composed));
    }

    // ==================== EXECUTION ====================

    public void execute(@NonNull String composed) {
        this.driver.execute(this.prepare(composed));
    }

    /**
     * Run the statement and pass its rows to the callback until it returns false.
     */
    public void iterate(@NonNull String composed, @NonNull RowCallback callback) {
        this.driver.iterate(this.prepare(composed), callback);
    }

    public List<Row> rows(@NonNull String composed) {
        List<Row> rows = new ArrayList<>();
        this.driver.iterate(this.prepare(composed), row -> {
            rows.add(row);
            return true;
        });
        return rows;
    }

    private String prepare(String composed) {
        String sql = this.debugQuery(this.reconstructor.reconstruct(composed));
        this.validator.validate(sql);
        return sql;
    }

    private String debugQuery(@NonNull String sql) {
        if (DEBUG) {
            System.out.println("[" + this.getDialect().getName() + "] " + sql);
        }
        return sql;
    }

    // ==================== LIFECYCLE ====================

    public int getTrustedFragmentCount() {
        return this.registry.size();
    }

    /**
     * Drop every registered fragment and allowlist binding. Text composed earlier is
     * still accepted, its tokens are then quoted as data.
     */
    public void clearTrustedFragments() {
        int count = this.registry.size();
        this.registry.clear();
        LOGGER.fine("Cleared " + count + " trusted fragments");
    }

    @Override
    public void close() throws IOException {
        this.registry.clear();
        this.driver.close();
    }

    private static String pad(String token) {
        return " " + token + " ";
    }

    public static class Builder {
        private SqlDriver driver;
        private String tokenPrefix = TokenGenerator.DEFAULT_PREFIX;
        private int tokenLength = TokenGenerator.MINIMUM_LENGTH;
        private SecurityPolicy securityPolicy = SecurityPolicy.defaults();
        private ErrorLevel errorLevel;
        private boolean verifyProvenance = true;
        private int registryWarningThreshold = 10_000;

        public Builder driver(@NonNull SqlDriver driver) {
            this.driver = driver;
            return this;
        }

        /**
         * @param tokenPrefix letters and underscores only
         */
        public Builder tokenPrefix(@NonNull String tokenPrefix) {
            this.tokenPrefix = tokenPrefix;
            return this;
        }

        /**
         * @param tokenLength random suffix length, raised to {@link TokenGenerator#MINIMUM_LENGTH} when smaller
         */
        public Builder tokenLength(int tokenLength) {
            this.tokenLength = tokenLength;
            return this;
        }

        public Builder securityPolicy(@NonNull SecurityPolicy securityPolicy) {
            this.securityPolicy = securityPolicy;
            return this;
        }

        public Builder errorLevel(@NonNull ErrorLevel errorLevel) {
            this.errorLevel = errorLevel;
            return this;
        }

        /**
         * Runtime check of fragment origin in {@link OwsqlConnection#ow(String)}.
         * Turn off only where Error Prone enforces {@link CompileTimeConstant} at build time.
         */
        public Builder verifyProvenance(boolean verifyProvenance) {
            this.verifyProvenance = verifyProvenance;
            return this;
        }

        /**
         * @param registryWarningThreshold fragment count above which a warning is logged once, 0 to disable
         */
        public Builder registryWarningThreshold(int registryWarningThreshold) {
            this.registryWarningThreshold = registryWarningThreshold;
            return this;
        }

        public OwsqlConnection build() {
            if (this.driver == null) {
                throw new IllegalStateException("driver is required");
            }
            if (this.registryWarningThreshold < 0) {
                throw new IllegalStateException("registryWarningThreshold cannot be negative");
            }
            ErrorLevel level = (this.errorLevel != null) ? this.errorLevel : ErrorLevel.fromSystemProperty();
            TrustRegistry registry = new TrustRegistry(new TokenGenerator(this.tokenPrefix, this.tokenLength), this.registryWarningThreshold);
            return new OwsqlConnection(this.driver, registry, this.securityPolicy, level, this.verifyProvenance);
        }
    }
}
