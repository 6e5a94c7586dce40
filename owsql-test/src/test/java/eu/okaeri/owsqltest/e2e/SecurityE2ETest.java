package eu.okaeri.owsqltest.e2e;

import eu.okaeri.owsql.OwsqlConnection;
import eu.okaeri.owsql.registry.MalformedFragmentException;
import eu.okaeri.owsql.validation.SecurityPatternException;
import eu.okaeri.owsqltest.containers.BackendContainer;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Escaping and rejection behaviour with hostile or awkward input on every backend.
 */
public class SecurityE2ETest extends E2ETestBase {

    private static final List<String> AWKWARD_VALUES = List.of(
        "O'Brien",
        "''",
        "back\\slash",
        "\\'",
        "trailing\\",
        "double \"quoted\"",
        "100%_done",
        "multi\nline",
        "zażółć 日本",
        "-- not a comment",
        "/* not */ a comment",
        "Robert'), ('Mallory', 99"
    );

    private static final List<String> ATTACK_VALUES = List.of(
        "alice' OR '1'='1",
        "x'; DROP TABLE users; --",
        "admin'--",
        "admin' /*",
        "' UNION SELECT name FROM users --",
        "1; DELETE FROM users",
        "1 OR 1=1",
        "alice\0"
    );

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void awkward_values_round_trip_verbatim(BackendTestContext btc) {
        OwsqlConnection owsql = btc.getOwsql();

        for (String value : AWKWARD_VALUES) {
            btc.insert(value, 99);

            assertThat(btc.names(owsql.ow("SELECT name FROM users WHERE name =") + value))
                .as(value)
                .containsExactly(value);
        }

        assertThat(btc.count()).isEqualTo(3 + AWKWARD_VALUES.size());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void attack_values_never_widen_results(BackendTestContext btc) {
        OwsqlConnection owsql = btc.getOwsql();

        for (String value : ATTACK_VALUES) {
            try {
                assertThat(btc.names(owsql.ow("SELECT name FROM users WHERE name =") + value)).as(value).isEmpty();
            } catch (SecurityPatternException rejected) {
                assertThat(rejected.getRule()).as(value).isNotBlank();
            }
            try {
                owsql.execute(owsql.ow("DELETE FROM users WHERE name =") + value);
            } catch (SecurityPatternException rejected) {
                assertThat(rejected.getRule()).as(value).isNotBlank();
            }
        }

        assertThat(btc.count()).isEqualTo(3);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void foreign_token_is_stored_as_text(BackendTestContext btc) throws Exception {
        OwsqlConnection owsql = btc.getOwsql();
        String foreign;
        try (OwsqlConnection other = btc.getBackend().createConnection()) {
            foreign = other.ow("DROP TABLE users").trim();
        }

        btc.insert(foreign, 99);

        assertThat(btc.names(owsql.ow("SELECT name FROM users WHERE age = 99"))).containsExactly(foreign);
        assertThat(btc.count()).isEqualTo(4);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void cleared_tokens_degrade_to_data(BackendTestContext btc) {
        OwsqlConnection owsql = btc.getOwsql();
        String stale = owsql.ow("DELETE FROM users");

        owsql.clearTrustedFragments();

        assertThat(owsql.actualSql(stale)).startsWith("'").endsWith("' ");
        assertThat(btc.count()).isEqualTo(3);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void allowlisted_value_matches_row(BackendTestContext btc) {
        OwsqlConnection owsql = btc.getOwsql();
        owsql.addAllowlist("alice", "bob");

        assertThat(btc.names(owsql.ow("SELECT name FROM users WHERE name =") + owsql.allowlist("bob")))
            .containsExactly("bob");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void dollar_quotes_stay_closed_on_postgres(BackendTestContext btc) {
        assumeTrue(btc.getBackend().getType() == BackendContainer.BackendType.POSTGRESQL);
        OwsqlConnection owsql = btc.getOwsql();

        assertThatThrownBy(() -> owsql.ow("SELECT name FROM users WHERE name = $$"))
            .isInstanceOf(MalformedFragmentException.class);
        assertThat(btc.names(owsql.ow("SELECT name FROM users WHERE name <> $q$it's$q$ AND name =") + "$$ OR true OR $$"))
            .isEmpty();
    }
}
