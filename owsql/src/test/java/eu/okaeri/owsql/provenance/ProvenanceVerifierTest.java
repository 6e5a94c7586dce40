package eu.okaeri.owsql.provenance;

import eu.okaeri.owsql.ErrorLevel;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvenanceVerifierTest {

    private static final String COLUMNS = "id, name";

    private final ProvenanceVerifier verifier = new ProvenanceVerifier(Set.of(), ErrorLevel.DEVELOP);

    @Test
    void literal_is_accepted() {
        assertThatCode(() -> this.verifier.verify("SELECT name FROM users WHERE"))
            .doesNotThrowAnyException();
    }

    @Test
    void constant_field_is_accepted() {
        assertThatCode(() -> this.verifier.verify(COLUMNS)).doesNotThrowAnyException();
    }

    @Test
    void folded_constant_expression_is_accepted() {
        assertThatCode(() -> this.verifier.verify("SELECT " + COLUMNS + " FROM users"))
            .doesNotThrowAnyException();
    }

    @Test
    void runtime_concatenation_is_rejected() {
        int age = Integer.parseInt("50");

        assertThatThrownBy(() -> this.verifier.verify("SELECT name FROM users WHERE age < " + age))
            .isInstanceOf(ProvenanceRejectedException.class)
            .hasMessageContaining("Fragment is not fixed in program source")
            .hasMessageContaining(ProvenanceVerifierTest.class.getName());
    }

    @Test
    void runtime_copy_of_constant_is_rejected() {
        String copy = new String("SELECT 1");

        assertThat(copy).isEqualTo("SELECT 1");
        assertThatThrownBy(() -> this.verifier.verify(copy))
            .isInstanceOf(ProvenanceRejectedException.class)
            .hasMessageContaining("runtime copy");
    }

    @Test
    void built_string_is_rejected() {
        String built = new StringBuilder("DELETE FROM ").append("users").toString();

        assertThatThrownBy(() -> this.verifier.verify(built))
            .isInstanceOf(ProvenanceRejectedException.class);
    }

    @Test
    void internal_classes_are_skipped_when_finding_caller() {
        ProvenanceVerifier throughFacade = new ProvenanceVerifier(Set.of(Facade.class), ErrorLevel.DEVELOP);

        // the constant lives in this class, not in Facade
        assertThatCode(() -> new Facade(throughFacade).register("SELECT email FROM users"))
            .doesNotThrowAnyException();
    }

    @Test
    void non_internal_intermediate_becomes_caller() {
        ProvenanceVerifier direct = new ProvenanceVerifier(Set.of(), ErrorLevel.DEVELOP);

        assertThatThrownBy(() -> new Facade(direct).register("SELECT phone FROM users"))
            .isInstanceOf(ProvenanceRejectedException.class)
            .hasMessageContaining(Facade.class.getName());
    }

    @Test
    void release_level_hides_details() {
        ProvenanceVerifier release = new ProvenanceVerifier(Set.of(), ErrorLevel.RELEASE);
        String copy = new String("SELECT 1");

        assertThatThrownBy(() -> release.verify(copy))
            .isInstanceOf(ProvenanceRejectedException.class)
            .hasMessage("Fragment is not fixed in program source");
    }

    @Test
    void debug_level_echoes_value() {
        ProvenanceVerifier debug = new ProvenanceVerifier(Set.of(), ErrorLevel.DEBUG);
        String value = "SELECT " + System.nanoTime();

        assertThatThrownBy(() -> debug.verify(value))
            .isInstanceOf(ProvenanceRejectedException.class)
            .hasMessageContaining(value);
    }

    static class Facade {

        private final ProvenanceVerifier verifier;

        Facade(ProvenanceVerifier verifier) {
            this.verifier = verifier;
        }

        void register(String fragment) {
            this.verifier.verify(fragment);
        }
    }
}
