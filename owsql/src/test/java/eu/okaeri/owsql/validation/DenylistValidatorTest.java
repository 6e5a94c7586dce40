package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.ErrorLevel;
import eu.okaeri.owsql.dialect.SqlDialect;
import eu.okaeri.owsql.validation.rule.QuoteBreakoutRule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

class DenylistValidatorTest {

    private static DenylistValidator validator(SecurityPolicy policy, ErrorLevel level) {
        return new DenylistValidator(policy, new SqlScanner(SqlDialect.SQLITE), level);
    }

    @Test
    void clean_statement_passes() {
        assertThatCode(() -> validator(SecurityPolicy.defaults(), ErrorLevel.DEVELOP)
            .validate("SELECT name FROM users WHERE age < '50' "))
            .doesNotThrowAnyException();
    }

    @Test
    void bare_literal_statement_passes() {
        assertThatCode(() -> validator(SecurityPolicy.defaults(), ErrorLevel.DEVELOP)
            .validate("'DROP TABLE users' "))
            .doesNotThrowAnyException();
    }

    @Test
    void first_matching_rule_rejects() {
        // matches both STACKED_STATEMENT and TRAILING_COMMENT
        assertThatThrownBy(() -> validator(SecurityPolicy.defaults(), ErrorLevel.DEVELOP)
            .validate("SELECT name FROM users WHERE age < '50 or 1=1; --' "))
            .isInstanceOf(SecurityPatternException.class)
            .hasMessageContaining("Statement rejected by security policy")
            .hasMessageContaining("STACKED_STATEMENT")
            .asInstanceOf(type(SecurityPatternException.class))
            .extracting(SecurityPatternException::getRule)
            .isEqualTo("STACKED_STATEMENT");
    }

    @Test
    void release_level_does_not_echo_statement() {
        assertThatThrownBy(() -> validator(SecurityPolicy.defaults(), ErrorLevel.RELEASE)
            .validate("SELECT * FROM users WHERE name = 'x'' OR ''1''=''1' "))
            .isInstanceOf(SecurityPatternException.class)
            .hasMessage("Statement rejected by security policy")
            .asInstanceOf(type(SecurityPatternException.class))
            .extracting(SecurityPatternException::getRule)
            .isEqualTo(QuoteBreakoutRule.NAME);
    }

    @Test
    void debug_level_echoes_statement() {
        String sql = "SELECT * FROM users WHERE name = 'x'' OR ''1''=''1' ";

        assertThatThrownBy(() -> validator(SecurityPolicy.defaults(), ErrorLevel.DEBUG).validate(sql))
            .isInstanceOf(SecurityPatternException.class)
            .hasMessageContaining(sql);
    }

    @Test
    void permissive_policy_accepts_anything() {
        assertThatCode(() -> validator(SecurityPolicy.permissive(), ErrorLevel.DEVELOP)
            .validate("SELECT * FROM users WHERE name = 'x''; DROP TABLE users; --' "))
            .doesNotThrowAnyException();
    }

    @Test
    void disabled_rule_is_skipped() {
        SecurityPolicy policy = SecurityPolicy.defaults().toBuilder().without(QuoteBreakoutRule.NAME).build();

        assertThatCode(() -> validator(policy, ErrorLevel.DEVELOP)
            .validate("SELECT * FROM users WHERE name = 'x'' OR ''1''=''1' "))
            .doesNotThrowAnyException();
    }
}
