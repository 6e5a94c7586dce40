package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.validation.rule.CommentAfterLiteralRule;
import eu.okaeri.owsql.validation.rule.NullByteRule;
import eu.okaeri.owsql.validation.rule.QuoteBreakoutRule;
import eu.okaeri.owsql.validation.rule.StackedStatementRule;
import eu.okaeri.owsql.validation.rule.TrailingCommentRule;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of rules applied to statements before execution.
 * The first matching rule rejects the statement.
 * <p>
 * Example:
 * <pre>
 * SecurityPolicy.defaults().toBuilder()
 *     .without(QuoteBreakoutRule.NAME)
 *     .rule(new MyRule())
 *     .build();
 * </pre>
 */
public final class SecurityPolicy {

    @Getter private final List<SecurityRule> rules;

    private SecurityPolicy(List<SecurityRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static SecurityPolicy defaults() {
        return builder()
            .rule(new NullByteRule())
            .rule(new StackedStatementRule())
            .rule(new QuoteBreakoutRule())
            .rule(new TrailingCommentRule())
            .rule(new CommentAfterLiteralRule())
            .build();
    }

    /**
     * No rules: every statement passes validation.
     */
    public static SecurityPolicy permissive() {
        return new SecurityPolicy(Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.rules.addAll(this.rules);
        return builder;
    }

    @Override
    public String toString() {
        return "SecurityPolicy" + this.rules;
    }

    public static final class Builder {

        private final List<SecurityRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder rule(@NonNull SecurityRule rule) {
            if (this.rules.stream().anyMatch(existing -> existing.getName().equals(rule.getName()))) {
                throw new IllegalArgumentException("Duplicate security rule: " + rule.getName());
            }
            this.rules.add(rule);
            return this;
        }

        public Builder without(@NonNull String name) {
            this.rules.removeIf(rule -> rule.getName().equals(name));
            return this;
        }

        public SecurityPolicy build() {
            return new SecurityPolicy(this.rules);
        }
    }
}
