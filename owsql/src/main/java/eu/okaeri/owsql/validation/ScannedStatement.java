package eu.okaeri.owsql.validation;

import eu.okaeri.owsql.dialect.SqlDialect;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A statement split into structure, literal and quoted identifier spans.
 */
@Getter
public class ScannedStatement {

    private final String sql;
    private final SqlDialect dialect;
    private final List<SqlSpan> spans;
    private final boolean openComment;

    public ScannedStatement(@NonNull String sql, @NonNull SqlDialect dialect, @NonNull List<SqlSpan> spans, boolean openComment) {
        this.sql = sql;
        this.dialect = dialect;
        this.spans = Collections.unmodifiableList(new ArrayList<>(spans));
        this.openComment = openComment;
    }

    public List<SqlSpan> getLiterals() {
        List<SqlSpan> literals = new ArrayList<>();
        for (SqlSpan span : this.spans) {
            if (span.isLiteral()) {
                literals.add(span);
            }
        }
        return literals;
    }

    /**
     * Literals that appear after some statement structure, i.e. values the statement
     * operates on. A statement made of nothing but a literal has none.
     */
    public List<SqlSpan> getOperandLiterals() {
        List<SqlSpan> operands = new ArrayList<>();
        boolean structureSeen = false;
        for (SqlSpan span : this.spans) {
            if (span.isLiteral() && structureSeen) {
                operands.add(span);
            } else if (!span.isLiteral() && !span.getText().isBlank()) {
                structureSeen = true;
            }
        }
        return operands;
    }

    public boolean hasStructure() {
        return this.spans.stream().anyMatch(span -> !span.isLiteral() && !span.getText().isBlank());
    }

    public boolean hasUnterminatedQuote() {
        return this.spans.stream().anyMatch(span -> !span.isTerminated());
    }

    /**
     * Whether text appended to this statement would land inside a quote or a comment.
     */
    public boolean isOpenEnded() {
        return this.openComment || this.hasUnterminatedQuote();
    }

    public Optional<SqlSpan> next(@NonNull SqlSpan span) {
        int index = this.spans.indexOf(span);
        if ((index < 0) || ((index + 1) >= this.spans.size())) {
            return Optional.empty();
        }
        return Optional.of(this.spans.get(index + 1));
    }
}
