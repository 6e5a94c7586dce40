package eu.okaeri.owsql;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single result row: column name to textual value, in column order.
 * Values are {@code null} for SQL NULL.
 */
@ToString
@EqualsAndHashCode
public final class Row {

    private final Map<String, String> values;

    private Row(Map<String, String> values) {
        this.values = values;
    }

    public static Row of(@NonNull Map<String, String> values) {
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(@NonNull String column) {
        return Optional.ofNullable(this.values.get(column));
    }

    public boolean hasColumn(@NonNull String column) {
        return this.values.containsKey(column);
    }

    public int getColumnCount() {
        return this.values.size();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(this.values.keySet());
    }

    public Map<String, String> asMap() {
        return this.values;
    }

    public static final class Builder {

        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(@NonNull String name, String value) {
            this.values.put(name, value);
            return this;
        }

        public Row build() {
            return Row.of(this.values);
        }
    }
}
