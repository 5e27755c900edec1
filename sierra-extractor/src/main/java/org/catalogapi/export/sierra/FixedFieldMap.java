package org.catalogapi.export.sierra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat, insertion-ordered, read-only map of fixed-field attribute names to values. Null values
 * are allowed and mean "known attribute, no value", which is different from an absent key.
 */
public final class FixedFieldMap {
    private final Map<String, Object> values;

    private FixedFieldMap(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FixedFieldMap of(Map<String, ?> values) {
        var builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public boolean containsKey(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        var value = values.get(name);
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String name) {
        var value = values.get(name);
        return value == null ? List.of() : (List<T>) value;
    }

    public Set<String> keySet() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FixedFieldMap && values.equals(((FixedFieldMap) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        /**
         * Lists are copied, so later changes to the caller's list do not reach the map.
         */
        public Builder put(String name, Object value) {
            values.put(name, value instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) value)) : value);
            return this;
        }

        public FixedFieldMap build() {
            return new FixedFieldMap(values);
        }
    }
}
