package org.catalogapi.export.pipeline.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The named outputs of one {@link RecordConverter} run, in table order. Values may be null.
 * Intermediate records and index documents are both ConvertedRecords.
 */
public final class ConvertedRecord {
    private final Map<String, Object> values;

    public ConvertedRecord(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean containsKey(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        var value = values.get(name);
        if (value != null && !type.isInstance(value)) {
            throw new IllegalStateException("Field " + name + " is a " + value.getClass().getSimpleName()
                + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
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

    /** A copy with one more (or one replaced) field. */
    public ConvertedRecord with(String name, Object value) {
        var copy = new LinkedHashMap<String, Object>(values);
        copy.put(name, value);
        return new ConvertedRecord(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConvertedRecord && values.equals(((ConvertedRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
