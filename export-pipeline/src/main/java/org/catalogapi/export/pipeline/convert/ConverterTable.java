package org.catalogapi.export.pipeline.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, read-only map of output field name to {@link FieldConverter}. Build a fresh table per
 * converter; tables are never shared defaults.
 */
public final class ConverterTable<I> {
    private final Map<String, FieldConverter<I>> converters;

    private ConverterTable(Map<String, FieldConverter<I>> converters) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
    }

    public static <I> Builder<I> builder() {
        return new Builder<>();
    }

    public Map<String, FieldConverter<I>> asMap() {
        return converters;
    }

    public Set<String> names() {
        return converters.keySet();
    }

    public int size() {
        return converters.size();
    }

    public static class Builder<I> {
        private final Map<String, FieldConverter<I>> converters = new LinkedHashMap<>();

        public Builder<I> put(String name, FieldConverter<I> converter) {
            if (converters.containsKey(name)) {
                throw new IllegalArgumentException("Converter table already has an entry named " + name);
            }
            converters.put(name, converter);
            return this;
        }

        public ConverterTable<I> build() {
            return new ConverterTable<>(converters);
        }
    }
}
