package org.catalogapi.export.pipeline.exporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges chunk results: maps merge key by key, lists with the same key concatenate in order, and
 * for anything else the later non-null value wins. Inputs are never modified.
 *
 * Merging is associative as long as a key holds the same kind of value (map, list or scalar) in
 * every result.
 */
public final class ValsMerger {

    private ValsMerger() {}

    public static Map<String, Object> compile(List<? extends Map<String, ?>> results) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (results == null) {
            return merged;
        }
        for (var result : results) {
            if (result != null) {
                merged = merge(merged, result);
            }
        }
        return merged;
    }

    public static Map<String, Object> merge(Map<String, ?> left, Map<String, ?> right) {
        var merged = new LinkedHashMap<String, Object>(left);
        for (var entry : right.entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue();
            var existing = merged.get(key);
            if (existing instanceof Map && value instanceof Map) {
                merged.put(key, merge(asStringMap(existing), asStringMap(value)));
            } else if (existing instanceof List && value instanceof List) {
                var concatenated = new ArrayList<Object>((List<?>) existing);
                concatenated.addAll((List<?>) value);
                merged.put(key, concatenated);
            } else if (value != null || !merged.containsKey(key)) {
                merged.put(key, value);
            }
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asStringMap(Object value) {
        return (Map<String, ?>) value;
    }
}
