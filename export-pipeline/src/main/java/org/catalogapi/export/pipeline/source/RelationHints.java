package org.catalogapi.export.pipeline.source;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Relation paths a record source should load along with each record. Advisory; a source is free
 * to ignore them.
 */
public record RelationHints(List<String> selectRelated, List<String> prefetchRelated) {
    public static final RelationHints NONE = new RelationHints(List.of(), List.of());

    public RelationHints {
        selectRelated = List.copyOf(selectRelated);
        prefetchRelated = List.copyOf(prefetchRelated);
    }

    /**
     * These hints with every path placed under {@code prefix}. A null or empty prefix leaves the
     * paths alone.
     */
    public RelationHints withPrefix(String prefix) {
        return new RelationHints(prefixed(selectRelated, prefix), prefixed(prefetchRelated, prefix));
    }

    /** Union of both hint lists, in order, without duplicates. */
    public RelationHints union(RelationHints other) {
        return new RelationHints(merge(selectRelated, other.selectRelated), merge(prefetchRelated, other.prefetchRelated));
    }

    static List<String> prefixed(List<String> paths, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return paths;
        }
        var result = new ArrayList<String>(paths.size());
        paths.forEach(p -> result.add(prefix + "__" + p));
        return result;
    }

    static List<String> merge(List<String> first, List<String> second) {
        var merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
