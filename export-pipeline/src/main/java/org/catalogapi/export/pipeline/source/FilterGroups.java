package org.catalogapi.export.pipeline.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A list of {@code {attribute: value}} groups. A record matches when it matches any group, and
 * it matches a group when every condition in the group holds.
 */
public final class FilterGroups {
    private static final FilterGroups MATCH_ALL = new FilterGroups(List.of(Map.of()));

    private final List<Map<String, Object>> groups;

    private FilterGroups(List<Map<String, Object>> groups) {
        this.groups = groups;
    }

    @SafeVarargs
    public static FilterGroups of(Map<String, Object>... groups) {
        return of(List.of(groups));
    }

    public static FilterGroups of(List<Map<String, Object>> groups) {
        return new FilterGroups(groups.stream()
            .map(group -> Collections.unmodifiableMap(new LinkedHashMap<String, Object>(group)))
            .collect(Collectors.toUnmodifiableList()));
    }

    /** One empty group; matches every record. */
    public static FilterGroups matchAll() {
        return MATCH_ALL;
    }

    public List<Map<String, Object>> getGroups() {
        return groups;
    }

    /** With no groups at all nothing matches. */
    public boolean matches(Map<String, ?> attributes) {
        return groups.stream().anyMatch(group -> group.entrySet().stream()
            .allMatch(condition -> attributes.containsKey(condition.getKey())
                && Objects.equals(attributes.get(condition.getKey()), condition.getValue())));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FilterGroups && groups.equals(((FilterGroups) o).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "FilterGroups" + groups;
    }
}
