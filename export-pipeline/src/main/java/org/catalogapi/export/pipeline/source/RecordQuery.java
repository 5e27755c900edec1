package org.catalogapi.export.pipeline.source;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a source needs to select the records of one export job.
 */
@Value
@Builder
public class RecordQuery {
    public static final String IS_DELETION = "is_deletion";
    public static final String LATEST_TIME = "latest_time";

    /** Name of the export-specific filter, e.g. "full_export" or "last_export". */
    @NonNull
    String exportFilter;

    /** Job options, including {@link #IS_DELETION} and, when known, {@link #LATEST_TIME}. */
    @Builder.Default
    Map<String, Object> options = Map.of();

    /** Base filter applied on top of the export filter. */
    @Builder.Default
    FilterGroups filterGroups = FilterGroups.matchAll();

    @Builder.Default
    RelationHints relationHints = RelationHints.NONE;

    public boolean isDeletion() {
        return Boolean.TRUE.equals(options.get(IS_DELETION));
    }

    public Object option(String name) {
        return options.get(name);
    }
}
