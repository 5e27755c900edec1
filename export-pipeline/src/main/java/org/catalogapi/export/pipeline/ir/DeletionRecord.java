package org.catalogapi.export.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record the source reports as deleted. {@code attributes} are what deletion filter groups
 * are matched against, e.g. the record type code and deletion date.
 */
public record DeletionRecord(String recordId, Map<String, Object> attributes) {

    public DeletionRecord {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DeletionRecord of(String recordId) {
        return new DeletionRecord(recordId, Map.of());
    }
}
