package org.catalogapi.export.pipeline.source;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.catalogapi.export.pipeline.ir.DeletionRecord;

/**
 * A DeletionSource over a fixed list of deletion records.
 */
public class InMemoryDeletionSource implements DeletionSource {
    private final List<DeletionRecord> deletions;

    public InMemoryDeletionSource(List<DeletionRecord> deletions) {
        this.deletions = new ArrayList<>(deletions);
    }

    @Override
    public List<DeletionRecord> fetchDeletions(RecordQuery query) {
        return deletions.stream()
            .filter(d -> query.getFilterGroups().matches(d.attributes()))
            .collect(Collectors.toList());
    }
}
