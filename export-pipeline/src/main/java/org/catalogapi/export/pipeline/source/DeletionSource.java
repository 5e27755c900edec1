package org.catalogapi.export.pipeline.source;

import java.util.List;

import org.catalogapi.export.pipeline.ir.DeletionRecord;

/**
 * Port for reading deletion candidates. Only the query's filter groups select what comes back.
 */
public interface DeletionSource {

    List<DeletionRecord> fetchDeletions(RecordQuery query);
}
