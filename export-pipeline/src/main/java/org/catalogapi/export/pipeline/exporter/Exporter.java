package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.RelationHints;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

/**
 * One export job's extract-transform-load steps. A runner calls {@link #getRecords} and
 * {@link #getDeletions} once, then {@link #exportRecords} and {@link #deleteRecords} once per
 * chunk, then {@link #compileVals} over every chunk result, then {@link #finalCallback} exactly
 * once.
 *
 * Chunk results ("vals") are maps; by convention lists of record ids keyed by what happened to
 * them.
 */
public interface Exporter<R> {

    ExportJob getJob();

    List<R> getRecords();

    List<DeletionRecord> getDeletions();

    Map<String, Object> exportRecords(List<R> batch);

    Map<String, Object> deleteRecords(List<DeletionRecord> batch);

    /** Merges chunk results. Null results are skipped. */
    default Map<String, Object> compileVals(List<Map<String, Object>> results) {
        return ValsMerger.compile(results);
    }

    void finalCallback(Map<String, Object> vals, ExportStatus status);

    RelationHints getRelationHints();
}
