package org.catalogapi.export.pipeline.exporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.catalogapi.export.pipeline.ConversionException;
import org.catalogapi.export.pipeline.SinkWriteException;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;
import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.ir.RecordIdentifier;
import org.catalogapi.export.pipeline.sink.IndexSink;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Hooks that load records into an {@link IndexSink}.
 *
 * A record that fails conversion is logged against the job and left out of its chunk. A sink
 * failure is logged against the job and the affected ids are reported as failed; it never
 * propagates. Writes always pass {@code commit = false}; the final callback commits.
 *
 * Results have the form {@code {"exported": [ids], "deleted": [ids], "failed": [ids]}}.
 */
@Slf4j
@Builder
public class IndexExportHooks<R> implements ExportHook<R>, DeleteHook, FinalCallbackHook {
    public static final String EXPORTED = "exported";
    public static final String DELETED = "deleted";
    public static final String FAILED = "failed";

    static final String CONVERT_STAGE = "convert";
    static final String SINK_ADD_STAGE = "sink add";
    static final String SINK_DELETE_STAGE = "sink delete";
    static final String SINK_COMMIT_STAGE = "sink commit";

    @NonNull
    private final IndexSink sink;
    @NonNull
    private final Function<? super R, ConvertedRecord> converter;
    /** Identifies a source record in logs and results. */
    @NonNull
    private final Function<? super R, String> recordId;
    /**
     * When set together with {@link #resourceType}, index ids are qualified as
     * {@code prefix.resourceType.recordId} for deletes; the converter must put the same id in
     * the documents it builds.
     */
    private final String idPrefix;
    private final String resourceType;

    @Override
    public Map<String, Object> exportRecords(List<R> batch, ExportJob job) {
        var documents = new ArrayList<ConvertedRecord>(batch.size());
        var exported = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (var record : batch) {
            var id = recordId.apply(record);
            try {
                documents.add(converter.apply(record));
                exported.add(id);
            } catch (ConversionException e) {
                job.logError(id, e.getStage() == null ? CONVERT_STAGE : e.getStage(), e.getMessage(), e);
                failed.add(id);
            } catch (RuntimeException e) {
                job.logError(id, CONVERT_STAGE, e.getMessage(), e);
                failed.add(id);
            }
        }
        if (!documents.isEmpty()) {
            try {
                sink.add(documents, false);
            } catch (SinkWriteException e) {
                job.logError(String.join(",", exported), SINK_ADD_STAGE, e.getMessage(), e);
                failed.addAll(exported);
                exported.clear();
            }
        }
        return vals(EXPORTED, exported, failed);
    }

    @Override
    public Map<String, Object> deleteRecords(List<DeletionRecord> batch, ExportJob job) {
        var deleted = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (var deletion : batch) {
            var id = indexId(deletion.recordId());
            try {
                sink.delete(id, false);
                deleted.add(deletion.recordId());
            } catch (SinkWriteException e) {
                job.logError(deletion.recordId(), SINK_DELETE_STAGE, e.getMessage(), e);
                failed.add(deletion.recordId());
            }
        }
        return vals(DELETED, deleted, failed);
    }

    @Override
    public void finalCallback(Map<String, Object> vals, ExportStatus status, ExportJob job) {
        log.atDebug().setMessage("Committing index after export #{} finished as {}")
            .addArgument(job::getInstanceId)
            .addArgument(status::getCode)
            .log();
        try {
            sink.commit();
        } catch (SinkWriteException e) {
            job.logError(null, SINK_COMMIT_STAGE, e.getMessage(), e);
        }
    }

    /** The id the index knows a record by. */
    public String indexId(String sourceRecordId) {
        if (idPrefix == null || resourceType == null) {
            return sourceRecordId;
        }
        return RecordIdentifier.qualified(idPrefix, resourceType, sourceRecordId);
    }

    private static Map<String, Object> vals(String key, List<String> done, List<String> failed) {
        var vals = new LinkedHashMap<String, Object>();
        vals.put(key, done);
        vals.put(FAILED, failed);
        return vals;
    }
}
