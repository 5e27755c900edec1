package org.catalogapi.export.pipeline.status;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.catalogapi.export.pipeline.SetupException;
import org.catalogapi.export.pipeline.config.ExportSettings;
import org.catalogapi.export.pipeline.source.RecordQuery;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates export jobs: resolves chunk sizes from settings, resolves the "last_export" filter to
 * a timestamp, and saves the new job's status record as waiting.
 */
@Slf4j
public class ExportJobFactory {
    public static final String LAST_EXPORT = "last_export";

    private final ExportInstanceStore store;
    private final ExportSettings settings;
    private final Clock clock;

    public ExportJobFactory(ExportInstanceStore store, ExportSettings settings) {
        this(store, settings, Clock.systemUTC());
    }

    public ExportJobFactory(ExportInstanceStore store, ExportSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @throws SetupException when the filter is "last_export" and no earlier job of the same type
     *                        completed
     */
    public ExportJob create(ExportType type, String exportFilter, Map<String, ?> options) {
        var jobOptions = new LinkedHashMap<String, Object>(options);
        jobOptions.putIfAbsent(RecordQuery.IS_DELETION, false);
        if (LAST_EXPORT.equals(exportFilter)) {
            var previous = store.findLatestCompleted(type.name())
                .orElseThrow(() -> new SetupException("Export type " + type.name()
                    + " has no completed run to export changes since"));
            jobOptions.put(RecordQuery.LATEST_TIME, previous.getTimestamp());
        }

        var instance = store.save(ExportInstance.builder()
            .exportType(type.name())
            .exportFilter(exportFilter)
            .status(ExportStatus.WAITING)
            .timestamp(clock.instant())
            .build());
        var job = new ExportJob(type, instance, jobOptions,
            settings.recordChunkFor(type), settings.deletionChunkFor(type), store);
        log.info("Created export {} #{} with filter {} (record chunk {}, deletion chunk {})",
            type.name(), instance.getId(), exportFilter, job.getMaxRecordChunk(), job.getMaxDeletionChunk());
        return job;
    }
}
