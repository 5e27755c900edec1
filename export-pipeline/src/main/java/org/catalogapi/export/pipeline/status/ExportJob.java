package org.catalogapi.export.pipeline.status;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One run of an export type: its filter, options and chunk sizes, plus the persisted status
 * record. Warnings and errors logged through the job also bump the persisted counters.
 */
@Slf4j
@Getter
public class ExportJob {
    private final ExportType exportType;
    private final Map<String, Object> options;
    private final int maxRecordChunk;
    private final int maxDeletionChunk;

    @Getter(AccessLevel.NONE)
    private final ExportInstanceStore store;
    @Getter(AccessLevel.NONE)
    private ExportInstance instance;

    public ExportJob(ExportType exportType, ExportInstance instance, Map<String, ?> options,
                     int maxRecordChunk, int maxDeletionChunk, ExportInstanceStore store) {
        this.exportType = exportType;
        this.instance = instance;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
        this.maxRecordChunk = maxRecordChunk;
        this.maxDeletionChunk = maxDeletionChunk;
        this.store = store;
    }

    public synchronized long getInstanceId() {
        return instance.getId();
    }

    public synchronized String getExportFilter() {
        return instance.getExportFilter();
    }

    public synchronized ExportStatus getStatus() {
        return instance.getStatus();
    }

    public synchronized int getWarnings() {
        return instance.getWarnings();
    }

    public synchronized int getErrors() {
        return instance.getErrors();
    }

    /** A copy of the current status record. */
    public synchronized ExportInstance snapshot() {
        return instance.toBuilder().build();
    }

    public synchronized void updateStatus(ExportStatus status) {
        log.atInfo().setMessage("Export {} #{} is now {}")
            .addArgument(exportType::name)
            .addArgument(instance::getId)
            .addArgument(status::getCode)
            .log();
        instance.setStatus(status);
        persist();
    }

    public synchronized void logWarning(String recordId, String stage, String message) {
        log.atWarn().setMessage("Export {} #{}: record {} at stage {}: {}")
            .addArgument(exportType::name)
            .addArgument(instance::getId)
            .addArgument(recordId)
            .addArgument(stage)
            .addArgument(message)
            .log();
        instance.setWarnings(instance.getWarnings() + 1);
        persist();
    }

    public synchronized void logError(String recordId, String stage, String message, Throwable cause) {
        log.atError().setMessage("Export {} #{}: record {} at stage {}: {}")
            .addArgument(exportType::name)
            .addArgument(instance::getId)
            .addArgument(recordId)
            .addArgument(stage)
            .addArgument(message)
            .setCause(cause)
            .log();
        instance.setErrors(instance.getErrors() + 1);
        persist();
    }

    private void persist() {
        instance = store.save(instance);
    }
}
