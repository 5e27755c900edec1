package org.catalogapi.export.pipeline.exporter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ExportException;
import org.catalogapi.export.pipeline.SourceReadException;
import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.DeletionSource;
import org.catalogapi.export.pipeline.source.FilterGroups;
import org.catalogapi.export.pipeline.source.RecordQuery;
import org.catalogapi.export.pipeline.source.RecordSource;
import org.catalogapi.export.pipeline.source.RelationHints;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * An Exporter assembled from a record source and hooks. What varies between export types is
 * which source, filters and hooks are plugged in; leaving a hook out makes that step a no-op.
 */
@Slf4j
@Builder
public class StandardExporter<R> implements Exporter<R> {
    @Getter
    @NonNull
    private final ExportJob job;
    @NonNull
    private final RecordSource<R> recordSource;
    /** Only needed when a deletion filter is set. */
    private final DeletionSource deletionSource;
    /** Base filter on top of the job's export filter; null matches everything. */
    private final FilterGroups recordFilter;
    /** Null means the export type never deletes. */
    private final FilterGroups deletionFilter;
    private final RelationHints relationHints;
    private final ExportHook<R> exportHook;
    private final DeleteHook deleteHook;
    private final FinalCallbackHook finalCallbackHook;
    /** Treat an empty record set as a source failure. */
    private final boolean failOnZero;

    @Override
    public List<R> getRecords() {
        return getRecords(getRelationHints());
    }

    /**
     * Fetches the job's records using the given hints instead of this exporter's own; compound
     * exporters pass the hints of all their children.
     */
    public List<R> getRecords(RelationHints hints) {
        var query = RecordQuery.builder()
            .exportFilter(job.getExportFilter())
            .options(optionsWith(false))
            .filterGroups(recordFilter == null ? FilterGroups.matchAll() : recordFilter)
            .relationHints(hints)
            .build();
        List<R> records;
        try {
            records = recordSource.fetch(query);
        } catch (ExportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("Reading records for export filter " + job.getExportFilter() + " failed", e);
        }
        log.atInfo().setMessage("Export filter {} matched {} records")
            .addArgument(job::getExportFilter)
            .addArgument(records::size)
            .log();
        if (records.isEmpty() && failOnZero) {
            throw new SourceReadException("Export filter " + job.getExportFilter() + " matched no records");
        }
        return records;
    }

    @Override
    public List<DeletionRecord> getDeletions() {
        if (deletionFilter == null) {
            return List.of();
        }
        if (deletionSource == null) {
            throw new IllegalStateException("A deletion filter is set but there is no deletion source");
        }
        var query = RecordQuery.builder()
            .exportFilter(job.getExportFilter())
            .options(optionsWith(true))
            .filterGroups(deletionFilter)
            .build();
        try {
            return deletionSource.fetchDeletions(query);
        } catch (ExportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("Reading deletions for export filter " + job.getExportFilter() + " failed", e);
        }
    }

    @Override
    public Map<String, Object> exportRecords(List<R> batch) {
        return exportHook == null ? Map.of() : exportHook.exportRecords(batch, job);
    }

    @Override
    public Map<String, Object> deleteRecords(List<DeletionRecord> batch) {
        return deleteHook == null ? Map.of() : deleteHook.deleteRecords(batch, job);
    }

    @Override
    public void finalCallback(Map<String, Object> vals, ExportStatus status) {
        if (finalCallbackHook != null) {
            finalCallbackHook.finalCallback(vals, status, job);
        }
    }

    @Override
    public RelationHints getRelationHints() {
        return relationHints == null ? RelationHints.NONE : relationHints;
    }

    private Map<String, Object> optionsWith(boolean isDeletion) {
        var options = new LinkedHashMap<String, Object>(job.getOptions());
        options.put(RecordQuery.IS_DELETION, isDeletion);
        return options;
    }
}
