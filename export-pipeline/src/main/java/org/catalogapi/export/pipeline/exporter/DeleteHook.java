package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.status.ExportJob;

/** What a {@link StandardExporter} does with one chunk of deletions. */
@FunctionalInterface
public interface DeleteHook {

    Map<String, Object> deleteRecords(List<DeletionRecord> batch, ExportJob job);
}
