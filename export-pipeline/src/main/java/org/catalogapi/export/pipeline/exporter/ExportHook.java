package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.status.ExportJob;

/** What a {@link StandardExporter} does with one chunk of records. */
@FunctionalInterface
public interface ExportHook<R> {

    Map<String, Object> exportRecords(List<R> batch, ExportJob job);
}
