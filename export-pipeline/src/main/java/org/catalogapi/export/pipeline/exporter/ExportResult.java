package org.catalogapi.export.pipeline.exporter;

import java.util.Map;

import org.catalogapi.export.pipeline.status.ExportStatus;

/** Final status of a job and its compiled results. */
public record ExportResult(ExportStatus status, Map<String, Object> vals) {}
