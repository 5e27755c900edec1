package org.catalogapi.export.pipeline.exporter;

import java.util.Map;

import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

/** Runs once when every chunk of a job is done; typically commits the sink. */
@FunctionalInterface
public interface FinalCallbackHook {

    void finalCallback(Map<String, Object> vals, ExportStatus status, ExportJob job);
}
