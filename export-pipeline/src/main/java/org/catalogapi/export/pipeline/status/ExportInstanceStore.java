package org.catalogapi.export.pipeline.status;

import java.util.Optional;

/**
 * Port for persisting export job status.
 */
public interface ExportInstanceStore {

    /** Saves a copy of the instance, assigning an id when it has none. Returns the saved copy. */
    ExportInstance save(ExportInstance instance);

    Optional<ExportInstance> findById(long id);

    /** Latest instance of the type whose status is success or done_with_errors. */
    Optional<ExportInstance> findLatestCompleted(String exportType);

    /**
     * Records a status by its code. Unknown codes are stored as
     * {@link ExportStatus#UNKNOWN}.
     */
    default ExportInstance updateStatus(long id, String statusCode) {
        var instance = findById(id).orElseThrow(() -> new IllegalArgumentException("No export instance " + id));
        instance.setStatus(ExportStatus.fromCode(statusCode));
        return save(instance);
    }
}
