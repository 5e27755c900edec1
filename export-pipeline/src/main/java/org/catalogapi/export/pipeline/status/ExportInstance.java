package org.catalogapi.export.pipeline.status;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The persisted status record of one export job.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExportInstance {
    /**
     * Assigned by the store on first save
     */
    private Long id;

    private String exportType;

    private String exportFilter;

    @Builder.Default
    private ExportStatus status = ExportStatus.WAITING;

    /**
     * When the job was created; "last_export" jobs select records changed since the latest
     * completed instance's timestamp
     */
    private Instant timestamp;

    private int warnings;

    private int errors;
}
