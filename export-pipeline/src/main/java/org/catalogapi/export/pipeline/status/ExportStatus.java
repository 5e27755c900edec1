package org.catalogapi.export.pipeline.status;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle of an export job: waiting, running, then success, done_with_errors or error.
 */
@Slf4j
public enum ExportStatus {
    WAITING("waiting"),
    RUNNING("running"),
    SUCCESS("success"),
    /** Finished, but at least one record, chunk or sink call failed. */
    DONE_WITH_ERRORS("done_with_errors"),
    /** Could not get past setup. */
    ERROR("error"),
    UNKNOWN("unknown");

    @Getter
    private final String code;

    ExportStatus(String code) {
        this.code = code;
    }

    /**
     * The status for a persisted code. Codes this version does not know become {@link #UNKNOWN}
     * rather than failing the caller.
     */
    public static ExportStatus fromCode(String code) {
        for (var status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        log.warn("Unrecognized export status code '{}'; recording it as unknown", code);
        return UNKNOWN;
    }

    public boolean isCompleted() {
        return this == SUCCESS || this == DONE_WITH_ERRORS;
    }
}
