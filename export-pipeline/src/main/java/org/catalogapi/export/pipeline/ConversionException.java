package org.catalogapi.export.pipeline;

import lombok.Getter;

/**
 * One record failed extraction or one of the conversion stages. The record is skipped and the
 * rest of its batch carries on.
 */
@Getter
public class ConversionException extends ExportException {
    /** Identifier of the failing source record, when known. */
    private final String recordId;
    /** Which stage failed, e.g. "intermediate" or "index". */
    private final String stage;

    public ConversionException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public ConversionException(String recordId, String stage, String message, Throwable cause) {
        super(describe(recordId, stage, message), cause);
        this.recordId = recordId;
        this.stage = stage;
    }

    private static String describe(String recordId, String stage, String message) {
        if (recordId == null && stage == null) {
            return message;
        }
        return "Record " + recordId + " failed at stage " + stage + ": " + message;
    }
}
