package org.catalogapi.export.pipeline;

/**
 * The record or deletion source could not be queried.
 */
public class SourceReadException extends ExportException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
