package org.catalogapi.export.pipeline;

/**
 * An add, delete or commit against the index failed.
 */
public class SinkWriteException extends ExportException {

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
