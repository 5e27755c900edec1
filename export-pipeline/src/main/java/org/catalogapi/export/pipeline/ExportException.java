package org.catalogapi.export.pipeline;

/**
 * Base of the export error taxonomy. All export errors are unchecked.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
