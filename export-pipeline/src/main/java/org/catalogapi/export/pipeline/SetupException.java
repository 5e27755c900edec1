package org.catalogapi.export.pipeline;

/**
 * The job cannot start: a filter or setting cannot be resolved. Fatal for the whole job.
 */
public class SetupException extends ExportException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
