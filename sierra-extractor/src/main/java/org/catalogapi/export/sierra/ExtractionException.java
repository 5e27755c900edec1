package org.catalogapi.export.sierra;

/**
 * A source record is missing data the extractor cannot do without.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
