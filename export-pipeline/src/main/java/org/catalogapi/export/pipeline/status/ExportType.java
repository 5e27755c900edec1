package org.catalogapi.export.pipeline.status;

/**
 * A kind of export job with its default chunk sizes. Settings may override the sizes.
 */
public record ExportType(String name, int maxRecordChunk, int maxDeletionChunk) {
    public static final int DEFAULT_RECORD_CHUNK = 1000;
    public static final int DEFAULT_DELETION_CHUNK = 2000;

    public ExportType {
        if (maxRecordChunk <= 0 || maxDeletionChunk <= 0) {
            throw new IllegalArgumentException("Chunk sizes must be positive for export type " + name);
        }
    }

    public static ExportType of(String name) {
        return new ExportType(name, DEFAULT_RECORD_CHUNK, DEFAULT_DELETION_CHUNK);
    }
}
