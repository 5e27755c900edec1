package org.catalogapi.export.pipeline.sink;

import java.util.List;

import org.catalogapi.export.pipeline.convert.ConvertedRecord;

/**
 * Port for writing index documents to any target (a Solr core, a test collector).
 *
 * Exporters always pass {@code commit = false} and commit once, from the final callback.
 * Failures surface as {@link org.catalogapi.export.pipeline.SinkWriteException}.
 */
public interface IndexSink extends AutoCloseable {

    void add(List<ConvertedRecord> documents, boolean commit);

    /** Deleting an id the index does not hold is not an error. */
    void delete(String id, boolean commit);

    void commit();

    @Override
    default void close() {
        // Default no-op
    }
}
