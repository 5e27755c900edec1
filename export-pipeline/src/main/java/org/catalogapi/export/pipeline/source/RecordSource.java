package org.catalogapi.export.pipeline.source;

import java.util.List;

/**
 * Port for reading the records of an export job from the catalog database or any stand-in.
 *
 * Implementations raise {@link org.catalogapi.export.pipeline.SetupException} when the query's
 * export filter cannot be resolved and {@link org.catalogapi.export.pipeline.SourceReadException}
 * when the read itself fails.
 */
public interface RecordSource<R> {

    List<R> fetch(RecordQuery query);
}
