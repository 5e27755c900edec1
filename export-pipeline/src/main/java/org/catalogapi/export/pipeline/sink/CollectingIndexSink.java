package org.catalogapi.export.pipeline.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.catalogapi.export.pipeline.SinkWriteException;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;

/**
 * An IndexSink that keeps documents in memory, keyed by their id field, for tests that exercise
 * exporters without a running index.
 *
 * Writes can be made to fail with {@link #failWrites(boolean)} to exercise error paths.
 */
public class CollectingIndexSink implements IndexSink {
    private final String idField;
    private final Map<String, ConvertedRecord> documents = new LinkedHashMap<>();
    private final List<String> deletedIds = new ArrayList<>();
    private final List<Boolean> commitFlags = new ArrayList<>();
    private final AtomicInteger commits = new AtomicInteger();
    private volatile boolean failWrites;

    public CollectingIndexSink() {
        this("id");
    }

    public CollectingIndexSink(String idField) {
        this.idField = idField;
    }

    @Override
    public synchronized void add(List<ConvertedRecord> batch, boolean commit) {
        checkWritable("add");
        commitFlags.add(commit);
        for (var document : batch) {
            documents.put(document.getString(idField), document);
        }
        if (commit) {
            commits.incrementAndGet();
        }
    }

    @Override
    public synchronized void delete(String id, boolean commit) {
        checkWritable("delete");
        commitFlags.add(commit);
        documents.remove(id);
        deletedIds.add(id);
        if (commit) {
            commits.incrementAndGet();
        }
    }

    @Override
    public void commit() {
        checkWritable("commit");
        commits.incrementAndGet();
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    private void checkWritable(String operation) {
        if (failWrites) {
            throw new SinkWriteException("Collecting sink refused " + operation);
        }
    }

    public synchronized Map<String, ConvertedRecord> getDocuments() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(documents));
    }

    public synchronized List<String> getDeletedIds() {
        return List.copyOf(deletedIds);
    }

    /** The commit flag of every add and delete call, in call order. */
    public synchronized List<Boolean> getCommitFlags() {
        return List.copyOf(commitFlags);
    }

    public int getCommitCount() {
        return commits.get();
    }
}
