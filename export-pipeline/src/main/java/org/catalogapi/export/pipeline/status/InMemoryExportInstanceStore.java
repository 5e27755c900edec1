package org.catalogapi.export.pipeline.status;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An ExportInstanceStore held in memory. Instances go in and come out as copies, so callers never
 * share a mutable instance with the store.
 */
public class InMemoryExportInstanceStore implements ExportInstanceStore {
    private final Map<Long, ExportInstance> instances = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public ExportInstance save(ExportInstance instance) {
        var copy = instance.toBuilder().build();
        if (copy.getId() == null) {
            copy.setId(nextId.getAndIncrement());
        }
        instances.put(copy.getId(), copy);
        return copy.toBuilder().build();
    }

    @Override
    public Optional<ExportInstance> findById(long id) {
        return Optional.ofNullable(instances.get(id)).map(i -> i.toBuilder().build());
    }

    @Override
    public Optional<ExportInstance> findLatestCompleted(String exportType) {
        return instances.values().stream()
            .filter(i -> exportType.equals(i.getExportType()))
            .filter(i -> i.getStatus() != null && i.getStatus().isCompleted())
            .filter(i -> i.getTimestamp() != null)
            .max(Comparator.comparing(ExportInstance::getTimestamp))
            .map(i -> i.toBuilder().build());
    }
}
