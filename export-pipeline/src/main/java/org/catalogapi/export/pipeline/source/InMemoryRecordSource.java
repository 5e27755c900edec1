package org.catalogapi.export.pipeline.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.catalogapi.export.pipeline.SetupException;

/**
 * A RecordSource over a fixed list, for tests and for replaying captured records.
 *
 * Export filters are registered by name; {@link #FULL_EXPORT} is always available. Every query
 * is kept so callers can check what was asked for.
 */
public class InMemoryRecordSource<R> implements RecordSource<R> {
    public static final String FULL_EXPORT = "full_export";

    private final List<R> records;
    private final Function<? super R, ? extends Map<String, ?>> attributes;
    private final Map<String, BiPredicate<? super R, RecordQuery>> exportFilters = new LinkedHashMap<>();
    private final List<RecordQuery> queries = new CopyOnWriteArrayList<>();

    /**
     * @param attributes what base filter groups are matched against for each record
     */
    public InMemoryRecordSource(List<R> records, Function<? super R, ? extends Map<String, ?>> attributes) {
        this.records = new ArrayList<>(records);
        this.attributes = attributes;
        exportFilters.put(FULL_EXPORT, (record, query) -> true);
    }

    public InMemoryRecordSource<R> withExportFilter(String name, BiPredicate<? super R, RecordQuery> filter) {
        exportFilters.put(name, filter);
        return this;
    }

    @Override
    public List<R> fetch(RecordQuery query) {
        queries.add(query);
        var exportFilter = exportFilters.get(query.getExportFilter());
        if (exportFilter == null) {
            throw new SetupException("Unknown export filter: " + query.getExportFilter());
        }
        return records.stream()
            .filter(r -> query.getFilterGroups().matches(attributes.apply(r)))
            .filter(r -> exportFilter.test(r, query))
            .collect(Collectors.toList());
    }

    public List<RecordQuery> getQueries() {
        return Collections.unmodifiableList(queries);
    }
}
