package org.catalogapi.export.pipeline.exporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.RelationHints;
import org.catalogapi.export.pipeline.status.ExportStatus;

import lombok.Getter;
import lombok.NonNull;

/**
 * One named child of a {@link CompoundExporter}: an exporter of its own record type plus the
 * functions that derive its records from the parent's.
 *
 * Derived records are de-duplicated by {@code identityKey}, first occurrence kept, within this
 * child only.
 */
public class ChildExporter<P, C> {
    @Getter
    private final String name;
    @Getter
    private final Exporter<C> exporter;
    private final Function<? super P, ? extends List<? extends C>> deriveRecords;
    private final Function<DeletionRecord, ? extends List<DeletionRecord>> deriveDeletions;
    private final Function<? super C, ?> identityKey;
    /** Relation path from the parent record to this child's records; may be empty. */
    @Getter
    private final String relationPrefix;

    @Getter(lazy = true)
    private final RelationHints prefixedHints = exporter.getRelationHints().withPrefix(relationPrefix);

    public ChildExporter(@NonNull String name,
                         @NonNull Exporter<C> exporter,
                         @NonNull Function<? super P, ? extends List<? extends C>> deriveRecords,
                         Function<DeletionRecord, ? extends List<DeletionRecord>> deriveDeletions,
                         Function<? super C, ?> identityKey,
                         String relationPrefix) {
        this.name = name;
        this.exporter = exporter;
        this.deriveRecords = deriveRecords;
        this.deriveDeletions = deriveDeletions == null ? List::of : deriveDeletions;
        this.identityKey = identityKey == null ? Function.identity() : identityKey;
        this.relationPrefix = relationPrefix == null ? "" : relationPrefix;
    }

    /** A child that exports the parent records themselves. */
    public static <P> ChildExporter<P, P> passThrough(String name, Exporter<P> exporter) {
        return new ChildExporter<P, P>(name, exporter, List::of, null, null, "");
    }

    /**
     * A child whose records are derived from each parent record, e.g. a bib's attached items.
     */
    public static <P, C> ChildExporter<P, C> derived(String name, Exporter<C> exporter,
                                                     Function<? super P, ? extends List<? extends C>> deriveRecords,
                                                     Function<? super C, ?> identityKey,
                                                     String relationPrefix) {
        return new ChildExporter<>(name, exporter, deriveRecords, null, identityKey, relationPrefix);
    }

    public List<C> deriveRecordSet(List<? extends P> parentBatch) {
        var unique = new LinkedHashMap<Object, C>();
        for (var parent : parentBatch) {
            for (C derived : deriveRecords.apply(parent)) {
                unique.putIfAbsent(identityKey.apply(derived), derived);
            }
        }
        return new ArrayList<>(unique.values());
    }

    public List<DeletionRecord> deriveDeletionSet(List<DeletionRecord> parentBatch) {
        var unique = new LinkedHashMap<String, DeletionRecord>();
        for (var parent : parentBatch) {
            for (var derived : deriveDeletions.apply(parent)) {
                unique.putIfAbsent(derived.recordId(), derived);
            }
        }
        return new ArrayList<>(unique.values());
    }

    public Map<String, Object> exportRecords(List<? extends P> parentBatch) {
        return exporter.exportRecords(deriveRecordSet(parentBatch));
    }

    /** Exports a set already produced by {@link #deriveRecordSet}. */
    @SuppressWarnings("unchecked")
    Map<String, Object> exportDerived(List<?> derivedRecords) {
        return exporter.exportRecords((List<C>) derivedRecords);
    }

    public Map<String, Object> deleteRecords(List<DeletionRecord> parentBatch) {
        return exporter.deleteRecords(deriveDeletionSet(parentBatch));
    }

    public Map<String, Object> compileVals(List<Map<String, Object>> results) {
        return exporter.compileVals(results);
    }

    public void finalCallback(Map<String, Object> vals, ExportStatus status) {
        exporter.finalCallback(vals, status);
    }
}
