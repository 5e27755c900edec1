package org.catalogapi.export.pipeline.exporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.RelationHints;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fans one parent job out to named children, each exporting its own record type to its own
 * sink. Results are keyed by child name and each child merges only its own results, so a child
 * that fails never spoils a sibling's.
 *
 * The parent fetches records once with the relation hints of every child combined.
 */
@Slf4j
public class CompoundExporter<P> implements Exporter<P> {
    static final String EXPORT_STAGE = "export";
    static final String DELETE_STAGE = "delete";
    static final String COMPILE_STAGE = "compile";
    static final String FINAL_CALLBACK_STAGE = "final callback";

    protected final StandardExporter<P> parent;
    protected final Map<String, ChildExporter<P, ?>> children;

    @Getter(lazy = true)
    private final RelationHints relationHints = combineRelationHints();

    public CompoundExporter(StandardExporter<P> parent, List<ChildExporter<P, ?>> children) {
        this.parent = parent;
        var byName = new LinkedHashMap<String, ChildExporter<P, ?>>();
        for (var child : children) {
            if (byName.putIfAbsent(child.getName(), child) != null) {
                throw new IllegalArgumentException("Duplicate child exporter name: " + child.getName());
            }
        }
        this.children = Collections.unmodifiableMap(byName);
    }

    public Map<String, ChildExporter<P, ?>> getChildren() {
        return children;
    }

    @Override
    public ExportJob getJob() {
        return parent.getJob();
    }

    @Override
    public List<P> getRecords() {
        return parent.getRecords(getRelationHints());
    }

    @Override
    public List<DeletionRecord> getDeletions() {
        return parent.getDeletions();
    }

    /** Each child's de-duplicated derived records for the batch, by child name. */
    public Map<String, List<?>> generateRecordSets(List<P> batch) {
        var sets = new LinkedHashMap<String, List<?>>();
        children.forEach((name, child) -> sets.put(name, child.deriveRecordSet(batch)));
        return sets;
    }

    @Override
    public Map<String, Object> exportRecords(List<P> batch) {
        var results = new LinkedHashMap<String, Object>();
        children.forEach((name, child) -> {
            try {
                var derived = child.deriveRecordSet(batch);
                results.put(name, child.exportDerived(derived));
            } catch (RuntimeException e) {
                childFailed(name, EXPORT_STAGE, e);
                results.put(name, null);
            }
        });
        return results;
    }

    @Override
    public Map<String, Object> deleteRecords(List<DeletionRecord> batch) {
        var results = new LinkedHashMap<String, Object>();
        children.forEach((name, child) -> results.put(name, deleteForChild(name, child, batch)));
        return results;
    }

    protected Map<String, Object> deleteForChild(String name, ChildExporter<P, ?> child, List<DeletionRecord> batch) {
        try {
            return child.deleteRecords(batch);
        } catch (RuntimeException e) {
            childFailed(name, DELETE_STAGE, e);
            return null;
        }
    }

    /**
     * Hands each child the results it produced, and only those, to merge its own way.
     */
    @Override
    public Map<String, Object> compileVals(List<Map<String, Object>> results) {
        var compiled = new LinkedHashMap<String, Object>();
        children.forEach((name, child) -> {
            var childResults = new ArrayList<Map<String, Object>>();
            for (var result : results) {
                if (result != null && result.get(name) instanceof Map) {
                    childResults.add(asVals(result.get(name)));
                }
            }
            try {
                compiled.put(name, child.compileVals(childResults));
            } catch (RuntimeException e) {
                childFailed(name, COMPILE_STAGE, e);
                compiled.put(name, null);
            }
        });
        return compiled;
    }

    @Override
    public void finalCallback(Map<String, Object> vals, ExportStatus status) {
        children.forEach((name, child) -> {
            var childVals = vals.get(name) instanceof Map ? asVals(vals.get(name)) : Map.<String, Object>of();
            try {
                child.finalCallback(childVals, status);
            } catch (RuntimeException e) {
                childFailed(name, FINAL_CALLBACK_STAGE, e);
            }
        });
    }

    protected RelationHints combineRelationHints() {
        var combined = parent.getRelationHints();
        for (var child : children.values()) {
            combined = combined.union(child.getPrefixedHints());
        }
        return combined;
    }

    protected void childFailed(String childName, String stage, RuntimeException e) {
        getJob().logError(null, stage + " (" + childName + ")", e.getMessage(), e);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asVals(Object value) {
        return (Map<String, Object>) value;
    }
}
