package org.catalogapi.export.pipeline.exporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.RelationHints;

/**
 * A compound whose first child is the main child and whose other children export records
 * attached to it, such as a bib's items and holdings.
 *
 * Deletions come from the main child's deletion filter and go only to the main child. The main
 * child's select hints are used as they are; attached children's select hints become prefetch
 * hints, together with every child's prefetch hints.
 */
public class AttachedRecordExporter<P> extends CompoundExporter<P> {

    public AttachedRecordExporter(StandardExporter<P> parent, List<ChildExporter<P, ?>> children) {
        super(parent, children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("An attached-record exporter needs a main child");
        }
    }

    public ChildExporter<P, ?> getMainChild() {
        return children.values().iterator().next();
    }

    @Override
    public List<DeletionRecord> getDeletions() {
        return getMainChild().getExporter().getDeletions();
    }

    @Override
    public Map<String, Object> deleteRecords(List<DeletionRecord> batch) {
        var main = getMainChild();
        var results = new LinkedHashMap<String, Object>();
        results.put(main.getName(), deleteForChild(main.getName(), main, batch));
        return results;
    }

    @Override
    protected RelationHints combineRelationHints() {
        var main = getMainChild();
        var select = new ArrayList<>(main.getPrefixedHints().selectRelated());
        var prefetch = new ArrayList<String>();
        for (var child : children.values()) {
            var hints = child.getPrefixedHints();
            if (child != main) {
                prefetch.addAll(hints.selectRelated());
            }
            prefetch.addAll(hints.prefetchRelated());
        }
        return parent.getRelationHints().union(new RelationHints(select, prefetch));
    }
}
