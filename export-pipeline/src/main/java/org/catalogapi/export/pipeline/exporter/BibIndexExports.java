package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.convert.IndexRecordPipeline;
import org.catalogapi.export.pipeline.sink.IndexSink;
import org.catalogapi.export.pipeline.source.DeletionSource;
import org.catalogapi.export.pipeline.source.FilterGroups;
import org.catalogapi.export.pipeline.source.RecordSource;
import org.catalogapi.export.pipeline.source.RelationHints;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportType;
import org.catalogapi.export.sierra.model.BibSourceRecord;

/**
 * The catalog's bib export. Bibs run through both converter stages into the {@link #INDEX}
 * index, and bibs the source reports deleted are removed from it. Writes are uncommitted until
 * the job's final callback.
 *
 * Deletion sources are expected to report {@link #RECORD_TYPE} and {@link #HAS_DELETION_DATE}
 * on each deletion record.
 */
public final class BibIndexExports {
    public static final ExportType TYPE =
        new ExportType("BibsToIndex", ExportType.DEFAULT_RECORD_CHUNK, ExportType.DEFAULT_DELETION_CHUNK);

    /** Logical index name; settings map it to a Solr core. */
    public static final String INDEX = "bibdata";

    public static final String RECORD_TYPE = "record_type";
    public static final String HAS_DELETION_DATE = "has_deletion_date";
    public static final String BIB_RECORD_TYPE = "b";

    public static final FilterGroups DELETION_FILTER =
        FilterGroups.of(Map.<String, Object>of(HAS_DELETION_DATE, true, RECORD_TYPE, BIB_RECORD_TYPE));

    /** Everything both converter stages read from a bib. */
    public static final RelationHints RELATION_HINTS = new RelationHints(
        List.of("record_metadata"),
        List.of(
            "record_metadata__varfield_set",
            "record_metadata__controlfield_set",
            "record_metadata__leaderfield_set",
            "bibrecorditemrecordlink_set",
            "bibrecorditemrecordlink_set__item_record",
            "bibrecorditemrecordlink_set__item_record__record_metadata",
            "bibrecordproperty_set",
            "bibrecordproperty_set__material__materialpropertyname_set"));

    private BibIndexExports() {}

    public static StandardExporter<BibSourceRecord> exporter(ExportJob job, RecordSource<BibSourceRecord> source,
                                                             DeletionSource deletionSource, IndexSink sink) {
        return exporter(job, source, deletionSource, sink, IndexRecordPipeline.defaults());
    }

    public static StandardExporter<BibSourceRecord> exporter(ExportJob job, RecordSource<BibSourceRecord> source,
                                                             DeletionSource deletionSource, IndexSink sink,
                                                             IndexRecordPipeline pipeline) {
        var hooks = IndexExportHooks.<BibSourceRecord>builder()
            .sink(sink)
            .converter(pipeline::convert)
            .recordId(IndexRecordPipeline::identify)
            .build();
        return StandardExporter.<BibSourceRecord>builder()
            .job(job)
            .recordSource(source)
            .deletionSource(deletionSource)
            .deletionFilter(DELETION_FILTER)
            .relationHints(RELATION_HINTS)
            .exportHook(hooks)
            .deleteHook(hooks)
            .finalCallbackHook(hooks)
            .build();
    }
}
