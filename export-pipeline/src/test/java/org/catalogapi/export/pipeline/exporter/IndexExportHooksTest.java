package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.CatalogFixtures;
import org.catalogapi.export.pipeline.convert.IndexRecordPipeline;
import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.sink.CollectingIndexSink;
import org.catalogapi.export.pipeline.status.ExportStatus;
import org.catalogapi.export.sierra.model.BibSourceRecord;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexExportHooksTest {

    private CollectingIndexSink sink;
    private IndexExportHooks<BibSourceRecord> hooks;

    @BeforeEach
    void setUp() {
        sink = new CollectingIndexSink();
        var pipeline = IndexRecordPipeline.defaults();
        hooks = IndexExportHooks.<BibSourceRecord>builder()
            .sink(sink)
            .converter(pipeline::convert)
            .recordId(IndexRecordPipeline::identify)
            .build();
    }

    @Test
    void convertedRecordsReachTheSinkUncommitted() {
        var job = TestJobs.job(10, 10);

        var vals = hooks.exportRecords(List.of(CatalogFixtures.bib(1000001), CatalogFixtures.bib(1000002)), job);

        assertEquals(List.of("b1000001", "b1000002"), vals.get(IndexExportHooks.EXPORTED));
        assertEquals(List.of(), vals.get(IndexExportHooks.FAILED));
        assertEquals(List.of("b1000001", "b1000002"), List.copyOf(sink.getDocuments().keySet()));
        assertEquals(List.of(false), sink.getCommitFlags());
        assertEquals(0, sink.getCommitCount());
        assertEquals(0, job.getErrors());
    }

    @Test
    void conversionFailureSkipsOnlyThatRecord() {
        var job = TestJobs.job(10, 10);

        var vals = hooks.exportRecords(List.of(
            CatalogFixtures.bib(1000001), CatalogFixtures.brokenBib(1000002), CatalogFixtures.bib(1000003)), job);

        assertEquals(List.of("b1000001", "b1000003"), vals.get(IndexExportHooks.EXPORTED));
        assertEquals(List.of("b1000002"), vals.get(IndexExportHooks.FAILED));
        assertFalse(sink.getDocuments().containsKey("b1000002"));
        assertEquals(1, job.getErrors());
    }

    @Test
    void sinkFailureMarksTheWholeChunkFailed() {
        var job = TestJobs.job(10, 10);
        sink.failWrites(true);

        var vals = hooks.exportRecords(List.of(CatalogFixtures.bib(1000001), CatalogFixtures.bib(1000002)), job);

        assertEquals(List.of(), vals.get(IndexExportHooks.EXPORTED));
        assertEquals(List.of("b1000001", "b1000002"), vals.get(IndexExportHooks.FAILED));
        assertEquals(1, job.getErrors());
    }

    @Test
    void deletingAnAbsentRecordIsNotAnError() {
        var job = TestJobs.job(10, 10);
        hooks.exportRecords(List.of(CatalogFixtures.bib(1000001)), job);

        var first = hooks.deleteRecords(List.of(DeletionRecord.of("b1000001")), job);
        var second = hooks.deleteRecords(List.of(DeletionRecord.of("b1000001")), job);

        assertEquals(List.of("b1000001"), first.get(IndexExportHooks.DELETED));
        assertEquals(List.of("b1000001"), second.get(IndexExportHooks.DELETED));
        assertTrue(sink.getDocuments().isEmpty());
        assertEquals(0, job.getErrors());
    }

    @Test
    void finalCallbackCommitsOnce() {
        var job = TestJobs.job(10, 10);

        hooks.finalCallback(Map.of(), ExportStatus.SUCCESS, job);

        assertEquals(1, sink.getCommitCount());
    }

    @Test
    void commitFailureIsLoggedAgainstTheJob() {
        var job = TestJobs.job(10, 10);
        sink.failWrites(true);

        hooks.finalCallback(Map.of(), ExportStatus.SUCCESS, job);

        assertEquals(1, job.getErrors());
    }

    @Test
    void deletesUseQualifiedIdsWhenConfigured() {
        var qualified = IndexExportHooks.<BibSourceRecord>builder()
            .sink(sink)
            .converter(record -> IndexRecordPipeline.defaults().convert(record))
            .recordId(IndexRecordPipeline::identify)
            .idPrefix("unt")
            .resourceType("bib")
            .build();

        qualified.deleteRecords(List.of(DeletionRecord.of("b1000001")), TestJobs.job(10, 10));

        assertEquals(List.of("unt.bib.b1000001"), sink.getDeletedIds());
    }
}
