package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.SetupException;
import org.catalogapi.export.pipeline.SourceReadException;
import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.FilterGroups;
import org.catalogapi.export.pipeline.source.InMemoryDeletionSource;
import org.catalogapi.export.pipeline.source.InMemoryRecordSource;
import org.catalogapi.export.pipeline.source.RecordQuery;
import org.catalogapi.export.pipeline.source.RelationHints;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandardExporterTest {

    record Book(String id, String branch) {
        Map<String, Object> attributes() {
            return Map.of("branch", branch);
        }
    }

    private static final List<Book> BOOKS = List.of(
        new Book("b1", "willis"), new Book("b2", "eagle"), new Book("b3", "willis"));

    @Test
    void recordFilterNarrowsTheExport() {
        var source = new InMemoryRecordSource<>(BOOKS, Book::attributes);
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(source)
            .recordFilter(FilterGroups.of(Map.of("branch", "willis")))
            .build();

        assertEquals(List.of(BOOKS.get(0), BOOKS.get(2)), exporter.getRecords());
    }

    @Test
    void queryCarriesOptionsAndHints() {
        var source = new InMemoryRecordSource<>(BOOKS, Book::attributes);
        var hints = new RelationHints(List.of("record_metadata"), List.of("items"));
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(source)
            .relationHints(hints)
            .build();

        exporter.getRecords();

        var query = source.getQueries().get(0);
        assertEquals(InMemoryRecordSource.FULL_EXPORT, query.getExportFilter());
        assertEquals(false, query.option(RecordQuery.IS_DELETION));
        assertEquals(hints, query.getRelationHints());
        assertEquals(FilterGroups.matchAll(), query.getFilterGroups());
    }

    @Test
    void noDeletionFilterMeansNoDeletions() {
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(BOOKS, Book::attributes))
            .deletionSource(new InMemoryDeletionSource(List.of(DeletionRecord.of("b9"))))
            .build();

        assertTrue(exporter.getDeletions().isEmpty());
    }

    @Test
    void deletionFilterSelectsDeletions() {
        var deletions = List.of(
            new DeletionRecord("b8", Map.of("record_type", "b")),
            new DeletionRecord("i9", Map.of("record_type", "i")));
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(BOOKS, Book::attributes))
            .deletionSource(new InMemoryDeletionSource(deletions))
            .deletionFilter(FilterGroups.of(Map.of("record_type", "b")))
            .build();

        assertEquals(List.of(deletions.get(0)), exporter.getDeletions());
    }

    @Test
    void deletionFilterWithoutSourceIsAnError() {
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(BOOKS, Book::attributes))
            .deletionFilter(FilterGroups.matchAll())
            .build();

        assertThrows(IllegalStateException.class, exporter::getDeletions);
    }

    @Test
    void emptyResultFailsOnlyWhenAskedTo() {
        var lenient = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(List.of(), Book::attributes))
            .build();
        var strict = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(List.of(), Book::attributes))
            .failOnZero(true)
            .build();

        assertTrue(lenient.getRecords().isEmpty());
        assertThrows(SourceReadException.class, strict::getRecords);
    }

    @Test
    void sourceFailuresBecomeSourceReadExceptions() {
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(query -> {
                throw new IllegalStateException("connection reset");
            })
            .build();

        var e = assertThrows(SourceReadException.class, exporter::getRecords);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void unknownExportFilterIsASetupProblem() {
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job("no_such_filter", 10, 10))
            .recordSource(new InMemoryRecordSource<>(BOOKS, Book::attributes))
            .build();

        assertThrows(SetupException.class, exporter::getRecords);
    }

    @Test
    void missingHooksAreNoOps() {
        var exporter = StandardExporter.<Book>builder()
            .job(TestJobs.job(10, 10))
            .recordSource(new InMemoryRecordSource<>(BOOKS, Book::attributes))
            .build();

        assertEquals(Map.of(), exporter.exportRecords(BOOKS));
        assertEquals(Map.of(), exporter.deleteRecords(List.of(DeletionRecord.of("b1"))));
        assertEquals(RelationHints.NONE, exporter.getRelationHints());
    }
}
