package org.catalogapi.export.solr;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.catalogapi.export.pipeline.SinkWriteException;
import org.catalogapi.export.pipeline.config.ExportSettings;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;
import org.catalogapi.export.pipeline.exporter.BibIndexExports;
import org.catalogapi.export.pipeline.exporter.ExportJobRunner;
import org.catalogapi.export.pipeline.exporter.IndexExportHooks;
import org.catalogapi.export.pipeline.exporter.StandardExporter;
import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.source.FilterGroups;
import org.catalogapi.export.pipeline.source.InMemoryDeletionSource;
import org.catalogapi.export.pipeline.source.InMemoryRecordSource;
import org.catalogapi.export.pipeline.status.ExportJobFactory;
import org.catalogapi.export.pipeline.status.ExportStatus;
import org.catalogapi.export.pipeline.status.ExportType;
import org.catalogapi.export.pipeline.status.InMemoryExportInstanceStore;
import org.catalogapi.export.sierra.model.BibSourceRecord;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SolrIndexClientTest {

    record Received(String core, String uri, String body) {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Received> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private DisposableServer server;
    private SolrIndexClient client;

    @BeforeEach
    void setUp() {
        server = HttpServer.create()
            .host("localhost")
            .port(0)
            .route(routes -> routes.post("/solr/{core}/update", (request, response) -> request.receive()
                .aggregate()
                .asString()
                .defaultIfEmpty("")
                .flatMap(body -> {
                    requests.add(new Received(request.param("core"), request.uri(), body));
                    return response.status(HttpResponseStatus.valueOf(status.get()))
                        .sendString(Mono.just("{\"responseHeader\":{\"status\":0}}"))
                        .then();
                })))
            .bindNow();
        client = new SolrIndexClient("http://localhost:" + server.port() + "/solr/", "bibdata", 2);
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.disposeNow();
    }

    @Test
    void addPostsDocumentsWithoutCommitting() throws Exception {
        client.add(List.of(
            new ConvertedRecord(Map.of("id", "b1", "has_more_items", false)),
            new ConvertedRecord(Map.of("id", "b2", "callnumbers_display", List.of("QA76.73 .J38")))), false);

        assertEquals(1, requests.size());
        var received = requests.get(0);
        assertEquals("bibdata", received.core());
        assertEquals("/solr/bibdata/update?commit=false", received.uri());
        List<Map<String, Object>> documents = MAPPER.readValue(received.body(), new TypeReference<>() {});
        assertEquals(2, documents.size());
        assertEquals("b1", documents.get(0).get("id"));
        assertEquals(List.of("QA76.73 .J38"), documents.get(1).get("callnumbers_display"));
    }

    @Test
    void emptyAddSendsNothing() {
        client.add(List.of(), false);

        assertTrue(requests.isEmpty());
    }

    @Test
    void deletePostsADeleteCommand() throws Exception {
        client.delete("b1000001", false);

        assertEquals("/solr/bibdata/update?commit=false", requests.get(0).uri());
        assertEquals(Map.of("delete", Map.of("id", "b1000001")), MAPPER.readValue(requests.get(0).body(), Map.class));
    }

    @Test
    void commitPostsACommitCommand() throws Exception {
        StepVerifier.create(client.commitAsync())
            .assertNext(response -> assertEquals(200, response.statusCode()))
            .verifyComplete();

        assertEquals("/solr/bibdata/update", requests.get(0).uri());
        assertEquals(Map.of("commit", Map.of()), MAPPER.readValue(requests.get(0).body(), Map.class));
    }

    @Test
    void rejectedUpdateIsASinkFailure() {
        status.set(500);

        var e = assertThrows(SinkWriteException.class, () -> client.delete("b1", false));

        assertTrue(e.getMessage().contains("500"), e.getMessage());
    }

    @Test
    void unreachableSolrIsASinkFailure() {
        var port = server.port();
        server.disposeNow();
        var unreachable = new SolrIndexClient("http://localhost:" + port + "/solr", "bibdata", 0);

        StepVerifier.create(unreachable.commitAsync())
            .expectError(SinkWriteException.class)
            .verify();
    }

    @Test
    void settingsPickTheCore() {
        var settings = new ExportSettings.SolrSettings();
        settings.setBaseUrl("http://solr.example:8983/solr");
        settings.getCores().put("bibdata", "bibdata_v2");

        var configured = SolrIndexClient.forIndex(settings, "bibdata");

        assertEquals("bibdata_v2", configured.getCore());
        assertEquals("http://solr.example:8983/solr", configured.getBaseUrl());
        configured.close();
    }

    @Test
    void exportJobWritesThenCommitsOnce() {
        var type = ExportType.of("BibsToIndex");
        var job = new ExportJobFactory(new InMemoryExportInstanceStore(), new ExportSettings())
            .create(type, InMemoryRecordSource.FULL_EXPORT, Map.of());
        var hooks = IndexExportHooks.<ConvertedRecord>builder()
            .sink(client)
            .converter(Function.identity())
            .recordId(record -> record.getString("id"))
            .build();
        var exporter = StandardExporter.<ConvertedRecord>builder()
            .job(job)
            .recordSource(new InMemoryRecordSource<>(List.of(
                new ConvertedRecord(Map.of("id", "b1")), new ConvertedRecord(Map.of("id", "b2"))), record -> Map.of()))
            .deletionSource(new InMemoryDeletionSource(List.of(DeletionRecord.of("b0"))))
            .deletionFilter(FilterGroups.matchAll())
            .exportHook(hooks)
            .deleteHook(hooks)
            .finalCallbackHook(hooks)
            .build();

        StepVerifier.create(new ExportJobRunner().run(exporter))
            .assertNext(result -> {
                assertEquals(ExportStatus.SUCCESS, result.status());
                assertEquals(List.of("b1", "b2"), result.vals().get(IndexExportHooks.EXPORTED));
                assertEquals(List.of("b0"), result.vals().get(IndexExportHooks.DELETED));
            })
            .verifyComplete();

        assertEquals(List.of(
                "/solr/bibdata/update?commit=false",
                "/solr/bibdata/update?commit=false",
                "/solr/bibdata/update"),
            requests.stream().map(Received::uri).collect(Collectors.toList()));
    }

    @Test
    void bibExportDeletesFromTheConfiguredCore() {
        var settings = new ExportSettings.SolrSettings();
        settings.setBaseUrl("http://localhost:" + server.port() + "/solr");
        settings.getCores().put(BibIndexExports.INDEX, "bibdata_v2");
        var job = new ExportJobFactory(new InMemoryExportInstanceStore(), new ExportSettings())
            .create(BibIndexExports.TYPE, InMemoryRecordSource.FULL_EXPORT, Map.of());
        var deletions = new InMemoryDeletionSource(List.of(
            new DeletionRecord("b1000009", Map.of(
                BibIndexExports.RECORD_TYPE, BibIndexExports.BIB_RECORD_TYPE,
                BibIndexExports.HAS_DELETION_DATE, true)),
            new DeletionRecord("i2000009", Map.of(
                BibIndexExports.RECORD_TYPE, "i",
                BibIndexExports.HAS_DELETION_DATE, true))));

        try (var configured = SolrIndexClient.forIndex(settings, BibIndexExports.INDEX)) {
            var exporter = BibIndexExports.exporter(job,
                new InMemoryRecordSource<BibSourceRecord>(List.of(), bib -> Map.of()), deletions, configured);

            StepVerifier.create(new ExportJobRunner().run(exporter))
                .assertNext(result -> {
                    assertEquals(ExportStatus.SUCCESS, result.status());
                    assertEquals(List.of("b1000009"), result.vals().get(IndexExportHooks.DELETED));
                })
                .verifyComplete();
        }

        assertEquals(List.of("/solr/bibdata_v2/update?commit=false", "/solr/bibdata_v2/update"),
            requests.stream().map(Received::uri).collect(Collectors.toList()));
        assertTrue(requests.get(0).body().contains("b1000009"));
    }
}
