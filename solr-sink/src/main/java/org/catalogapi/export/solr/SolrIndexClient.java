package org.catalogapi.export.solr;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.SinkWriteException;
import org.catalogapi.export.pipeline.config.ExportSettings;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;
import org.catalogapi.export.pipeline.sink.IndexSink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * An {@link IndexSink} that posts JSON to one Solr core's update handler.
 *
 * Each call is one request. Adds and deletes carry Solr's {@code commit} parameter; commits are
 * an explicit {@code {"commit": {}}} command. A non-2xx answer or a transport failure surfaces as
 * a {@link SinkWriteException}.
 */
@Slf4j
public class SolrIndexClient implements IndexSink {
    private static final String USER_AGENT = "CatalogExport-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final String baseUrl;
    @Getter
    private final String core;
    private final HttpClient client;
    /** Only set when this client created the pool, and so has to dispose of it. */
    private final ConnectionProvider ownedProvider;

    /**
     * @param maxConnections if &gt; 0, requests share a pool of this many connections; otherwise
     *                       Reactor's default pool is used
     */
    public SolrIndexClient(String baseUrl, String core, int maxConnections) {
        this(baseUrl, core, maxConnections <= 0 ? null : ConnectionProvider.create("SolrIndexClient", maxConnections));
    }

    private SolrIndexClient(String baseUrl, String core, ConnectionProvider provider) {
        this(baseUrl, core, provider == null ? HttpClient.create() : HttpClient.create(provider), provider);
    }

    protected SolrIndexClient(String baseUrl, String core, HttpClient httpClient, ConnectionProvider ownedProvider) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.core = core;
        this.ownedProvider = ownedProvider;
        this.client = httpClient
            .baseUrl(this.baseUrl)
            .headers(h -> h.set(HttpHeaderNames.USER_AGENT, USER_AGENT)
                .set(HttpHeaderNames.CONTENT_TYPE, JSON_CONTENT_TYPE))
            .keepAlive(true);
    }

    /** A client for the core the settings map {@code index} to. */
    public static SolrIndexClient forIndex(ExportSettings.SolrSettings settings, String index) {
        return new SolrIndexClient(settings.getBaseUrl(), settings.coreFor(index), settings.getConnectionPoolSize());
    }

    public Mono<SolrResponse> addAsync(List<ConvertedRecord> documents, boolean commit) {
        var payload = new ArrayList<Map<String, Object>>(documents.size());
        documents.forEach(d -> payload.add(d.asMap()));
        return update(payload, commit, "add " + documents.size() + " documents");
    }

    public Mono<SolrResponse> deleteAsync(String id, boolean commit) {
        return update(Map.of("delete", Map.of("id", id)), commit, "delete " + id);
    }

    public Mono<SolrResponse> commitAsync() {
        return update(Map.of("commit", Map.of()), null, "commit");
    }

    @Override
    public void add(List<ConvertedRecord> documents, boolean commit) {
        if (documents.isEmpty()) {
            return;
        }
        addAsync(documents, commit).block();
    }

    /** Solr answers a delete of an unknown id with success, so deleting twice is harmless. */
    @Override
    public void delete(String id, boolean commit) {
        deleteAsync(id, commit).block();
    }

    @Override
    public void commit() {
        commitAsync().block();
    }

    @Override
    public void close() {
        if (ownedProvider != null) {
            ownedProvider.dispose();
        }
    }

    private Mono<SolrResponse> update(Object command, Boolean commit, String description) {
        String body;
        try {
            body = MAPPER.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            return Mono.error(new SinkWriteException("Could not serialize " + description + " for Solr core " + core, e));
        }
        var path = "/" + core + "/update" + (commit == null ? "" : "?commit=" + commit);
        log.debug("POST {}{} ({})", baseUrl, path, description);

        return client.post()
            .uri(path)
            .send(Mono.just(Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, bytes) -> bytes.asString()
                .defaultIfEmpty("")
                .map(text -> new SolrResponse(response.status().code(), response.status().reasonPhrase(), text)))
            .onErrorMap(e -> !(e instanceof SinkWriteException),
                e -> new SinkWriteException("Solr core " + core + " did not accept " + description + ": " + e.getMessage(), e))
            .flatMap(response -> {
                if (response.isSuccess()) {
                    return Mono.just(response);
                }
                log.atWarn().setMessage("Solr core {} rejected {}: {} {}")
                    .addArgument(core)
                    .addArgument(description)
                    .addArgument(response::statusCode)
                    .addArgument(response::body)
                    .log();
                return Mono.error(new SinkWriteException("Solr core " + core + " rejected " + description
                    + " with status " + response.statusCode() + " " + response.statusText()));
            });
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
