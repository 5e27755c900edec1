package org.catalogapi.export.pipeline.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import org.catalogapi.export.pipeline.SetupException;
import org.catalogapi.export.pipeline.status.ExportType;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Deployment settings read from {@code export-settings.json}: chunk-size overrides per export
 * type and the Solr connection.
 */
@Slf4j
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportSettings {
    public static final String DEFAULT_RESOURCE = "/export-settings.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Map<String, ChunkSettings> exportTypes = new LinkedHashMap<>();

    private SolrSettings solr = new SolrSettings();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkSettings {
        /**
         * Zero keeps the export type's default
         */
        private int maxRecordChunk;

        private int maxDeletionChunk;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SolrSettings {
        private String baseUrl = "http://localhost:8983/solr";

        /**
         * Logical index name to Solr core name
         */
        private Map<String, String> cores = new LinkedHashMap<>();

        private int connectionPoolSize = 8;

        public String coreFor(String index) {
            return cores.getOrDefault(index, index);
        }
    }

    public static ExportSettings load(InputStream in) {
        try {
            return MAPPER.readValue(in, ExportSettings.class);
        } catch (IOException e) {
            throw new SetupException("Could not read export settings", e);
        }
    }

    /**
     * Reads {@link #DEFAULT_RESOURCE} from the classpath, or returns empty settings when it is not
     * there.
     */
    public static ExportSettings fromClasspath() {
        try (var in = ExportSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath; using defaults", DEFAULT_RESOURCE);
                return new ExportSettings();
            }
            return load(in);
        } catch (IOException e) {
            throw new SetupException("Could not close export settings resource", e);
        }
    }

    public int recordChunkFor(ExportType type) {
        var override = exportTypes.get(type.name());
        return override != null && override.maxRecordChunk > 0 ? override.maxRecordChunk : type.maxRecordChunk();
    }

    public int deletionChunkFor(ExportType type) {
        var override = exportTypes.get(type.name());
        return override != null && override.maxDeletionChunk > 0 ? override.maxDeletionChunk : type.maxDeletionChunk();
    }
}
