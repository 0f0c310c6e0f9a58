package org.carball.autoindex.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads query telemetry from an exported JSON file instead of the live
 * {@code query_stats} table.
 * <p>
 * Each entry in {@code queries} is either structured ({@code table}, {@code fields}
 * or {@code field}, {@code predicate_kind}) or raw {@code sql_text}, which is run
 * through the {@link SqlPredicateExtractor}. Entries that cannot be read are
 * skipped and counted.
 */
@Slf4j
public class QueryTelemetryFileSource implements QueryTelemetrySource {

    private final JsonNode exportData;
    private final List<QueryRecord> records;
    private int skippedEntries;
    private int cursor;

    public QueryTelemetryFileSource(Path path, SqlPredicateExtractor extractor) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        if (!Files.exists(path)) {
            throw new IOException("Query telemetry export file not found: " + path);
        }

        String content = Files.readString(path);
        exportData = objectMapper.readTree(content);

        validateExportFormat();
        records = parseQueries(extractor);
        log.info("Loaded {} query records from {} ({} entries skipped)", records.size(), path, skippedEntries);
    }

    @Override
    public synchronized List<QueryRecord> poll(int maxRecords) {
        int end = Math.min(records.size(), cursor + Math.max(0, maxRecords));
        List<QueryRecord> batch = new ArrayList<>(records.subList(cursor, end));
        cursor = end;
        return batch;
    }

    /**
     * Extracts all records from the export, independent of the poll cursor.
     */
    public List<QueryRecord> getAllRecords() {
        return List.copyOf(records);
    }

    public int getSkippedEntries() {
        return skippedEntries;
    }

    /**
     * Gets export metadata including database name and export timestamp.
     */
    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        JsonNode totalQueries = metadata.get("total_queries");
        return new ExportMetadata(
            metadata.get("database_name").asText(),
            metadata.get("export_timestamp").asText(),
            totalQueries != null ? totalQueries.asInt() : exportData.get("queries").size()
        );
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }

        JsonNode queries = exportData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in export file");
        }

        String[] requiredFields = {"database_name", "export_timestamp"};
        for (String field : requiredFields) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }
    }

    private List<QueryRecord> parseQueries(SqlPredicateExtractor extractor) {
        List<QueryRecord> results = new ArrayList<>();
        for (JsonNode queryNode : exportData.get("queries")) {
            try {
                List<QueryRecord> parsed = parseQueryFromJson(queryNode, extractor);
                if (parsed.isEmpty()) {
                    skippedEntries++;
                }
                results.addAll(parsed);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                skippedEntries++;
                log.warn("Skipping unreadable telemetry entry {}: {}", queryNode.path("query_id").asText("?"), e.getMessage());
            }
        }
        return results;
    }

    private List<QueryRecord> parseQueryFromJson(JsonNode queryNode, SqlPredicateExtractor extractor) {
        String tenantId = requiredText(queryNode, "tenant_id");
        Instant timestamp = Instant.parse(requiredText(queryNode, "timestamp"));
        double durationMs = queryNode.path("duration_ms").asDouble(Double.NaN);

        if (queryNode.hasNonNull("sql_text")) {
            return extractor.toRecords(tenantId, queryNode.get("sql_text").asText(), durationMs, timestamp);
        }

        String table = requiredText(queryNode, "table");
        List<String> fields = new ArrayList<>();
        if (queryNode.has("fields") && queryNode.get("fields").isArray()) {
            queryNode.get("fields").forEach(f -> fields.add(f.asText()));
        } else {
            fields.add(requiredText(queryNode, "field"));
        }
        PredicateKind kind = PredicateKind.fromString(queryNode.path("predicate_kind").asText(null));
        if (kind == null) {
            throw new IllegalArgumentException("unknown predicate_kind '" + queryNode.path("predicate_kind").asText() + "'");
        }
        return List.of(new QueryRecord(tenantId, table, fields, kind, durationMs, timestamp));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value.asText();
    }

    /**
     * Metadata about the telemetry export.
     */
    public record ExportMetadata(String databaseName, String exportTimestamp, int totalQueries) {

        @Override
        public String toString() {
            return String.format("ExportMetadata{database='%s', timestamp='%s', queries=%d}",
                    databaseName, exportTimestamp, totalQueries);
        }
    }
}
