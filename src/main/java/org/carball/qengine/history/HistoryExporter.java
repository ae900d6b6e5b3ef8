package org.carball.qengine.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.history.ExecutionPerformance;
import org.carball.qengine.model.history.ExportFormat;
import org.carball.qengine.model.history.ExportOptions;
import org.carball.qengine.model.history.HistoryMetadata;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.history.UserFeedback;
import org.carball.qengine.util.JsonMappers;

import java.io.StringReader;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts history entries to and from the export formats. JSON and YAML carry whole
 * entries; CSV carries one flat row per entry and is rebuilt into partial entries on import.
 */
@Slf4j
public class HistoryExporter {

    private static final List<String> BASE_COLUMNS = List.of(
            "id", "timestamp", "connectionId", "database", "originalQuery", "optimizedQuery",
            "tags", "queryType", "complexity", "estimatedBenefit", "actualBenefit");
    private static final List<String> PERFORMANCE_COLUMNS = List.of(
            "originalExecutionTime", "optimizedExecutionTime", "performanceGain", "success");
    private static final List<String> FEEDBACK_COLUMNS = List.of("userRating", "helpful", "comments");

    private static final String TAG_SEPARATOR = ";";
    private static final TypeReference<List<OptimizationHistoryEntry>> ENTRY_LIST = new TypeReference<>() { };

    private final ObjectMapper jsonMapper = JsonMappers.json();
    private final ObjectMapper yamlMapper = JsonMappers.yaml();

    public String export(List<OptimizationHistoryEntry> entries, ExportOptions options) {
        ExportFormat format = options.getFormat() != null ? options.getFormat() : ExportFormat.JSON;
        return switch (format) {
            case JSON -> write(jsonMapper, project(entries, options));
            case YAML -> write(yamlMapper, project(entries, options));
            case CSV -> toCsv(entries, options);
        };
    }

    public List<OptimizationHistoryEntry> parse(String data, ExportFormat format) {
        if (data == null || data.isBlank()) {
            return new ArrayList<>();
        }
        return switch (format) {
            case JSON -> read(jsonMapper, data);
            case YAML -> read(yamlMapper, data);
            case CSV -> fromCsv(data);
        };
    }

    // Drops the sections the caller did not ask for.
    private static List<OptimizationHistoryEntry> project(List<OptimizationHistoryEntry> entries, ExportOptions options) {
        return entries.stream()
                .map(entry -> {
                    OptimizationHistoryEntry.OptimizationHistoryEntryBuilder copy = entry.toBuilder();
                    if (!options.isIncludeContext()) {
                        copy.context(null);
                    }
                    if (!options.isIncludePerformance()) {
                        copy.performance(ExecutionPerformance.pending()).performanceRecorded(false);
                    }
                    if (!options.isIncludeFeedback()) {
                        copy.userFeedback(null);
                    }
                    return copy.build();
                })
                .collect(Collectors.toList());
    }

    private static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize optimization history", e);
        }
    }

    private static List<OptimizationHistoryEntry> read(ObjectMapper mapper, String data) {
        try {
            List<OptimizationHistoryEntry> entries = mapper.readValue(data, ENTRY_LIST);
            return entries != null ? entries : new ArrayList<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid optimization history data: " + e.getOriginalMessage(), e);
        }
    }

    private static String toCsv(List<OptimizationHistoryEntry> entries, ExportOptions options) {
        List<String> headers = new ArrayList<>(BASE_COLUMNS);
        if (options.isIncludePerformance()) {
            headers.addAll(PERFORMANCE_COLUMNS);
        }
        if (options.isIncludeFeedback()) {
            headers.addAll(FEEDBACK_COLUMNS);
        }

        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setLineSeparator("\n");
        settings.setQuoteEscapingEnabled(true);

        StringWriter out = new StringWriter();
        CsvWriter writer = new CsvWriter(out, settings);
        writer.writeHeaders(headers);
        for (OptimizationHistoryEntry entry : entries) {
            writer.writeRow(row(entry, options));
        }
        writer.close();
        return out.toString();
    }

    private static List<Object> row(OptimizationHistoryEntry entry, ExportOptions options) {
        HistoryMetadata metadata = entry.getMetadata() != null ? entry.getMetadata() : new HistoryMetadata();
        List<Object> row = new ArrayList<>(Arrays.asList(
                entry.getId(),
                entry.getTimestamp() != null ? entry.getTimestamp().toString() : null,
                entry.getConnectionId(),
                entry.getDatabase(),
                entry.getOriginalQuery(),
                entry.getOptimizedQuery(),
                String.join(TAG_SEPARATOR, entry.getTags()),
                metadata.getQueryType(),
                metadata.getComplexity(),
                metadata.getEstimatedBenefit(),
                metadata.getActualBenefit()));

        if (options.isIncludePerformance()) {
            ExecutionPerformance performance = entry.getPerformance() != null
                    ? entry.getPerformance() : ExecutionPerformance.pending();
            row.add(performance.getOriginalExecutionTime());
            row.add(performance.getOptimizedExecutionTime());
            row.add(performance.getPerformanceGain());
            row.add(performance.isSuccess());
        }
        if (options.isIncludeFeedback()) {
            UserFeedback feedback = entry.getUserFeedback();
            row.add(feedback != null ? feedback.getRating() : null);
            row.add(feedback != null ? feedback.isHelpful() : null);
            row.add(feedback != null && feedback.getComments() != null ? feedback.getComments() : null);
        }
        return row;
    }

    private static List<OptimizationHistoryEntry> fromCsv(String data) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setMaxCharsPerColumn(-1);

        List<String[]> rows = new CsvParser(settings).parseAll(new StringReader(data));
        if (rows.isEmpty()) {
            return new ArrayList<>();
        }

        String[] headers = rows.get(0);
        List<OptimizationHistoryEntry> entries = new ArrayList<>();
        for (String[] values : rows.subList(1, rows.size())) {
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < headers.length && i < values.length; i++) {
                row.put(headers[i], values[i]);
            }
            entries.add(toEntry(row));
        }
        return entries;
    }

    private static OptimizationHistoryEntry toEntry(Map<String, String> row) {
        List<String> tags = blank(row.get("tags"))
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(row.get("tags").split(TAG_SEPARATOR)));

        HistoryMetadata metadata = HistoryMetadata.builder()
                .queryType(row.get("queryType"))
                .complexity(number(row, "complexity"))
                .optimizationTechniques(tags.stream()
                        .filter(tag -> tag.startsWith(HistoryEntryAnnotator.TECHNIQUE_TAG_PREFIX))
                        .map(tag -> tag.substring(HistoryEntryAnnotator.TECHNIQUE_TAG_PREFIX.length()))
                        .collect(Collectors.toList()))
                .estimatedBenefit(number(row, "estimatedBenefit"))
                .actualBenefit(number(row, "actualBenefit"))
                .engineVersion(HistoryEntryAnnotator.ENGINE_VERSION)
                .build();

        OptimizationHistoryEntry.OptimizationHistoryEntryBuilder entry = OptimizationHistoryEntry.builder()
                .id(row.get("id"))
                .timestamp(timestamp(row.get("timestamp")))
                .connectionId(row.get("connectionId"))
                .database(row.get("database"))
                .originalQuery(row.get("originalQuery"))
                .optimizedQuery(row.get("optimizedQuery"))
                .tags(tags)
                .metadata(metadata);

        if (row.containsKey("performanceGain")) {
            entry.performance(ExecutionPerformance.builder()
                    .originalExecutionTime(number(row, "originalExecutionTime"))
                    .optimizedExecutionTime(number(row, "optimizedExecutionTime"))
                    .performanceGain(number(row, "performanceGain"))
                    .success(Boolean.parseBoolean(row.get("success")))
                    .build());
            entry.performanceRecorded(true);
        }
        if (!blank(row.get("userRating"))) {
            entry.userFeedback(UserFeedback.builder()
                    .rating((int) number(row, "userRating"))
                    .helpful(Boolean.parseBoolean(row.get("helpful")))
                    .comments(row.get("comments"))
                    .build());
        }
        return entry.build();
    }

    private static Instant timestamp(String value) {
        if (blank(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable history timestamp '{}'", value);
            return null;
        }
    }

    private static double number(Map<String, String> row, String column) {
        String value = row.get(column);
        return blank(value) ? 0 : Double.parseDouble(value.trim());
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
