package org.carball.qengine.cli;

import org.carball.qengine.config.OutputFormat;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.history.ExportFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryEngineCLITest {

    @TempDir
    Path tempDir;

    private Path queriesFile;

    @BeforeEach
    public void setUp() throws IOException {
        queriesFile = tempDir.resolve("queries.sql");
        Files.writeString(queriesFile, """
                -- nightly report queries
                SELECT id, total FROM orders WHERE status = 'open'

                SELECT region, SUM(total) FROM orders GROUP BY region
                """);
    }

    @Test
    public void shouldReadQueriesSkippingBlankAndCommentLines() throws IOException {
        // When
        List<String> queries = QueryEngineCLI.readQueries(queriesFile);

        // Then
        assertThat(queries).containsExactly(
                "SELECT id, total FROM orders WHERE status = 'open'",
                "SELECT region, SUM(total) FROM orders GROUP BY region");
    }

    @Test
    public void shouldRejectFileWithoutQueries() throws IOException {
        // Given
        Path empty = tempDir.resolve("empty.sql");
        Files.writeString(empty, "-- nothing here\n\n");

        // When/Then
        assertThatThrownBy(() -> QueryEngineCLI.readQueries(empty))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("No queries found in");
    }

    @Test
    public void shouldParseOptionsAndSkipEngineOverrides() {
        // Given
        String output = tempDir.resolve("report.txt").toString();
        String[] args = {queriesFile.toString(), "-o", output, "--format", "markdown",
                "--connection", "primary", "--database", "shop", "--profile", "analytics",
                "--engine.cache-size", "50", "-v"};

        // When
        QueryEngineCLI.CliOptions options = QueryEngineCLI.parseArgs(args);

        // Then
        assertThat(options.getFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(options.getOutputFile()).isEqualTo(tempDir.resolve("report.md").toString());
        assertThat(options.getConnection()).isEqualTo("primary");
        assertThat(options.getDatabase()).isEqualTo("shop");
        assertThat(options.getProfile()).isEqualTo("analytics");
        assertThat(options.isVerbose()).isTrue();
    }

    @Test
    public void shouldRejectInvalidOptions() {
        // When/Then
        assertThatThrownBy(() -> QueryEngineCLI.parseArgs(new String[]{queriesFile.toString(), "--format", "pdf"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid output format. Use: json, markdown, or both");
        assertThatThrownBy(() -> QueryEngineCLI.parseArgs(new String[]{queriesFile.toString(), "--turbo"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --turbo");
        assertThatThrownBy(() -> QueryEngineCLI.parseArgs(new String[]{tempDir.resolve("missing.sql").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Queries file not found");
        assertThatThrownBy(() -> QueryEngineCLI.parseArgs(
                new String[]{queriesFile.toString(), "--history-export", "history.xlsx"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unsupported history format: xlsx");
    }

    @Test
    public void shouldPickHistoryExportFormatFromExtension() {
        // When/Then
        assertThat(QueryEngineCLI.exportFormatOf(Path.of("out/history.csv"))).isEqualTo(ExportFormat.CSV);
        assertThat(QueryEngineCLI.exportFormatOf(Path.of("history.yml"))).isEqualTo(ExportFormat.YAML);
        assertThat(QueryEngineCLI.exportFormatOf(Path.of("history.JSON"))).isEqualTo(ExportFormat.JSON);
    }

    @Test
    public void shouldReadQueryContextFromYaml() throws IOException {
        // Given
        Path contextFile = tempDir.resolve("context.yml");
        Files.writeString(contextFile, """
                systemLoad:
                  cpuUsage: 85
                  memoryUsage: 60
                dataSize:
                  totalRows: 2500000
                """);

        // When
        QueryContext context = QueryEngineCLI.readContext(contextFile);

        // Then
        assertThat(context.cpuUsage(0)).isEqualTo(85);
        assertThat(context.totalRows()).isEqualTo(2_500_000);
    }

    @Test
    public void shouldStripOnlyFileExtension() {
        // When/Then
        assertThat(QueryEngineCLI.removeFileExtension("reports/out.json")).isEqualTo("reports/out");
        assertThat(QueryEngineCLI.removeFileExtension("reports.v2/out")).isEqualTo("reports.v2/out");
    }
}
