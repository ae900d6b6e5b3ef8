package org.carball.qengine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.config.EngineConfig;
import org.carball.qengine.config.EngineConfigLoader;
import org.carball.qengine.config.EngineProfile;
import org.carball.qengine.config.OutputFormat;
import org.carball.qengine.engine.IntelligentQueryEngine;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.history.ExportFormat;
import org.carball.qengine.model.history.ExportOptions;
import org.carball.qengine.model.optimization.QueryOptimizationRequest;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.output.OptimizationReport;
import org.carball.qengine.util.JsonMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class QueryEngineCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              Intelligent Query Engine v%s                  ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            CliOptions options = parseArgs(args);
            EngineConfig config = new EngineConfigLoader()
                    .loadConfiguration(options.getProfile(), options.getConfigFile(), args);

            List<String> queries = readQueries(options.getQueriesFile());
            QueryContext context = options.getContextFile() != null ? readContext(options.getContextFile()) : null;

            System.out.println("\n🔍 Starting optimization...");
            System.out.println("   Queries file: " + options.getQueriesFile() + " (" + queries.size() + " queries)");
            System.out.println("   Connection: " + options.getConnection() + " / " + options.getDatabase());
            System.out.println("   " + config.getConfigurationSummary());
            System.out.println();

            List<QueryOptimizationResult> results;
            try (IntelligentQueryEngine engine = IntelligentQueryEngine.builder().config(config).build()) {
                System.out.print("⚙️  Optimizing queries... ");
                List<QueryOptimizationRequest> requests = queries.stream()
                        .map(query -> QueryOptimizationRequest.builder()
                                .query(query)
                                .connectionId(options.getConnection())
                                .database(options.getDatabase())
                                .context(context)
                                .build())
                        .collect(Collectors.toList());
                results = engine.optimizeQueries(requests);
                System.out.println("✓");

                if (options.getHistoryExport() != null) {
                    System.out.print("🗂️  Exporting optimization history... ");
                    exportHistory(engine, options.getHistoryExport());
                    System.out.println("✓");
                }
            }

            System.out.print("📝 Writing results... ");
            outputResults(results, options);
            System.out.println("✓");

            printSummary(results, options.isVerbose());

            System.out.println("\n✅ Optimization complete!");
            if (options.getFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(options.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + options.getOutputFile());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar query-engine.jar <queries-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  queries-file        Text file with one SQL query per line (-- comments allowed)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: optimization-report.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --connection        Default connection id (default: default)");
        System.out.println("  --database          Database name used in cache keys (default: default)");
        System.out.println("  --profile           Engine profile: " + EngineProfile.getAvailableProfiles());
        System.out.println("  --config            YAML engine configuration file");
        System.out.println("  --context           YAML file describing the query context (system load, data size, indexes)");
        System.out.println("  --history-export    Write the optimization history to this file (.json, .yaml or .csv)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(EngineConfigLoader.getConfigurationHelp());
        System.out.println(EngineProfile.getProfileHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar query-engine.jar queries.sql");
        System.out.println("  java -jar query-engine.jar queries.sql --format both --profile analytics");
        System.out.println("  java -jar query-engine.jar queries.sql --context load.yml --history-export history.csv");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.setQueriesFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output", "-o" -> options.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                case "--format", "-f" -> options.setFormat(parseFormat(requireValue(args, ++i, "Output format not specified")));
                case "--connection" -> options.setConnection(requireValue(args, ++i, "Connection not specified"));
                case "--database" -> options.setDatabase(requireValue(args, ++i, "Database not specified"));
                case "--profile" -> options.setProfile(requireValue(args, ++i, "Profile not specified"));
                case "--config" -> options.setConfigFile(Paths.get(requireValue(args, ++i, "Config file not specified")));
                case "--context" -> options.setContextFile(Paths.get(requireValue(args, ++i, "Context file not specified")));
                case "--history-export" -> options.setHistoryExport(Paths.get(requireValue(args, ++i, "History export file not specified")));
                case "--verbose", "-v" -> options.setVerbose(true);
                default -> {
                    if (arg.startsWith("--engine.")) {
                        // value is applied by EngineConfigLoader
                        requireValue(args, ++i, "Value not specified for " + arg);
                    } else {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                }
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(options.getOutputFile());
        options.setOutputFile(options.getFormat() == OutputFormat.MARKDOWN ? baseFileName + ".md" : baseFileName + ".json");

        validateOptions(options);
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static OutputFormat parseFormat(String value) {
        try {
            return OutputFormat.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
        }
    }

    private static void validateOptions(CliOptions options) {
        if (!Files.isRegularFile(options.getQueriesFile())) {
            throw new IllegalArgumentException("Queries file not found: " + options.getQueriesFile());
        }

        if (options.getContextFile() != null && !Files.isRegularFile(options.getContextFile())) {
            throw new IllegalArgumentException("Context file not found: " + options.getContextFile());
        }

        if (options.getHistoryExport() != null) {
            exportFormatOf(options.getHistoryExport());
        }

        Path outputDir = Paths.get(options.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    /**
     * Reads one query per line. Blank lines and lines starting with {@code --} are skipped.
     */
    static List<String> readQueries(Path file) throws IOException {
        List<String> queries = Files.readAllLines(file).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("--"))
                .collect(Collectors.toList());
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("No queries found in " + file);
        }
        return queries;
    }

    static QueryContext readContext(Path file) throws IOException {
        ObjectMapper mapper = JsonMappers.yaml();
        QueryContext context = mapper.readValue(file.toFile(), QueryContext.class);
        log.info("Loaded query context from: {}", file);
        return context;
    }

    static ExportFormat exportFormatOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1) : "";
        if (extension.equalsIgnoreCase("yml")) {
            return ExportFormat.YAML;
        }
        return ExportFormat.fromName(extension);
    }

    private static void exportHistory(IntelligentQueryEngine engine, Path file) throws IOException {
        String exported = engine.exportOptimizationHistory(ExportOptions.builder()
                .format(exportFormatOf(file))
                .includeContext(true)
                .build());
        Files.writeString(file, exported);
    }

    private static void outputResults(List<QueryOptimizationResult> results, CliOptions options) throws IOException {
        OptimizationReport report = new OptimizationReport(results);
        String baseFileName = removeFileExtension(options.getOutputFile());

        if (options.getFormat() == OutputFormat.JSON || options.getFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }

        if (options.getFormat() == OutputFormat.MARKDOWN || options.getFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printSummary(List<QueryOptimizationResult> results, boolean verbose) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 OPTIMIZATION SUMMARY");
        System.out.println("=".repeat(60));

        long rewritten = results.stream()
                .filter(r -> r.getOptimizedQuery() != null && !r.getOptimizedQuery().equals(r.getOriginalQuery()))
                .count();
        long withWarnings = results.stream().filter(r -> !r.getWarnings().isEmpty()).count();

        System.out.println("\nQueries optimized: " + results.size());
        System.out.println("Queries rewritten: " + rewritten);
        System.out.println("Queries with warnings: " + withWarnings);

        System.out.println("\n🎯 Highest Estimated Gains:");
        System.out.println("-".repeat(60));
        results.stream()
                .sorted((a, b) -> Double.compare(b.getEstimatedPerformanceGain(), a.getEstimatedPerformanceGain()))
                .limit(verbose ? results.size() : 3)
                .forEach(result -> {
                    System.out.printf(Locale.ROOT, "%5.1f%%  %s%n", result.getEstimatedPerformanceGain(),
                            abbreviate(result.getOriginalQuery(), 50));
                    if (result.getRoutingStrategy() != null) {
                        System.out.printf("  └─ Route: %s%n", result.getRoutingStrategy().getTargetConnection());
                    }
                    if (verbose) {
                        result.getOptimizationTechniques()
                                .forEach(t -> System.out.printf("  └─ %s%n", t.getName()));
                    }
                });
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    @Data
    static class CliOptions {
        private Path queriesFile;
        private String outputFile = "optimization-report.json";
        private OutputFormat format = OutputFormat.JSON;
        private String connection = "default";
        private String database = "default";
        private String profile;
        private Path configFile;
        private Path contextFile;
        private Path historyExport;
        private boolean verbose;
    }
}
