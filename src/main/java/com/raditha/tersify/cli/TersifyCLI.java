package com.raditha.tersify.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.tersify.analyzer.AnalysisReport;
import com.raditha.tersify.analyzer.ProjectAnalyzer;
import com.raditha.tersify.analyzer.RewriteAnalyzer;
import com.raditha.tersify.config.ConfigLoader;
import com.raditha.tersify.config.TersifyConfig;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.model.Severity;
import com.raditha.tersify.refactoring.DiffGenerator;
import com.raditha.tersify.refactoring.FixResult;
import com.raditha.tersify.refactoring.RewriteEngine;
import com.raditha.tersify.rules.RewriteRule;
import com.raditha.tersify.rules.RuleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Tersify.
 * <p>
 * Usage:
 * java -jar tersify.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Configuration priority: CLI arguments &gt; tersify.yml &gt; defaults
 */
@Command(name = "tersify", mixinStandardHelpOptions = true, version = "Tersify v1.0.0",
        description = "Finds Java code that can be written more tersely and rewrites it")
public class TersifyCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_FAIL_ON = 5;

    private static final String VERSION = "1.0.0";
    private static final Logger logger = LoggerFactory.getLogger(TersifyCLI.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "Java files or directories to analyze")
    private List<Path> paths = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file (default: ./tersify.yml)",
            paramLabel = "<path>")
    private String configFile;

    @Option(names = "--mode", description = "What to do with findings: ${COMPLETION-CANDIDATES} (default: report)",
            paramLabel = "<mode>", converter = FixModeConverter.class)
    private FixMode mode = FixMode.REPORT;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--rule", description = "Only run this rule; may be repeated", paramLabel = "<id>")
    private List<String> ruleIds = new ArrayList<>();

    @Option(names = "--fail-on", description = "Exit with code 5 if a diagnostic has at least this severity",
            paramLabel = "<severity>", converter = SeverityConverter.class)
    private Severity failOn;

    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        TersifyConfig config = configFile != null
                ? ConfigLoader.load(Path.of(configFile))
                : ConfigLoader.loadFromDirectory(Path.of("").toAbsolutePath());

        List<RewriteRule<?>> rules = RuleFactory.createRules(config, ruleIds);
        RewriteAnalyzer analyzer = new RewriteAnalyzer(rules);
        List<AnalysisReport> reports = new ProjectAnalyzer(config, analyzer).analyze(paths);

        Map<AnalysisReport, FileOutcome> outcomes = new LinkedHashMap<>();
        if (mode != FixMode.REPORT) {
            RewriteEngine engine = new RewriteEngine(analyzer, config.parserConfiguration());
            for (AnalysisReport report : reports) {
                if (report.hasDiagnostics()) {
                    outcomes.put(report, fixFile(engine, report.sourceFile()));
                }
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            printJsonReport(out, reports, outcomes);
        } else {
            printTextReport(out, reports, outcomes);
        }
        out.flush();

        if (failOn != null) {
            long failing = reports.stream().mapToLong(r -> r.countAtLeast(failOn)).sum();
            if (failing > 0) {
                logger.debug("{} diagnostics at or above {}", failing, failOn.toCliString());
                return EXIT_FAIL_ON;
            }
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Build the command line with the error handling used by {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new TersifyCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine commandLine = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            commandLine.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, commandLine.getErr());
            commandLine.getErr().print(commandLine.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (configFile != null && !Files.isRegularFile(Path.of(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (!ruleIds.isEmpty() && !RuleFactory.knownRuleIds().containsAll(ruleIds)) {
            List<String> unknown = ruleIds.stream()
                    .filter(id -> !RuleFactory.knownRuleIds().contains(id))
                    .toList();
            throw new IllegalArgumentException("Unknown rule(s) " + unknown + ". Known rules: "
                    + RuleFactory.knownRuleIds());
        }
    }

    private FileOutcome fixFile(RewriteEngine engine, Path file) throws IOException {
        String original = Files.readString(file);
        FixResult result = engine.fixAll(original);
        if (!result.changed()) {
            return new FileOutcome(0, null);
        }
        if (mode == FixMode.APPLY) {
            Files.writeString(file, result.source());
            logger.info("Applied {} fixes to {}", result.applied(), file);
            return new FileOutcome(result.applied(), null);
        }
        String diff = new DiffGenerator().generateUnifiedDiff(file.getFileName().toString(), original,
                result.source());
        return new FileOutcome(result.applied(), diff);
    }

    private void printTextReport(PrintWriter out, List<AnalysisReport> reports,
            Map<AnalysisReport, FileOutcome> outcomes) {
        int diagnosticCount = 0;
        int skipped = 0;
        int fixed = 0;

        for (AnalysisReport report : reports) {
            if (!report.isParsed()) {
                skipped++;
                out.println(report.getSummary());
                report.parseProblems().forEach(problem -> out.println("    " + problem));
                continue;
            }
            if (!report.hasDiagnostics()) {
                continue;
            }
            diagnosticCount += report.diagnostics().size();
            out.println(report.sourceFile());
            for (Diagnostic diagnostic : report.diagnostics()) {
                out.println("  " + diagnostic.toDisplayString());
            }

            FileOutcome outcome = outcomes.get(report);
            if (outcome == null) {
                continue;
            }
            fixed += outcome.fixesApplied();
            if (outcome.diff() != null) {
                out.println();
                out.println(outcome.diff());
            } else if (mode == FixMode.APPLY) {
                out.printf("  Applied %d fixes%n", outcome.fixesApplied());
            }
        }

        out.println();
        out.printf("Summary: %d files analyzed, %d skipped, %d diagnostics", reports.size(), skipped,
                diagnosticCount);
        switch (mode) {
            case DRY_RUN -> out.printf(", %d fixes available%n", fixed);
            case APPLY -> out.printf(", %d fixes applied%n", fixed);
            default -> out.println();
        }
    }

    private void printJsonReport(PrintWriter out, List<AnalysisReport> reports,
            Map<AnalysisReport, FileOutcome> outcomes) throws IOException {
        List<JsonFile> files = new ArrayList<>();
        int diagnosticCount = 0;
        for (AnalysisReport report : reports) {
            diagnosticCount += report.diagnostics().size();
            if (report.isParsed() && !report.hasDiagnostics()) {
                continue;
            }
            FileOutcome outcome = outcomes.get(report);
            files.add(new JsonFile(
                    report.sourceFile().toString(),
                    report.diagnostics(),
                    report.isParsed() ? null : report.parseProblems(),
                    outcome == null ? null : outcome.fixesApplied(),
                    outcome == null ? null : outcome.diff()));
        }
        JsonReport json = new JsonReport(VERSION, mode.toCliString(), reports.size(), diagnosticCount, files);
        out.println(JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json));
    }

    private record FileOutcome(int fixesApplied, String diff) {
    }

    record JsonReport(String version, String mode, int filesAnalyzed, int totalDiagnostics,
            List<JsonFile> files) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record JsonFile(String path, List<Diagnostic> diagnostics, List<String> parseProblems, Integer fixesApplied,
            String diff) {
    }

    public static class FixModeConverter implements ITypeConverter<FixMode> {
        @Override
        public FixMode convert(String value) throws Exception {
            return FixMode.fromString(value);
        }
    }

    public static class SeverityConverter implements ITypeConverter<Severity> {
        @Override
        public Severity convert(String value) throws Exception {
            return Severity.fromString(value);
        }
    }
}
