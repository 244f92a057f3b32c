package com.raditha.tersify.analyzer;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.tersify.config.TersifyConfig;
import com.raditha.tersify.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Finds the Java sources under a set of paths, parses them and analyzes each one.
 * A file that does not parse is reported as skipped; it does not stop the run.
 */
public class ProjectAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final TersifyConfig config;
    private final RewriteAnalyzer analyzer;
    private final JavaParser parser;

    public ProjectAnalyzer(TersifyConfig config, RewriteAnalyzer analyzer) {
        this.config = config;
        this.analyzer = analyzer;
        this.parser = new JavaParser(config.parserConfiguration());
    }

    /**
     * Analyze every Java source under the given files and directories.
     *
     * @throws IOException if a path does not exist or a file cannot be read
     */
    public List<AnalysisReport> analyze(List<Path> roots) throws IOException {
        List<AnalysisReport> reports = new ArrayList<>();
        for (Path file : collectSources(roots)) {
            reports.add(analyzeFile(file));
        }
        return reports;
    }

    /**
     * Analyze one file.
     */
    public AnalysisReport analyzeFile(Path file) throws IOException {
        String source = Files.readString(file);
        return analyzeSource(file, source);
    }

    /**
     * Analyze source text that belongs to {@code file}.
     */
    public AnalysisReport analyzeSource(Path file, String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .toList();
            logger.warn("Skipping {}: {} parse problems", file, problems.size());
            return AnalysisReport.skipped(file, problems.isEmpty() ? List.of("Unknown parse failure") : problems);
        }

        List<Diagnostic> diagnostics = new ArrayList<>(analyzer.analyze(result.getResult().get()));
        diagnostics.sort(Diagnostic.BY_LOCATION);
        logger.debug("Analyzed {}: {} diagnostics", file, diagnostics.size());
        return new AnalysisReport(file, diagnostics, List.of());
    }

    /**
     * Collect the {@code .java} files under the given paths, skipping excluded ones.
     *
     * @return absolute, normalized paths in sorted order
     * @throws NoSuchFileException if a path does not exist
     */
    public List<Path> collectSources(List<Path> roots) throws IOException {
        TreeSet<Path> sources = new TreeSet<>();
        for (Path root : roots) {
            Path absolute = root.toAbsolutePath().normalize();
            if (!Files.exists(absolute)) {
                throw new NoSuchFileException(root.toString());
            }
            if (Files.isRegularFile(absolute)) {
                if (isJavaSource(absolute)) {
                    sources.add(absolute);
                }
                continue;
            }
            try (Stream<Path> walk = Files.walk(absolute)) {
                walk.filter(Files::isRegularFile)
                        .filter(this::isJavaSource)
                        .forEach(sources::add);
            }
        }
        return new ArrayList<>(sources);
    }

    private boolean isJavaSource(Path path) {
        if (!path.getFileName().toString().endsWith(".java")) {
            return false;
        }
        if (config.shouldExclude(path.toString())) {
            logger.debug("Excluded {}", path);
            return false;
        }
        return true;
    }
}
