package com.raditha.tersify.analyzer;

import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.model.Severity;

import java.nio.file.Path;
import java.util.List;

/**
 * Analysis results for one source file.
 *
 * @param sourceFile    the analyzed file
 * @param diagnostics   diagnostics in source order
 * @param parseProblems parser messages; non-empty when the file could not be parsed and was skipped
 */
public record AnalysisReport(
        Path sourceFile,
        List<Diagnostic> diagnostics,
        List<String> parseProblems) {

    public AnalysisReport {
        diagnostics = List.copyOf(diagnostics);
        parseProblems = parseProblems == null ? List.of() : List.copyOf(parseProblems);
    }

    public static AnalysisReport skipped(Path sourceFile, List<String> parseProblems) {
        return new AnalysisReport(sourceFile, List.of(), parseProblems);
    }

    public boolean isParsed() {
        return parseProblems.isEmpty();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Count diagnostics with at least the given severity.
     */
    public long countAtLeast(Severity severity) {
        return diagnostics.stream()
                .filter(d -> d.severity().isAtLeast(severity))
                .count();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        if (!isParsed()) {
            return String.format("%s: skipped (%d parse problems)", sourceFile, parseProblems.size());
        }
        return String.format("%s: %d diagnostics", sourceFile, diagnostics.size());
    }
}
