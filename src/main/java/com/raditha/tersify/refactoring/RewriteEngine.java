package com.raditha.tersify.refactoring;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.raditha.tersify.analyzer.RewriteAnalyzer;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.rules.Rewrite;
import com.raditha.tersify.rules.RewriteRule;
import com.raditha.tersify.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applies the rewrites proposed by rules.
 * <p>
 * Before editing, the construct at a diagnostic's location is found again and re-checked
 * by its rule. If it has changed or gone, nothing is edited.
 */
public class RewriteEngine {

    private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

    private static final int MAX_FIXES = 10_000;

    private final RewriteAnalyzer analyzer;
    private final Map<String, RewriteRule<?>> rulesById = new LinkedHashMap<>();
    private final JavaParser parser;

    public RewriteEngine(RewriteAnalyzer analyzer, ParserConfiguration parserConfiguration) {
        this.analyzer = analyzer;
        this.parser = new JavaParser(parserConfiguration);
        for (RewriteRule<?> rule : analyzer.getRules()) {
            rulesById.put(rule.id(), rule);
        }
    }

    /**
     * Apply the fix for one diagnostic to a copy of the tree.
     *
     * @param cu         the tree the diagnostic refers to, possibly re-parsed since; never modified
     * @param diagnostic a diagnostic produced by one of this engine's rules
     * @return the edited copy, or empty if the construct at the location no longer qualifies
     */
    public Optional<CodeFix> fix(CompilationUnit cu, Diagnostic diagnostic) {
        RewriteRule<?> rule = rulesById.get(diagnostic.ruleId());
        if (rule == null) {
            logger.debug("No rule '{}' registered; ignoring fix request", diagnostic.ruleId());
            return Optional.empty();
        }
        return fixOnCopy(rule, cu, diagnostic);
    }

    /**
     * Apply every available fix to a source text, printing the result with the original
     * formatting kept outside of the rewritten constructs.
     *
     * @throws IllegalArgumentException if the source does not parse
     */
    public FixResult fixAll(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getMessage)
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Source does not parse: " + problems);
        }

        CompilationUnit cu = result.getResult().get();
        LexicalPreservingPrinter.setup(cu);

        List<String> descriptions = new ArrayList<>();
        while (descriptions.size() < MAX_FIXES) {
            List<Diagnostic> diagnostics = analyzer.analyze(cu);
            if (diagnostics.isEmpty()) {
                break;
            }
            // last in pre-order first, so nested constructs are rewritten before their parents
            Diagnostic next = diagnostics.get(diagnostics.size() - 1);
            Optional<Rewrite> applied = fixInPlace(rulesById.get(next.ruleId()), cu, next);
            if (applied.isEmpty()) {
                logger.warn("Could not apply {} at {}; stopping", next.ruleId(), next.location());
                break;
            }
            descriptions.add(applied.get().description());
        }

        if (descriptions.isEmpty()) {
            return new FixResult(source, 0, List.of());
        }
        return new FixResult(print(cu), descriptions.size(), descriptions);
    }

    private <T extends Node> Optional<CodeFix> fixOnCopy(RewriteRule<T> rule, CompilationUnit cu,
            Diagnostic diagnostic) {
        Optional<T> located = rule.locate(cu, diagnostic.location());
        if (located.isEmpty()) {
            logger.debug("Nothing to fix for {} at {}: location is stale", rule.id(), diagnostic.location());
            return Optional.empty();
        }

        // clones keep token ranges, so the twin is found by the same location
        CompilationUnit copy = cu.clone();
        Optional<Rewrite> rewrite = rule.locate(copy, diagnostic.location())
                .filter(twin -> ASTUtility.structurallyEqual(twin, located.get()))
                .flatMap(rule::rewrite);
        if (rewrite.isEmpty()) {
            logger.debug("Nothing to fix for {} at {}: construct no longer matches", rule.id(),
                    diagnostic.location());
            return Optional.empty();
        }
        if (!replace(rewrite.get())) {
            return Optional.empty();
        }
        return Optional.of(new CodeFix(copy, rewrite.get().description()));
    }

    private <T extends Node> Optional<Rewrite> fixInPlace(RewriteRule<T> rule, CompilationUnit cu,
            Diagnostic diagnostic) {
        return rule.locate(cu, diagnostic.location())
                .flatMap(rule::rewrite)
                .map(RewriteEngine::withoutRecordedText)
                .filter(RewriteEngine::replace);
    }

    /**
     * Clones copy the original text recorded for lexical preservation. The replacement is new
     * code, so that text is dropped and it gets pretty printed.
     */
    private static Rewrite withoutRecordedText(Rewrite rewrite) {
        rewrite.replacement().walk(node -> node.removeData(LexicalPreservingPrinter.NODE_TEXT_DATA));
        return rewrite;
    }

    private static boolean replace(Rewrite rewrite) {
        boolean replaced = rewrite.target().replace(rewrite.replacement());
        if (!replaced) {
            logger.warn("Could not replace {}: node has no parent", rewrite.target().getClass().getSimpleName());
        }
        return replaced;
    }

    private static String print(CompilationUnit cu) {
        try {
            return LexicalPreservingPrinter.print(cu);
        } catch (RuntimeException e) {
            logger.warn("Could not preserve original formatting ({}); pretty printing instead", e.getMessage());
            return cu.toString();
        }
    }
}
