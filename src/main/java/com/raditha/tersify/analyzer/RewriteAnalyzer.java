package com.raditha.tersify.analyzer;

import com.github.javaparser.ast.Node;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.rules.RewriteRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Walks a syntax tree and offers every node to the rules that inspect its type.
 * <p>
 * Nodes are visited in pre-order, so diagnostics come out in source order with enclosing
 * constructs before the ones nested in them. Cancellation is checked between nodes;
 * the rules themselves never see it.
 */
public class RewriteAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RewriteAnalyzer.class);

    private final List<RewriteRule<?>> rules;
    private final SuppressionFilter suppressionFilter;

    public RewriteAnalyzer(List<RewriteRule<?>> rules) {
        this(rules, new SuppressionFilter());
    }

    public RewriteAnalyzer(List<RewriteRule<?>> rules, SuppressionFilter suppressionFilter) {
        this.rules = List.copyOf(rules);
        this.suppressionFilter = suppressionFilter;
    }

    public List<RewriteRule<?>> getRules() {
        return rules;
    }

    /**
     * Analyze a tree without cancellation.
     */
    public List<Diagnostic> analyze(Node root) {
        return analyze(root, () -> false);
    }

    /**
     * Analyze a tree.
     *
     * @param root      root of the tree, usually a compilation unit
     * @param cancelled polled before each node
     * @return diagnostics in visiting order
     * @throws CancellationException if {@code cancelled} reports true; the tree is left untouched
     */
    public List<Diagnostic> analyze(Node root, BooleanSupplier cancelled) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        root.walk(Node.TreeTraversal.PREORDER, node -> {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Analysis cancelled");
            }
            for (RewriteRule<?> rule : rules) {
                analyzeNode(rule, node).ifPresent(diagnostics::add);
            }
        });
        return diagnostics;
    }

    private <T extends Node> Optional<Diagnostic> analyzeNode(RewriteRule<T> rule, Node node) {
        if (!rule.targetType().isInstance(node)) {
            return Optional.empty();
        }
        Optional<Diagnostic> diagnostic = rule.analyze(rule.targetType().cast(node));
        if (diagnostic.isPresent() && suppressionFilter.isSuppressed(node, rule.descriptor())) {
            logger.debug("Suppressed {} at {}", rule.id(), diagnostic.get().location());
            return Optional.empty();
        }
        return diagnostic;
    }
}
