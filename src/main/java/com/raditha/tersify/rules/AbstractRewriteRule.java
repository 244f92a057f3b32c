package com.raditha.tersify.rules;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.model.Location;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class for rules that split detection from the construction of the replacement.
 *
 * @param <T> the node type the rule inspects
 */
public abstract class AbstractRewriteRule<T extends Node> implements RewriteRule<T> {

    private final RuleDescriptor descriptor;
    private final Class<T> targetType;

    protected AbstractRewriteRule(RuleDescriptor descriptor, Class<T> targetType) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.targetType = Objects.requireNonNull(targetType, "targetType");
    }

    /**
     * Whether the rule applies to the node and the rewrite is worth proposing.
     */
    protected abstract boolean detect(T node);

    /**
     * Build the replacement. Only called for nodes accepted by {@link #detect}.
     */
    protected abstract Node buildReplacement(T node);

    /**
     * The span a diagnostic for this node points at. Empty for nodes without a position.
     */
    protected Optional<Range> diagnosticRange(T node) {
        return node.getRange();
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Class<T> targetType() {
        return targetType;
    }

    @Override
    public Optional<Diagnostic> analyze(T node) {
        Optional<Range> range = diagnosticRange(node);
        if (range.isEmpty() || !detect(node)) {
            return Optional.empty();
        }
        return Optional.of(new Diagnostic(
                descriptor.id(),
                descriptor.severity(),
                descriptor.message(),
                Location.from(range.get())));
    }

    @Override
    public Optional<Rewrite> rewrite(T node) {
        if (!detect(node)) {
            return Optional.empty();
        }
        return Optional.of(new Rewrite(node, buildReplacement(node), descriptor.fixTitle()));
    }

    @Override
    public Optional<T> locate(CompilationUnit cu, Location location) {
        return cu.findFirst(targetType, node -> diagnosticRange(node)
                .map(Location::from)
                .filter(location::equals)
                .isPresent());
    }
}
