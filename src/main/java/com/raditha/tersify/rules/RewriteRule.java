package com.raditha.tersify.rules;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.model.Location;

import java.util.Optional;

/**
 * A rule that recognises one kind of construct and proposes a rewrite for it.
 * <p>
 * Rules are stateless: analysing or rewriting a node never modifies it, so one
 * instance can serve any number of trees concurrently. A rule that does not apply
 * returns an empty result; it never throws for a non-matching node.
 *
 * @param <T> the node type the rule inspects
 */
public interface RewriteRule<T extends Node> {

    RuleDescriptor descriptor();

    /**
     * The node type the analyzer should offer to this rule.
     */
    Class<T> targetType();

    /**
     * Report a diagnostic if the rule applies to the node.
     */
    Optional<Diagnostic> analyze(T node);

    /**
     * Build the replacement for the node, if the rule applies to it.
     */
    Optional<Rewrite> rewrite(T node);

    /**
     * Find the node a diagnostic of this rule points at.
     *
     * @return the node at that location, or empty if no node of the target type is there
     */
    Optional<T> locate(CompilationUnit cu, Location location);

    default String id() {
        return descriptor().id();
    }
}
