package com.raditha.tersify.pattern;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SimpleName;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of an expected syntax tree shape.
 * <p>
 * Patterns are immutable and hold no match state, so a single instance can be
 * built once and matched against any number of candidates, from any thread.
 * Matching is done by {@link PatternMatcher}.
 */
public sealed interface Pattern
        permits Pattern.Fixed, Pattern.AnyNode, Pattern.AnyNodeOrNull, Pattern.Backreference, Pattern.Choice {

    /**
     * Matches a node of exactly the given class whose children match {@code children} in order.
     *
     * @param kind     the node class to match
     * @param token    identifier, literal value or operator the node must carry, or null for any
     * @param children patterns for the node's children, in source order
     */
    record Fixed(Class<? extends Node> kind, String token, List<Pattern> children) implements Pattern {
        public Fixed {
            Objects.requireNonNull(kind, "kind");
            children = List.copyOf(children);
        }
    }

    /**
     * Matches exactly one present node and binds it under {@code name}.
     * A null name matches without binding.
     */
    record AnyNode(String name) implements Pattern {
    }

    /**
     * Matches one present node or an absent one (for example a missing argument).
     */
    record AnyNodeOrNull(String name) implements Pattern {
        public AnyNodeOrNull {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Matches a node structurally equal to the first node already bound under {@code name}.
     */
    record Backreference(String name) implements Pattern {
        public Backreference {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Matches if any alternative matches; alternatives are tried in order.
     */
    record Choice(List<Pattern> alternatives) implements Pattern {
        public Choice {
            alternatives = List.copyOf(alternatives);
            if (alternatives.isEmpty()) {
                throw new IllegalArgumentException("Choice needs at least one alternative");
            }
        }
    }

    static Pattern fixed(Class<? extends Node> kind, Pattern... children) {
        return new Fixed(kind, null, List.of(children));
    }

    static Pattern fixed(Class<? extends Node> kind, String token, Pattern... children) {
        return new Fixed(kind, token, List.of(children));
    }

    /**
     * Matches a {@link SimpleName} with the given identifier.
     */
    static Pattern name(String identifier) {
        return new Fixed(SimpleName.class, Objects.requireNonNull(identifier, "identifier"), List.of());
    }

    static Pattern any() {
        return new AnyNode(null);
    }

    static Pattern any(String name) {
        return new AnyNode(Objects.requireNonNull(name, "name"));
    }

    static Pattern anyOrNull(String name) {
        return new AnyNodeOrNull(name);
    }

    static Pattern backreference(String name) {
        return new Backreference(name);
    }

    static Pattern choice(Pattern... alternatives) {
        return new Choice(List.of(alternatives));
    }
}
