package com.raditha.tersify.pattern;

import com.github.javaparser.ast.Node;
import com.raditha.tersify.util.ASTUtility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable capture table built up during one match attempt.
 * <p>
 * Maps a capture name to the nodes bound to it, in binding order. A name bound to an
 * absent node maps to an empty list. Binding never mutates: {@link #bind} returns a
 * new table, so a failed branch of a match leaves nothing behind.
 */
public final class Captures {

    private static final Captures EMPTY = new Captures(Map.of());

    private final Map<String, List<Node>> bindings;

    private Captures(Map<String, List<Node>> bindings) {
        this.bindings = bindings;
    }

    public static Captures empty() {
        return EMPTY;
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Nodes bound to a name, empty if the name is unbound or bound to an absent node.
     */
    public List<Node> get(String name) {
        return bindings.getOrDefault(name, List.of());
    }

    /**
     * Bind a node (or absence, when {@code node} is null) to a name.
     * <p>
     * A name that is already bound only accepts a node structurally equal to its first
     * binding, and a name bound to absence only accepts absence.
     *
     * @return the extended table, or empty if the binding conflicts with an earlier one
     */
    public Optional<Captures> bind(String name, Node node) {
        List<Node> existing = bindings.get(name);
        if (existing != null) {
            if (existing.isEmpty()) {
                return node == null ? Optional.of(this) : Optional.empty();
            }
            if (!ASTUtility.structurallyEqual(existing.get(0), node)) {
                return Optional.empty();
            }
        }

        List<Node> nodes = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        if (node != null) {
            nodes.add(node);
        }
        Map<String, List<Node>> extended = new LinkedHashMap<>(bindings);
        extended.put(name, Collections.unmodifiableList(nodes));
        return Optional.of(new Captures(Collections.unmodifiableMap(extended)));
    }

    public Map<String, List<Node>> asMap() {
        return bindings;
    }

    @Override
    public String toString() {
        return "Captures" + bindings;
    }
}
