package com.raditha.tersify.pattern;

import com.github.javaparser.ast.Node;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of matching a {@link Pattern} against a node.
 * A failed match carries no captures at all.
 */
public final class Match {

    private static final Match FAILURE = new Match(null);

    private final Captures captures;

    private Match(Captures captures) {
        this.captures = captures;
    }

    static Match success(Captures captures) {
        return new Match(captures);
    }

    static Match failure() {
        return FAILURE;
    }

    public boolean isSuccess() {
        return captures != null;
    }

    /**
     * Nodes captured under a name. Empty for failed matches.
     */
    public List<Node> get(String name) {
        return isSuccess() ? captures.get(name) : List.of();
    }

    /**
     * The first node captured under a name, if it exists and has the expected type.
     */
    public <T extends Node> Optional<T> first(String name, Class<T> type) {
        return get(name).stream()
                .findFirst()
                .filter(type::isInstance)
                .map(type::cast);
    }

    public Map<String, List<Node>> captures() {
        return isSuccess() ? captures.asMap() : Map.of();
    }

    @Override
    public String toString() {
        return isSuccess() ? "Match[" + captures + "]" : "Match[failed]";
    }
}
