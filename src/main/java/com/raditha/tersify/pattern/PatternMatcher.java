package com.raditha.tersify.pattern;

import com.github.javaparser.ast.Node;
import com.raditha.tersify.util.ASTUtility;

import java.util.List;
import java.util.Optional;

/**
 * Matches {@link Pattern}s against JavaParser syntax trees.
 * <p>
 * Children are visited depth first, left to right, and a capture is only visible to
 * pattern elements visited after it. The matcher keeps no state between calls and
 * never modifies the candidate tree.
 */
public class PatternMatcher {

    /**
     * Match a pattern against a candidate node.
     *
     * @param pattern   the expected shape
     * @param candidate the node to test, or null for an absent node
     * @return a successful match with its captures, or a failure
     */
    public Match match(Pattern pattern, Node candidate) {
        return matchNode(pattern, candidate, Captures.empty())
                .map(Match::success)
                .orElseGet(Match::failure);
    }

    private Optional<Captures> matchNode(Pattern pattern, Node candidate, Captures captures) {
        if (pattern instanceof Pattern.Fixed fixed) {
            return matchFixed(fixed, candidate, captures);
        }
        if (pattern instanceof Pattern.AnyNode any) {
            if (candidate == null) {
                return Optional.empty();
            }
            return any.name() == null ? Optional.of(captures) : captures.bind(any.name(), candidate);
        }
        if (pattern instanceof Pattern.AnyNodeOrNull anyOrNull) {
            return captures.bind(anyOrNull.name(), candidate);
        }
        if (pattern instanceof Pattern.Backreference backreference) {
            return matchBackreference(backreference, candidate, captures);
        }
        if (pattern instanceof Pattern.Choice choice) {
            for (Pattern alternative : choice.alternatives()) {
                Optional<Captures> result = matchNode(alternative, candidate, captures);
                if (result.isPresent()) {
                    return result;
                }
            }
            return Optional.empty();
        }
        throw new IllegalStateException("Unknown pattern variant: " + pattern.getClass().getName());
    }

    private Optional<Captures> matchFixed(Pattern.Fixed fixed, Node candidate, Captures captures) {
        if (candidate == null || candidate.getClass() != fixed.kind()) {
            return Optional.empty();
        }
        if (fixed.token() != null && !fixed.token().equals(ASTUtility.token(candidate))) {
            return Optional.empty();
        }
        return matchChildren(fixed.children(), 0, ASTUtility.children(candidate), 0, captures);
    }

    private Optional<Captures> matchBackreference(Pattern.Backreference backreference, Node candidate,
            Captures captures) {
        if (!captures.isBound(backreference.name())) {
            return Optional.empty();
        }
        List<Node> bound = captures.get(backreference.name());
        if (bound.isEmpty()) {
            return candidate == null ? Optional.of(captures) : Optional.empty();
        }
        if (candidate != null && ASTUtility.structurallyEqual(bound.get(0), candidate)) {
            return Optional.of(captures);
        }
        return Optional.empty();
    }

    /**
     * Match child patterns against child nodes as a sequence. Each pattern consumes one node,
     * except that a pattern able to match absence may also leave the current node for the
     * next pattern. Consuming is tried first. All nodes must be consumed.
     */
    private Optional<Captures> matchChildren(List<Pattern> patterns, int patternIndex, List<Node> nodes,
            int nodeIndex, Captures captures) {
        if (patternIndex == patterns.size()) {
            return nodeIndex == nodes.size() ? Optional.of(captures) : Optional.empty();
        }
        Pattern pattern = patterns.get(patternIndex);

        if (nodeIndex < nodes.size()) {
            Optional<Captures> consumed = matchNode(pattern, nodes.get(nodeIndex), captures)
                    .flatMap(c -> matchChildren(patterns, patternIndex + 1, nodes, nodeIndex + 1, c));
            if (consumed.isPresent()) {
                return consumed;
            }
        }
        return matchNode(pattern, null, captures)
                .flatMap(c -> matchChildren(patterns, patternIndex + 1, nodes, nodeIndex, c));
    }
}
