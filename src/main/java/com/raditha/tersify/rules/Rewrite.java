package com.raditha.tersify.rules;

import com.github.javaparser.ast.Node;

/**
 * A proposed replacement of one node by a newly built one.
 * The replacement shares no nodes with the tree {@code target} belongs to.
 *
 * @param target      node to replace
 * @param replacement node to put in its place
 * @param description what the replacement does
 */
public record Rewrite(Node target, Node replacement, String description) {
}
