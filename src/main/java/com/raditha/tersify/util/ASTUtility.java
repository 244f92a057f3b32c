package com.raditha.tersify.util;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.visitor.NoCommentEqualsVisitor;
import com.github.javaparser.metamodel.PropertyMetaModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for common AST operations.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * The syntactic children of a node: every child except comments, in source order.
     * <p>
     * When any child has no position (it was built by hand or put in place by an edit) the
     * children are returned in the order the node's constructor takes them. JavaParser moves a
     * replaced child to the end of {@link Node#getChildNodes()}, so that list cannot be used as is.
     *
     * @param node the parent node
     * @return a new mutable list of the children
     */
    public static List<Node> children(Node node) {
        List<Node> children = withoutComments(node.getChildNodes());
        if (children.stream().allMatch(c -> c.getRange().isPresent())) {
            children.sort(Comparator.comparing((Node c) -> beginOf(c)));
            return children;
        }
        List<Node> ordered = constructionOrder(node);
        return ordered.size() == children.size() ? ordered : children;
    }

    /**
     * A clone is built through the node's constructor, so its children are in declaration
     * order. Each clone child is mapped back to the original through the property holding it.
     */
    private static List<Node> constructionOrder(Node node) {
        Node copy = node.clone();
        Map<Node, Node> originals = new IdentityHashMap<>();
        for (PropertyMetaModel property : node.getMetaModel().getAllPropertyMetaModels()) {
            pair(property.getValue(node), property.getValue(copy), originals);
        }

        List<Node> ordered = new ArrayList<>();
        for (Node twin : withoutComments(copy.getChildNodes())) {
            Node original = originals.get(twin);
            if (original != null) {
                ordered.add(original);
            }
        }
        return ordered;
    }

    private static void pair(Object original, Object copy, Map<Node, Node> originals) {
        if (original instanceof NodeList<?> list && copy instanceof NodeList<?> copies) {
            for (int i = 0; i < Math.min(list.size(), copies.size()); i++) {
                originals.put(copies.get(i), list.get(i));
            }
        } else if (original instanceof Node child && copy instanceof Node twin) {
            originals.put(twin, child);
        }
    }

    private static List<Node> withoutComments(List<Node> nodes) {
        List<Node> children = new ArrayList<>();
        for (Node child : nodes) {
            if (!(child instanceof Comment)) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * The token a node carries outside of its children: an identifier, a literal value or an operator.
     * Unary operators are named by their enum constant ({@code PREFIX_INCREMENT}), the others by
     * their source text.
     *
     * @return the token, or null for nodes that are fully described by their children
     */
    public static String token(Node node) {
        if (node instanceof SimpleName simpleName) {
            return simpleName.getIdentifier();
        }
        if (node instanceof Name name) {
            return name.asString();
        }
        if (node instanceof LiteralStringValueExpr literal) {
            return literal.getValue();
        }
        if (node instanceof BooleanLiteralExpr literal) {
            return String.valueOf(literal.getValue());
        }
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator().asString();
        }
        if (node instanceof UnaryExpr unary) {
            // ++x and x++ print the same operator
            return unary.getOperator().name();
        }
        if (node instanceof AssignExpr assign) {
            return assign.getOperator().asString();
        }
        return null;
    }

    /**
     * Structural equality of two nodes, ignoring comments, positions and formatting.
     * Two absent nodes are equal.
     */
    public static boolean structurallyEqual(Node a, Node b) {
        if (a == null || b == null) {
            return a == b;
        }
        return NoCommentEqualsVisitor.equals(a, b);
    }

    /**
     * Check if a node spans more than one source line. Nodes without a position count as single-line.
     */
    public static boolean isMultiLine(Node node) {
        return node.getRange()
                .map(range -> range.begin.line != range.end.line)
                .orElse(false);
    }

    private static Position beginOf(Node node) {
        return node.getRange().orElseThrow().begin;
    }
}
