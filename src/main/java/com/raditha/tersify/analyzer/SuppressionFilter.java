package com.raditha.tersify.analyzer;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.raditha.tersify.rules.RuleDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a diagnostic is disabled by an enclosing {@code @SuppressWarnings}.
 * <p>
 * Accepted values are the rule's suppression keyword and {@code "tersify:<keyword>"}.
 * {@code "tersify"} and {@code "all"} disable every rule.
 */
public class SuppressionFilter {

    static final String PREFIX = "tersify";
    static final String ALL = "all";

    public boolean isSuppressed(Node node, RuleDescriptor descriptor) {
        String keyword = descriptor.suppressionKeyword();
        Optional<Node> current = Optional.of(node);
        while (current.isPresent()) {
            Node n = current.get();
            if (n instanceof NodeWithAnnotations<?> annotated && suppresses(annotated, keyword)) {
                return true;
            }
            current = n.getParentNode();
        }
        return false;
    }

    private boolean suppresses(NodeWithAnnotations<?> annotated, String keyword) {
        return annotated.getAnnotations().stream()
                .filter(a -> a.getName().getIdentifier().equals("SuppressWarnings"))
                .flatMap(a -> suppressedNames(a).stream())
                .anyMatch(name -> name.equals(keyword)
                        || name.equals(PREFIX + ":" + keyword)
                        || name.equals(PREFIX)
                        || name.equals(ALL));
    }

    private List<String> suppressedNames(AnnotationExpr annotation) {
        Expression value = null;
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            value = single.getMemberValue();
        } else if (annotation instanceof NormalAnnotationExpr normal) {
            value = normal.getPairs().stream()
                    .filter(p -> p.getNameAsString().equals("value"))
                    .map(MemberValuePair::getValue)
                    .findFirst()
                    .orElse(null);
        }

        List<String> names = new ArrayList<>();
        if (value instanceof StringLiteralExpr literal) {
            names.add(literal.asString());
        } else if (value instanceof ArrayInitializerExpr array) {
            for (Expression element : array.getValues()) {
                if (element instanceof StringLiteralExpr literal) {
                    names.add(literal.asString());
                }
            }
        }
        return names;
    }
}
