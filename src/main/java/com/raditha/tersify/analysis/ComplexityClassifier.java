package com.raditha.tersify.analysis;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.raditha.tersify.util.ASTUtility;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether expressions are simple enough to sit inside a conditional expression.
 * <p>
 * A structurally valid rewrite can still make code harder to read. These checks keep
 * the values of a {@code ?:} short and its condition a plain comparison.
 */
public class ComplexityClassifier {

    private static final Set<BinaryExpr.Operator> COMPARISONS = EnumSet.of(
            BinaryExpr.Operator.GREATER,
            BinaryExpr.Operator.GREATER_EQUALS,
            BinaryExpr.Operator.EQUALS,
            BinaryExpr.Operator.NOT_EQUALS,
            BinaryExpr.Operator.LESS,
            BinaryExpr.Operator.LESS_EQUALS);

    private ComplexityClassifier() {
        /* this is only a utility class */
    }

    /**
     * A value is complex when it spans several lines, is itself a conditional or is a binary expression.
     */
    public static boolean isComplexExpression(Expression expr) {
        return ASTUtility.isMultiLine(expr)
                || expr instanceof ConditionalExpr
                || expr instanceof BinaryExpr;
    }

    /**
     * A condition is simple when it is a single-line literal, name, field access, method call
     * or comparison. Parentheses and prefix operators are looked through; every other
     * expression kind is complex.
     */
    public static boolean isComplexCondition(Expression expr) {
        if (ASTUtility.isMultiLine(expr)) {
            return true;
        }

        if (expr instanceof LiteralExpr
                || expr instanceof NameExpr
                || expr instanceof FieldAccessExpr
                || expr instanceof MethodCallExpr) {
            return false;
        }

        if (expr instanceof EnclosedExpr enclosed) {
            return isComplexCondition(enclosed.getInner());
        }

        if (expr instanceof UnaryExpr unary && unary.isPrefix()) {
            return isComplexCondition(unary.getExpression());
        }

        if (expr instanceof BinaryExpr binary) {
            return !COMPARISONS.contains(binary.getOperator());
        }
        return true;
    }
}
