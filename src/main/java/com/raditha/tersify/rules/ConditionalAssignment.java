package com.raditha.tersify.rules;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ExpressionStmt;

/**
 * The parts of an if/else statement that assigns the same target in both branches.
 *
 * @param condition       the if condition
 * @param target          the assigned target, structurally equal in both branches
 * @param trueAssignment  the assignment in the then branch
 * @param falseAssignment the assignment in the else branch
 */
public record ConditionalAssignment(
        Expression condition,
        Expression target,
        AssignExpr trueAssignment,
        AssignExpr falseAssignment) {

    public Expression trueValue() {
        return trueAssignment.getValue();
    }

    public Expression falseValue() {
        return falseAssignment.getValue();
    }

    public AssignExpr.Operator operator() {
        return trueAssignment.getOperator();
    }

    /**
     * Build {@code target op condition ? trueValue : falseValue;} from clones of the parts.
     */
    public ExpressionStmt toStatement() {
        ConditionalExpr conditional = new ConditionalExpr(
                condition.clone(),
                operand(trueValue()),
                operand(falseValue()));
        return new ExpressionStmt(new AssignExpr(target.clone(), conditional, operator()));
    }

    // assignments bind looser than ?: and must keep their own parentheses
    private static Expression operand(Expression value) {
        Expression copy = value.clone();
        return copy instanceof AssignExpr ? new EnclosedExpr(copy) : copy;
    }
}
