package com.raditha.tersify.rules;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.tersify.analysis.ComplexityClassifier;
import com.raditha.tersify.model.Category;
import com.raditha.tersify.model.Severity;
import com.raditha.tersify.util.ASTUtility;

import java.util.Optional;

/**
 * Converts an if/else that assigns the same target in both branches into one
 * assignment of a conditional expression:
 * <pre>{@code
 * if (x > 0) { y = 1; } else { y = 2; }   =>   y = x > 0 ? 1 : 2;
 * }</pre>
 * Only simple conditions and single-line, non-binary values are reported. Values that
 * {@code ?:} would convert to a common type are left alone.
 */
public class IfToConditionalRule extends AbstractRewriteRule<IfStmt> {

    public static final String ID = "IfToConditional";

    public IfToConditionalRule() {
        this(defaultDescriptor());
    }

    public IfToConditionalRule(RuleDescriptor descriptor) {
        super(descriptor, IfStmt.class);
    }

    public static RuleDescriptor defaultDescriptor() {
        return new RuleDescriptor(
                ID,
                "Convert 'if' to '?:'",
                "Convert to '?:' expression",
                "Convert to '?:' expression",
                Severity.INFO,
                Category.OPPORTUNITIES,
                ID);
    }

    /**
     * Extract the condition, target and both assignments of an if/else statement.
     *
     * @return the parts, or empty if the statement is not an if/else with one assignment
     *         to the same target, using the same operator, in each branch
     */
    public static Optional<ConditionalAssignment> parse(IfStmt ifStmt) {
        if (ifStmt == null || ifStmt.getElseStmt().isEmpty()) {
            return Optional.empty();
        }

        Optional<AssignExpr> trueAssignment = singleAssignment(ifStmt.getThenStmt());
        Optional<AssignExpr> falseAssignment = singleAssignment(ifStmt.getElseStmt().get());
        if (trueAssignment.isEmpty() || falseAssignment.isEmpty()) {
            return Optional.empty();
        }

        AssignExpr whenTrue = trueAssignment.get();
        AssignExpr whenFalse = falseAssignment.get();
        if (whenTrue.getOperator() != whenFalse.getOperator()
                || !ASTUtility.structurallyEqual(whenTrue.getTarget(), whenFalse.getTarget())) {
            return Optional.empty();
        }

        return Optional.of(new ConditionalAssignment(ifStmt.getCondition(), whenTrue.getTarget(), whenTrue, whenFalse));
    }

    /**
     * Whether the extracted parts read well as a conditional expression.
     */
    public static boolean isSimpleEnough(ConditionalAssignment assignment) {
        return !ComplexityClassifier.isComplexCondition(assignment.condition())
                && !ComplexityClassifier.isComplexExpression(assignment.trueValue())
                && !ComplexityClassifier.isComplexExpression(assignment.falseValue());
    }

    /**
     * Whether {@code ?:} leaves both values with the type they have as separate assignments.
     * <p>
     * Primitive literals of different kinds would be promoted to one numeric type
     * ({@code c ? 1 : 2.0} is always a double). A primitive literal next to an expression of
     * unknown type could unbox it. Reference literals such as strings and {@code null} never
     * trigger either conversion.
     */
    public static boolean keepsValueTypes(ConditionalAssignment assignment) {
        Optional<String> whenTrue = primitiveLiteralKind(assignment.trueValue());
        Optional<String> whenFalse = primitiveLiteralKind(assignment.falseValue());
        if (whenTrue.isEmpty() && whenFalse.isEmpty()) {
            return true;
        }
        if (whenTrue.isPresent() && whenFalse.isPresent()) {
            return whenTrue.equals(whenFalse);
        }
        Expression other = whenTrue.isPresent() ? assignment.falseValue() : assignment.trueValue();
        return other instanceof NullLiteralExpr
                || other instanceof StringLiteralExpr
                || other instanceof TextBlockLiteralExpr;
    }

    @Override
    protected boolean detect(IfStmt node) {
        return parse(node)
                .filter(IfToConditionalRule::isSimpleEnough)
                .filter(IfToConditionalRule::keepsValueTypes)
                .isPresent();
    }

    @Override
    protected Node buildReplacement(IfStmt node) {
        return parse(node)
                .map(ConditionalAssignment::toStatement)
                .orElseThrow(() -> new IllegalStateException("Not a conditional assignment: " + node));
    }

    /**
     * The diagnostic points at the {@code if} keyword.
     */
    @Override
    protected Optional<Range> diagnosticRange(IfStmt node) {
        return node.getRange().map(range -> new Range(range.begin, range.begin.right(1)));
    }

    private static Optional<AssignExpr> singleAssignment(Statement branch) {
        Statement statement = branch;
        if (branch instanceof BlockStmt block) {
            if (block.getStatements().size() != 1) {
                return Optional.empty();
            }
            statement = block.getStatement(0);
        }
        if (statement instanceof ExpressionStmt expressionStmt
                && expressionStmt.getExpression() instanceof AssignExpr assign) {
            return Optional.of(assign);
        }
        return Optional.empty();
    }

    /**
     * The primitive type of a literal, with sign prefixes looked through.
     */
    private static Optional<String> primitiveLiteralKind(Expression value) {
        if (value instanceof UnaryExpr unary
                && (unary.getOperator() == UnaryExpr.Operator.MINUS || unary.getOperator() == UnaryExpr.Operator.PLUS)) {
            // a signed char is an int
            return primitiveLiteralKind(unary.getExpression()).map(kind -> "char".equals(kind) ? "int" : kind);
        }
        if (value instanceof IntegerLiteralExpr) {
            return Optional.of("int");
        }
        if (value instanceof LongLiteralExpr) {
            return Optional.of("long");
        }
        if (value instanceof DoubleLiteralExpr literal) {
            String text = literal.getValue();
            return Optional.of(text.endsWith("f") || text.endsWith("F") ? "float" : "double");
        }
        if (value instanceof CharLiteralExpr) {
            return Optional.of("char");
        }
        if (value instanceof BooleanLiteralExpr) {
            return Optional.of("boolean");
        }
        return Optional.empty();
    }
}
