package com.raditha.tersify.rules;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.raditha.tersify.model.Category;
import com.raditha.tersify.model.Severity;
import com.raditha.tersify.pattern.Match;
import com.raditha.tersify.pattern.Pattern;
import com.raditha.tersify.pattern.PatternMatcher;

import java.util.Objects;

import static com.raditha.tersify.pattern.Pattern.any;
import static com.raditha.tersify.pattern.Pattern.anyOrNull;
import static com.raditha.tersify.pattern.Pattern.backreference;
import static com.raditha.tersify.pattern.Pattern.choice;
import static com.raditha.tersify.pattern.Pattern.fixed;
import static com.raditha.tersify.pattern.Pattern.name;

/**
 * Replaces an existence check followed by a first-match lookup with a single find-or-default call:
 * <pre>{@code
 * items.any(p) ? items.first(p) : null   =>   items.firstOrDefault(p)
 * }</pre>
 * Receiver and predicate must be the same in both calls; the fallback may be {@code null}
 * or a cast {@code null}.
 */
public class FirstOrDefaultRule extends AbstractRewriteRule<ConditionalExpr> {

    public static final String ID = "ReplaceWithFirstOrDefault";

    static final String EXPR = "expr";
    static final String PARAM = "param";

    private final MethodNames methodNames;
    private final Pattern pattern;
    private final PatternMatcher matcher = new PatternMatcher();

    /**
     * Names of the methods the rule looks for and the one it rewrites to.
     *
     * @param any         existence check, {@code any} by default
     * @param first       first-match lookup, {@code first} by default
     * @param replacement find-or-default call, {@code firstOrDefault} by default
     */
    public record MethodNames(String any, String first, String replacement) {
        public MethodNames {
            Objects.requireNonNull(any, "any");
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(replacement, "replacement");
        }

        public static MethodNames defaults() {
            return new MethodNames("any", "first", "firstOrDefault");
        }
    }

    public FirstOrDefaultRule() {
        this(defaultDescriptor(MethodNames.defaults()), MethodNames.defaults());
    }

    public FirstOrDefaultRule(RuleDescriptor descriptor, MethodNames methodNames) {
        super(descriptor, ConditionalExpr.class);
        this.methodNames = methodNames;
        this.pattern = fixed(ConditionalExpr.class,
                fixed(MethodCallExpr.class, any(EXPR), name(methodNames.any()), anyOrNull(PARAM)),
                fixed(MethodCallExpr.class, backreference(EXPR), name(methodNames.first()), backreference(PARAM)),
                choice(
                        fixed(NullLiteralExpr.class),
                        fixed(CastExpr.class, any(), fixed(NullLiteralExpr.class))));
    }

    public static RuleDescriptor defaultDescriptor(MethodNames methodNames) {
        String call = "'" + methodNames.replacement() + "()'";
        return new RuleDescriptor(
                ID,
                "Replace with " + call,
                "Expression can be simplified to " + call,
                "Replace with " + call,
                Severity.WARNING,
                Category.PRACTICES_AND_IMPROVEMENTS,
                ID);
    }

    public MethodNames methodNames() {
        return methodNames;
    }

    public Match match(ConditionalExpr node) {
        return matcher.match(pattern, node);
    }

    @Override
    protected boolean detect(ConditionalExpr node) {
        return match(node).isSuccess();
    }

    @Override
    protected Node buildReplacement(ConditionalExpr node) {
        Match match = match(node);
        Expression receiver = match.first(EXPR, Expression.class)
                .orElseThrow(() -> new IllegalStateException("No receiver captured for " + node));

        NodeList<Expression> arguments = new NodeList<>();
        match.first(PARAM, Expression.class).ifPresent(param -> arguments.add(param.clone()));
        return new MethodCallExpr(receiver.clone(), methodNames.replacement(), arguments);
    }
}
