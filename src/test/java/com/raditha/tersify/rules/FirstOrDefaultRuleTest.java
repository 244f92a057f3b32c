package com.raditha.tersify.rules;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.tersify.model.Category;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.model.Severity;
import com.raditha.tersify.pattern.Match;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FirstOrDefaultRuleTest {

    private FirstOrDefaultRule rule;

    @BeforeEach
    void setUp() {
        rule = new FirstOrDefaultRule();
    }

    private static ConditionalExpr conditional(String code) {
        return StaticJavaParser.parseExpression(code).asConditionalExpr();
    }

    private static String rewritten(FirstOrDefaultRule rule, String code) {
        return rule.rewrite(conditional(code))
                .map(Rewrite::replacement)
                .map(Node::toString)
                .orElseThrow(() -> new AssertionError("Expected a rewrite for " + code));
    }

    @Test
    void testPredicateLookup() {
        assertEquals("list.firstOrDefault(p -> p.ok)",
                rewritten(rule, "list.any(p -> p.ok) ? list.first(p -> p.ok) : null"));
    }

    @Test
    void testLookupWithoutArguments() {
        assertEquals("list.firstOrDefault()", rewritten(rule, "list.any() ? list.first() : null"));
    }

    @Test
    void testCastNullFallback() {
        assertEquals("names.firstOrDefault(isAdmin)",
                rewritten(rule, "names.any(isAdmin) ? names.first(isAdmin) : (String) null"));
    }

    @Test
    void testComplexReceiver() {
        assertEquals("repo.items().firstOrDefault(p)",
                rewritten(rule, "repo.items().any(p) ? repo.items().first(p) : null"));
    }

    @Test
    void testEquivalentFormattingStillMatches() {
        assertTrue(rule.match(conditional("list.any( x -> x.ok ) ? list . first(x->x.ok) : null")).isSuccess());
    }

    @Test
    void testCapturesReceiverAndPredicate() {
        Match match = rule.match(conditional("list.any(p) ? list.first(p) : null"));

        assertTrue(match.isSuccess());
        assertEquals("list", match.first(FirstOrDefaultRule.EXPR, Expression.class).orElseThrow().toString());
        assertEquals("p", match.first(FirstOrDefaultRule.PARAM, Expression.class).orElseThrow().toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "list.any(p -> p.ok) ? list.first(p -> p.bad) : null",
            "list.any(p) ? other.first(p) : null",
            "list.any(p) ? list.first() : null",
            "list.any() ? list.first(p) : null",
            "list.any(p) ? list.first(p) : other",
            "list.any(p) ? list.first(p) : (String) other",
            "list.exists(p) ? list.first(p) : null",
            "list.any(p) ? list.last(p) : null",
            "list.first(p) ? list.any(p) : null",
            "any(p) ? first(p) : null",
            "list.any(p, q) ? list.first(p, q) : null",
            "list.isEmpty() ? null : list.get(0)"
    })
    void testNoMatch(String code) {
        ConditionalExpr expr = conditional(code);

        assertFalse(rule.match(expr).isSuccess(), code);
        assertTrue(rule.analyze(expr).isEmpty(), code);
        assertTrue(rule.rewrite(expr).isEmpty(), code);
    }

    @Test
    void testDiagnostic() {
        Diagnostic diagnostic = rule.analyze(conditional("list.any(p) ? list.first(p) : null")).orElseThrow();

        assertEquals(FirstOrDefaultRule.ID, diagnostic.ruleId());
        assertEquals(Severity.WARNING, diagnostic.severity());
        assertEquals("Expression can be simplified to 'firstOrDefault()'", diagnostic.message());
        assertEquals(Category.PRACTICES_AND_IMPROVEMENTS, rule.descriptor().category());
        assertEquals(1, diagnostic.location().startColumn());
    }

    @Test
    void testCustomMethodNames() {
        FirstOrDefaultRule.MethodNames names = new FirstOrDefaultRule.MethodNames("Any", "First", "FirstOrDefault");
        FirstOrDefaultRule custom = new FirstOrDefaultRule(FirstOrDefaultRule.defaultDescriptor(names), names);

        assertEquals("items.FirstOrDefault(x)", rewritten(custom, "items.Any(x) ? items.First(x) : null"));
        assertFalse(custom.match(conditional("items.any(x) ? items.first(x) : null")).isSuccess());
        assertEquals("Expression can be simplified to 'FirstOrDefault()'", custom.descriptor().message());
    }

    @Test
    void testReplacementIsDetachedCopy() {
        ConditionalExpr expr = conditional("list.any(p) ? list.first(p) : null");
        String before = expr.toString();

        MethodCallExpr replacement = (MethodCallExpr) rule.rewrite(expr).orElseThrow().replacement();

        assertEquals(before, expr.toString());
        Expression receiver = replacement.getScope().orElseThrow();
        assertNotSame(expr.getThenExpr().asMethodCallExpr().getScope().orElseThrow(), receiver);
        assertSame(replacement, receiver.getParentNode().orElseThrow());
    }
}
