package com.raditha.tersify.analyzer;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.tersify.model.Diagnostic;
import com.raditha.tersify.rules.FirstOrDefaultRule;
import com.raditha.tersify.rules.IfToConditionalRule;
import com.raditha.tersify.rules.RewriteRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for RewriteAnalyzer - visiting order, suppression and cancellation.
 */
class RewriteAnalyzerTest {

    private static final String BOTH_RULES = """
            class A {
                String pick(Items list, boolean c) {
                    int y;
                    if (c) { y = 1; } else { y = 2; }
                    return list.any(p -> p.ok) ? list.first(p -> p.ok) : null;
                }
            }
            """;

    private RewriteAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        List<RewriteRule<?>> rules = List.of(new IfToConditionalRule(), new FirstOrDefaultRule());
        analyzer = new RewriteAnalyzer(rules);
    }

    private List<String> ruleIds(String code) {
        return analyzer.analyze(StaticJavaParser.parse(code)).stream()
                .map(Diagnostic::ruleId)
                .toList();
    }

    @Test
    void testDiagnosticsInSourceOrder() {
        List<Diagnostic> diagnostics = analyzer.analyze(StaticJavaParser.parse(BOTH_RULES));

        assertEquals(2, diagnostics.size());
        assertEquals(IfToConditionalRule.ID, diagnostics.get(0).ruleId());
        assertEquals(4, diagnostics.get(0).location().startLine());
        assertEquals(FirstOrDefaultRule.ID, diagnostics.get(1).ruleId());
        assertEquals(5, diagnostics.get(1).location().startLine());
    }

    @Test
    void testEnclosingConstructReportedBeforeNested() {
        List<Diagnostic> diagnostics = analyzer.analyze(StaticJavaParser.parseExpression(
                "a.any(x -> b.any(q) ? b.first(q) : null) ? a.first(x -> b.any(q) ? b.first(q) : null) : null"));

        assertEquals(3, diagnostics.size());
        assertEquals(1, diagnostics.get(0).location().startColumn());
        assertTrue(diagnostics.get(1).location().startColumn() < diagnostics.get(2).location().startColumn());
    }

    @Test
    void testNothingToReport() {
        assertTrue(ruleIds("class A { int f(int x) { return x > 0 ? 1 : 2; } }").isEmpty());
    }

    @Test
    void testSuppressedByRuleId() {
        String code = BOTH_RULES.replace("    String pick", "    @SuppressWarnings(\"IfToConditional\")\n    String pick");

        assertEquals(List.of(FirstOrDefaultRule.ID), ruleIds(code));
    }

    @Test
    void testSuppressedByPrefixedRuleIdOnClass() {
        String code = "@SuppressWarnings(\"tersify:ReplaceWithFirstOrDefault\")\n" + BOTH_RULES;

        assertEquals(List.of(IfToConditionalRule.ID), ruleIds(code));
    }

    @Test
    void testSuppressedByToolName() {
        String code = BOTH_RULES.replace("    String pick", "    @SuppressWarnings(value = \"tersify\")\n    String pick");

        assertTrue(ruleIds(code).isEmpty());
    }

    @Test
    void testSuppressAll() {
        String code = "@SuppressWarnings(\"all\")\n" + BOTH_RULES;

        assertTrue(ruleIds(code).isEmpty());
    }

    @Test
    void testSuppressedByArrayValue() {
        String code = BOTH_RULES.replace("    String pick",
                "    @SuppressWarnings({\"unchecked\", \"ReplaceWithFirstOrDefault\"})\n    String pick");

        assertEquals(List.of(IfToConditionalRule.ID), ruleIds(code));
    }

    @Test
    void testUnrelatedSuppressionIgnored() {
        String code = BOTH_RULES.replace("    String pick", "    @SuppressWarnings(\"unchecked\")\n    String pick");

        assertEquals(2, ruleIds(code).size());
    }

    @Test
    void testCancellationStopsAnalysis() {
        CompilationUnit cu = StaticJavaParser.parse(BOTH_RULES);
        String before = cu.toString();
        BooleanSupplier cancelled = mock(BooleanSupplier.class);
        when(cancelled.getAsBoolean()).thenReturn(false, false, true);

        assertThrows(CancellationException.class, () -> analyzer.analyze(cu, cancelled));

        verify(cancelled, times(3)).getAsBoolean();
        assertEquals(before, cu.toString());
    }

    @Test
    void testNotCancelledCompletes() {
        BooleanSupplier cancelled = mock(BooleanSupplier.class);
        when(cancelled.getAsBoolean()).thenReturn(false);

        assertEquals(2, analyzer.analyze(StaticJavaParser.parse(BOTH_RULES), cancelled).size());
        verify(cancelled, atLeastOnce()).getAsBoolean();
    }
}
