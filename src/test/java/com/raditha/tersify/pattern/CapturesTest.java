package com.raditha.tersify.pattern;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CapturesTest {

    private static Node node(String code) {
        return StaticJavaParser.parseExpression(code);
    }

    @Test
    void testBindingReturnsNewTable() {
        Captures empty = Captures.empty();

        Captures bound = empty.bind("x", node("a.b")).orElseThrow();

        assertFalse(empty.isBound("x"));
        assertTrue(bound.isBound("x"));
        assertEquals("a.b", bound.get("x").get(0).toString());
    }

    @Test
    void testRebindingRequiresEqualNode() {
        Captures bound = Captures.empty().bind("x", node("a.b")).orElseThrow();

        assertTrue(bound.bind("x", node("a . b")).isPresent());
        assertEquals(2, bound.bind("x", node("a.b")).orElseThrow().get("x").size());
        assertTrue(bound.bind("x", node("a.c")).isEmpty());
        assertTrue(bound.bind("x", null).isEmpty());
    }

    @Test
    void testAbsenceBindsOnlyAbsence() {
        Captures absent = Captures.empty().bind("p", null).orElseThrow();

        assertTrue(absent.isBound("p"));
        assertTrue(absent.get("p").isEmpty());
        assertTrue(absent.bind("p", null).isPresent());
        assertTrue(absent.bind("p", node("x")).isEmpty());
    }

    @Test
    void testTableIsUnmodifiable() {
        Captures bound = Captures.empty().bind("x", node("a")).orElseThrow();

        assertThrows(UnsupportedOperationException.class, () -> bound.asMap().remove("x"));
        assertThrows(UnsupportedOperationException.class, () -> bound.get("x").clear());
    }
}
