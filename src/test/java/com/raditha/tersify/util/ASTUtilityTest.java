package com.raditha.tersify.util;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ASTUtilityTest {

    @Test
    void testChildrenInSourceOrderWithoutComments() {
        MethodCallExpr call = StaticJavaParser.parseExpression("items /* receiver */ .first(p)").asMethodCallExpr();

        List<Node> children = ASTUtility.children(call);

        assertEquals(3, children.size());
        assertInstanceOf(NameExpr.class, children.get(0));
        assertInstanceOf(SimpleName.class, children.get(1));
        assertEquals("p", children.get(2).toString());
        assertTrue(children.stream().noneMatch(Comment.class::isInstance));
    }

    @Test
    void testChildrenKeepSourceOrderAfterReplacement() {
        ConditionalExpr conditional = StaticJavaParser.parseExpression("c ? first : second").asConditionalExpr();
        NameExpr replacement = new NameExpr("replaced");
        assertTrue(conditional.getThenExpr().replace(replacement));

        List<Node> children = ASTUtility.children(conditional);

        assertEquals(List.of("c", "replaced", "second"), children.stream().map(Node::toString).toList());
        assertSame(replacement, children.get(1));
        assertSame(conditional.getElseExpr(), children.get(2));
    }

    @Test
    void testChildrenOfReplacedMethodScope() {
        MethodCallExpr call = StaticJavaParser.parseExpression("items.first(p)").asMethodCallExpr();
        call.setScope(new NameExpr("others"));

        List<Node> children = ASTUtility.children(call);

        assertEquals(List.of("others", "first", "p"), children.stream().map(Node::toString).toList());
    }

    @Test
    void testPrefixAndPostfixTokensDiffer() {
        String prefix = ASTUtility.token(StaticJavaParser.parseExpression("++x"));
        String postfix = ASTUtility.token(StaticJavaParser.parseExpression("x++"));

        assertEquals("PREFIX_INCREMENT", prefix);
        assertEquals("POSTFIX_INCREMENT", postfix);
    }

    @Test
    void testTokens() {
        assertEquals("x", ASTUtility.token(new SimpleName("x")));
        assertEquals("42", ASTUtility.token(StaticJavaParser.parseExpression("42")));
        assertEquals("text", ASTUtility.token(StaticJavaParser.parseExpression("\"text\"")));
        assertEquals("true", ASTUtility.token(StaticJavaParser.parseExpression("true")));
        assertEquals("&&", ASTUtility.token(StaticJavaParser.parseExpression("a && b")));
        assertEquals("LOGICAL_COMPLEMENT", ASTUtility.token(StaticJavaParser.parseExpression("!a")));
        assertEquals("+=", ASTUtility.token(StaticJavaParser.parseExpression("a += 1")));
        assertNull(ASTUtility.token(StaticJavaParser.parseExpression("a.b()")));
    }

    @Test
    void testStructuralEquality() {
        Expression a = StaticJavaParser.parseExpression("f(a, /* c */ b)");
        Expression b = StaticJavaParser.parseExpression("f( a,b )");

        assertTrue(ASTUtility.structurallyEqual(a, b));
        assertFalse(ASTUtility.structurallyEqual(a, StaticJavaParser.parseExpression("f(b, a)")));
        assertFalse(ASTUtility.structurallyEqual(a, null));
        assertTrue(ASTUtility.structurallyEqual(null, null));
    }

    @Test
    void testMultiLine() {
        assertTrue(ASTUtility.isMultiLine(StaticJavaParser.parseExpression("f(a,\n b)")));
        assertFalse(ASTUtility.isMultiLine(StaticJavaParser.parseExpression("f(a, b)")));
        assertFalse(ASTUtility.isMultiLine(new AssignExpr(new NameExpr("a"), new NameExpr("b"),
                AssignExpr.Operator.ASSIGN)));
    }
}
