/**
 *
 */
package org.theseed.regflux.expr;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TreeBuilderTest {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TreeBuilderTest.class);

    @Test
    public void testPrecedence() {
        ExprNode tree = TreeBuilder.buildTree("A & B | C", Grammar.BOOLEAN);
        assertThat(tree.getValue(), equalTo("|"));
        assertThat(tree.toInfix(), equalTo("((A and B) or C)"));
        // AND and OR bind equally, so mixed rules group from the left.
        tree = TreeBuilder.buildTree("A | B & C", Grammar.BOOLEAN);
        assertThat(tree.getValue(), equalTo("&"));
        assertThat(tree.toInfix(), equalTo("((A or B) and C)"));
        assertThat(BooleanResolver.evaluate("A | B & C", Set.of("A")), equalTo(false));
        assertThat(BooleanResolver.evaluate("A | B & C", Set.of("A", "C")), equalTo(true));
        tree = TreeBuilder.buildTree("A & B | C & D", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("(((A and B) or C) and D)"));
        tree = TreeBuilder.buildTree("not A | B", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("((not A) or B)"));
        tree = TreeBuilder.buildTree("not A & B", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("((not A) and B)"));
        tree = TreeBuilder.buildTree("not (A & B)", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("(not (A and B))"));
        assertThat(tree.isUnary(), equalTo(true));
        assertThat(tree.isBinary(), equalTo(false));
        assertThat(tree.getRight().isBinary(), equalTo(true));
        assertThat(tree.getLeft().isBinary(), equalTo(false));
        assertThat(tree.getLeft().isEmptyLeaf(), equalTo(true));
        tree = TreeBuilder.buildTree("a - b - c", Grammar.ARITHMETIC);
        assertThat(tree.toInfix(), equalTo("((a - b) - c)"));
        tree = TreeBuilder.buildTree("a ^ b ^ c", Grammar.ARITHMETIC);
        assertThat(tree.toInfix(), equalTo("(a ^ (b ^ c))"));
        tree = TreeBuilder.buildTree("a + b * c", Grammar.ARITHMETIC);
        assertThat(tree.toInfix(), equalTo("(a + (b * c))"));
        tree = TreeBuilder.buildTree("-a + b", Grammar.ARITHMETIC);
        assertThat(tree.toInfix(), equalTo("((- a) + b)"));
    }

    @Test
    public void testRoundTrip() {
        String[] rules = new String[] { "(g1 and g2) or g3", "not g1 and (g2 or not g3)", "A & B | C & D",
                "R > 0 and not b2", "g1" };
        for (String rule : rules) {
            String infix = TreeBuilder.buildTree(rule, Grammar.BOOLEAN).toInfix();
            String infix2 = TreeBuilder.buildTree(infix, Grammar.BOOLEAN).toInfix();
            assertThat(rule, infix2, equalTo(infix));
        }
        String[] laws = new String[] { "Vmax * S / (Km + S)", "-x ^ 2 + 3", "max(a, b) - sqrt(c)",
                "f(a, b, c) * 2", "k1 * 1e-5" };
        for (String law : laws) {
            String infix = TreeBuilder.buildTree(law, Grammar.ARITHMETIC).toInfix();
            String infix2 = TreeBuilder.buildTree(infix, Grammar.ARITHMETIC).toInfix();
            assertThat(law, infix2, equalTo(infix));
        }
    }

    @Test
    public void testCoverage() {
        ExprNode tree = TreeBuilder.buildTree("(g1 and g2) or g3", Grammar.BOOLEAN);
        assertThat(tree.getOperands(), contains("g1", "g2", "g3"));
        assertThat(tree.getOperators(), contains("&", "|"));
        tree = TreeBuilder.buildTree("R > 0 & A", Grammar.BOOLEAN);
        assertThat(tree.getOperands(), containsInAnyOrder("A", "R > 0"));
        assertThat(tree.getConditions(), contains("R > 0"));
        tree = TreeBuilder.buildTree("2 * k * S + 1.5", Grammar.ARITHMETIC);
        assertThat(tree.getOperands(), containsInAnyOrder("2", "k", "S", "1.5"));
        assertThat(tree.getParameters(), containsInAnyOrder("k", "S"));
        assertThat(tree.getOperators(), containsInAnyOrder("*", "+"));
    }

    @Test
    public void testFunctions() {
        ExprNode tree = TreeBuilder.buildTree("sqrt(x)", Grammar.ARITHMETIC);
        assertThat(tree.getArity(), equalTo(ExprNode.UNARY_FUNCTION));
        assertThat(tree.getLeft().isEmptyLeaf(), equalTo(true));
        assertThat(tree.toInfix(), equalTo("sqrt(x)"));
        tree = TreeBuilder.buildTree("pow(x, 2)", Grammar.ARITHMETIC);
        assertThat(tree.getArity(), equalTo(ExprNode.BINARY_FUNCTION));
        assertThat(tree.toInfix(), equalTo("pow(x, 2)"));
        tree = TreeBuilder.buildTree("f(a, b + 1, c)", Grammar.ARITHMETIC);
        assertThat(tree.getArity(), equalTo(3));
        List<ExprNode> args = tree.getArguments();
        assertThat(args.size(), equalTo(3));
        assertThat(args.get(0).getValue(), equalTo("a"));
        assertThat(args.get(1).toInfix(), equalTo("(b + 1)"));
        assertThat(args.get(2).getValue(), equalTo("c"));
        assertThat(tree.toInfix(), equalTo("f(a, (b + 1), c)"));
        assertThat(tree.toInfix("[", "]", " ", ",", null), equalTo("f(a,[b + 1],c)"));
        tree = TreeBuilder.buildTree("g()", Grammar.ARITHMETIC);
        assertThat(tree.getArity(), equalTo(ExprNode.UNARY_FUNCTION));
        assertThat(tree.getRight().isEmptyLeaf(), equalTo(true));
        assertThat(tree.toInfix(), equalTo("g()"));
        tree = TreeBuilder.buildTree("2 * max(a, min(b, c))", Grammar.ARITHMETIC);
        assertThat(tree.toInfix(), equalTo("(2 * max(a, min(b, c)))"));
    }

    @Test
    public void testEmptyAndMalformed() {
        assertThat(TreeBuilder.buildTree("", Grammar.BOOLEAN).isEmptyLeaf(), equalTo(true));
        assertThat(TreeBuilder.buildTree("   ", Grammar.BOOLEAN).isEmptyLeaf(), equalTo(true));
        assertThat(TreeBuilder.buildTree("", Grammar.BOOLEAN).toInfix(), equalTo(""));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("A &", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("& A", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("A, B", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("(A | B", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("a * / b", Grammar.ARITHMETIC));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("(a + b) c", Grammar.ARITHMETIC));
    }

    @Test
    public void testMisplacedNot() {
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("A not B", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("A ~B", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("(A | B) not C", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("@ A", Grammar.BOOLEAN));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree("not", Grammar.BOOLEAN));
        // A unary operator that arrives without its empty operand is rejected as well.
        List<Token> tokens = List.of(Token.operand("A"), Token.operator("~"), Token.operand("B"));
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.buildTree(tokens, Grammar.BOOLEAN));
        // Legal placements still parse, and multi-word operands keep their words.
        ExprNode tree = TreeBuilder.buildTree("A and not B", Grammar.BOOLEAN);
        assertThat(tree.getOperands(), contains("A", "B"));
        tree = TreeBuilder.buildTree("not not A", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("(not (not A))"));
        tree = TreeBuilder.buildTree("R > 0 and not sugar level", Grammar.BOOLEAN);
        assertThat(tree.getOperands(), contains("R > 0", "sugar level"));
    }

    @Test
    public void testTransforms() {
        ExprNode tree = TreeBuilder.buildTree("A & B", Grammar.BOOLEAN);
        ExprNode replaced = tree.replace(Map.of("A", "X"));
        assertThat(replaced.toInfix(), equalTo("(X and B)"));
        assertThat(tree.toInfix(), equalTo("(A and B)"));
        ExprNode copy = tree.copy();
        assertThat(copy, equalTo(tree));
        assertThat(copy, not(sameInstance(tree)));
        // Grafting replaces only the first match.
        ExprNode sub = TreeBuilder.buildTree("y * 2", Grammar.ARITHMETIC);
        tree = TreeBuilder.buildTree("x + x", Grammar.ARITHMETIC);
        assertThat(tree.replaceNode("x", sub), equalTo(true));
        assertThat(tree.toInfix(), equalTo("((y * 2) + x)"));
        assertThat(tree.replaceNode("q", sub), equalTo(false));
        tree = TreeBuilder.buildTree("x + x", Grammar.ARITHMETIC);
        assertThat(tree.replaceAllNodes("x", sub), equalTo(2));
        assertThat(tree.toInfix(), equalTo("((y * 2) + (y * 2))"));
        // The grafted copies are independent of the source subtree.
        sub.replaceNode("y", new ExprNode("z"));
        assertThat(tree.toInfix(), equalTo("((y * 2) + (y * 2))"));
        // A graft that contains its own key is not searched again.
        tree = TreeBuilder.buildTree("x + 1", Grammar.ARITHMETIC);
        assertThat(tree.replaceAllNodes("x", TreeBuilder.buildTree("x * 2", Grammar.ARITHMETIC)), equalTo(1));
        assertThat(tree.toInfix(), equalTo("((x * 2) + 1)"));
        // Function inlining.
        tree = TreeBuilder.buildTree("f(S) * g(S)", Grammar.ARITHMETIC);
        tree.replaceNodes(Map.of("f", TreeBuilder.buildTree("S + 1", Grammar.ARITHMETIC),
                "g", new ExprNode("k")));
        assertThat(tree.toInfix(), equalTo("((S + 1) * k)"));
        tree.dump();
    }

    @Test
    public void testRenames() {
        ExprNode tree = TreeBuilder.buildTree("a and not b", Grammar.BOOLEAN);
        assertThat(tree.toInfix(), equalTo("(a and (not b))"));
        assertThat(tree.toInfix("(", ")", " ", ", ", Map.of("&", "&&", "~", "!")), equalTo("(a && (! b))"));
        assertThat(tree.toInfix("", "", " ", ", ", null), equalTo("a and not b"));
        assertThat(tree.toString(), equalTo(tree.toInfix()));
    }

    @Test
    public void testLatex() {
        ExprNode tree = TreeBuilder.buildTree("a / b", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("\\frac {\\textrm{a}} {\\textrm{b}}"));
        tree = TreeBuilder.buildTree("(a + b) * c", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(),
                equalTo("\\mathopen{}\\left( \\textrm{a} + \\textrm{b} \\mathclose{}\\right) \\times \\textrm{c}"));
        tree = TreeBuilder.buildTree("a * b + c", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("\\textrm{a} \\times \\textrm{b} + \\textrm{c}"));
        assertThat(tree.toLatex().getPrecedence(), equalTo(0));
        tree = TreeBuilder.buildTree("a - (b - c)", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(),
                equalTo("\\textrm{a} - \\mathopen{}\\left( \\textrm{b} - \\textrm{c} \\mathclose{}\\right)"));
        tree = TreeBuilder.buildTree("2 ^ x", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("{2}^{\\textrm{x}}"));
        tree = TreeBuilder.buildTree("sqrt(x)", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("\\sqrt {\\textrm{x}}"));
        tree = TreeBuilder.buildTree("exp(k_1)", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("\\textrm{exp}\\left(\\textrm{k\\_1}\\right)"));
        assertThat(Latex.escape("a{b}"), equalTo("a\\{b\\}"));
        assertThat(Latex.escape("50%"), equalTo("50\\%"));
    }

    @Test
    public void testPrefixAndLogicalLatex() {
        ExprNode tree = TreeBuilder.buildTree("-a", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(), equalTo("-\\textrm{a}"));
        tree = TreeBuilder.buildTree("a * -b", Grammar.ARITHMETIC);
        assertThat(tree.toLatex().getText(),
                equalTo("\\textrm{a} \\times \\mathopen{}\\left( -\\textrm{b} \\mathclose{}\\right)"));
        tree = TreeBuilder.buildTree("not A", Grammar.BOOLEAN);
        assertThat(tree.toLatex().getText(), equalTo("\\lnot \\textrm{A}"));
        tree = TreeBuilder.buildTree("A and B and C", Grammar.BOOLEAN);
        assertThat(tree.toLatex().getText(), equalTo("\\textrm{A} \\land \\textrm{B} \\land \\textrm{C}"));
        tree = TreeBuilder.buildTree("(A or B) and not C", Grammar.BOOLEAN);
        assertThat(tree.toLatex().getText(), equalTo(
                "\\mathopen{}\\left( \\textrm{A} \\lor \\textrm{B} \\mathclose{}\\right) \\land \\lnot \\textrm{C}"));
        tree = TreeBuilder.buildTree("A or (B and C)", Grammar.BOOLEAN);
        assertThat(tree.toLatex().getText(), equalTo(
                "\\textrm{A} \\lor \\mathopen{}\\left( \\textrm{B} \\land \\textrm{C} \\mathclose{}\\right)"));
        tree = TreeBuilder.buildTree("not (A or B)", Grammar.BOOLEAN);
        assertThat(tree.toLatex().getText(), equalTo(
                "\\lnot \\mathopen{}\\left( \\textrm{A} \\lor \\textrm{B} \\mathclose{}\\right)"));
    }

}
