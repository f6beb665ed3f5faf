/**
 *
 */
package org.theseed.regflux.expr;

import java.util.Map;

/**
 * This object holds the LaTeX rendering of an expression subtree together with the
 * precedence of its outermost operator.  The precedence is threaded up the tree so that a
 * parent only brackets a child that binds more loosely than itself.
 *
 */
public class Latex {

    // FIELDS
    /** LaTeX text */
    private final String text;
    /** precedence of the outermost operator */
    private final int precedence;

    /** precedence reported by leaves and function calls */
    public static final int MAX_PRECEDENCE = 10;
    /** operator precedences for bracketing */
    private static final Map<String, Integer> PRECEDENCE = Map.of("+", 0, "-", 0, "*", 1, "/", 1,
            "^", 2, "pow", 2, Grammar.AND, 0, Grammar.OR, 0, Grammar.NOT, 1);
    /** special characters and their escapes */
    private static final Map<Character, String> ESCAPES = Map.of('\\', "\\textbackslash{}", '_', "\\_",
            '^', "\\^{}", '{', "\\{", '}', "\\}", '%', "\\%", '&', "\\&", '#', "\\#", '$', "\\$",
            '~', "\\textasciitilde{}");

    /**
     * Construct a LaTeX fragment.
     *
     * @param text			LaTeX text
     * @param precedence	precedence of the outermost operator
     */
    public Latex(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    /**
     * @return the LaTeX text
     */
    public String getText() {
        return this.text;
    }

    /**
     * @return the precedence of the outermost operator
     */
    public int getPrecedence() {
        return this.precedence;
    }

    /**
     * @return TRUE if the specified operator has a dedicated LaTeX layout
     *
     * @param op	operator or function name
     */
    public static boolean hasLayout(String op) {
        return PRECEDENCE.containsKey(op) || op.equals("sqrt");
    }

    /**
     * @return the bracketing precedence of an operator
     *
     * @param op	operator or function name
     */
    public static int precedenceOf(String op) {
        return PRECEDENCE.getOrDefault(op, MAX_PRECEDENCE);
    }

    /**
     * @return TRUE if an operator is a Boolean connective
     *
     * @param op	operator or function name
     */
    public static boolean isLogical(String op) {
        return op.equals(Grammar.AND) || op.equals(Grammar.OR) || op.equals(Grammar.NOT);
    }

    /**
     * @return TRUE if a right operand with the same precedence as the operator must be bracketed
     *
     * @param op	operator or function name
     */
    public static boolean bracketsEqualRight(String op) {
        return op.equals("-") || op.equals(Grammar.AND) || op.equals(Grammar.OR);
    }

    /**
     * @return the LaTeX layout of an operator applied to two rendered operands.  An empty left
     * operand yields the prefix form of the operator.
     *
     * @param op	operator or function name
     * @param x		rendered left operand
     * @param y		rendered right operand
     */
    public static String layout(String op, String x, String y) {
        String retVal;
        switch (op) {
        case "*" :
            retVal = x + " \\times " + y;
            break;
        case "/" :
            retVal = "\\frac {" + x + "} {" + y + "}";
            break;
        case "+" :
            retVal = (x.isEmpty() ? "+" + y : x + " + " + y);
            break;
        case "-" :
            retVal = (x.isEmpty() ? "-" + y : x + " - " + y);
            break;
        case Grammar.AND :
            retVal = x + " \\land " + y;
            break;
        case Grammar.OR :
            retVal = x + " \\lor " + y;
            break;
        case Grammar.NOT :
            retVal = "\\lnot " + y;
            break;
        case "^" :
        case "pow" :
            retVal = "{" + x + "}^{" + y + "}";
            break;
        case "sqrt" :
            retVal = "\\sqrt {" + y + "}";
            break;
        default :
            throw new IllegalArgumentException("No LaTeX layout for \"" + op + "\".");
        }
        return retVal;
    }

    /**
     * @return a bracketed version of a LaTeX fragment
     *
     * @param src	fragment to bracket
     */
    public static String paren(String src) {
        return "\\mathopen{}\\left( " + src + " \\mathclose{}\\right)";
    }

    /**
     * @return the LaTeX rendering of a leaf value
     *
     * @param value		operand text
     */
    public static String convertConstant(String value) {
        String retVal;
        if (ExprNode.isNumber(value))
            retVal = value;
        else
            retVal = "\\textrm{" + escape(value) + "}";
        return retVal;
    }

    /**
     * @return text with the LaTeX special characters escaped
     *
     * @param text	text to escape
     */
    public static String escape(String text) {
        StringBuilder retVal = new StringBuilder(text.length() + 10);
        final int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            String escaped = ESCAPES.get(c);
            if (escaped == null)
                retVal.append(c);
            else
                retVal.append(escaped);
        }
        return retVal.toString();
    }

    @Override
    public String toString() {
        return this.text;
    }

}
