/**
 *
 */
package org.theseed.regflux.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * This class splits a rule string into tokens.  Words are separated by white space,
 * parentheses and commas; operator spellings declared by the grammar are split out of
 * words; and each raw word is passed through the grammar's alias table.
 *
 * The parenthesis balance is checked before any token is produced, so the tree builder
 * never sees structurally broken input.
 *
 */
public class Tokenizer {

    /** pattern for a partial word that ends in the exponent marker of a numeric literal */
    private static final Pattern EXPONENT_PREFIX = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)[eE]");

    private Tokenizer() { }

    /**
     * Convert an expression into a list of tokens.
     *
     * @param expression	expression to tokenize
     * @param grammar		grammar defining the operators and aliases
     *
     * @return the list of tokens in the expression
     *
     * @throws MalformedExpressionException if the parentheses are unbalanced
     */
    public static List<Token> tokenize(String expression, Grammar grammar) {
        checkBalance(expression);
        List<Token> retVal = new ArrayList<Token>();
        StringBuilder word = new StringBuilder(expression.length());
        final int n = expression.length();
        int i = 0;
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                flush(word, grammar, retVal);
                i++;
            } else if (c == '(') {
                flush(word, grammar, retVal);
                retVal.add(Token.OPEN);
                i++;
            } else if (c == ')') {
                flush(word, grammar, retVal);
                retVal.add(Token.CLOSE);
                i++;
            } else if (c == ',') {
                flush(word, grammar, retVal);
                retVal.add(Token.SEPARATOR);
                i++;
            } else {
                String symbol = grammar.matchSymbol(expression, i);
                if (symbol == null || isExponentSign(word, symbol)) {
                    word.append(c);
                    i++;
                } else {
                    // Here the symbol stands alone, even if it is glued to its neighbors.
                    flush(word, grammar, retVal);
                    emit(symbol, grammar, retVal);
                    i += symbol.length();
                }
            }
        }
        flush(word, grammar, retVal);
        return retVal;
    }

    /**
     * Verify that the parentheses in an expression are balanced.
     *
     * @param expression	expression to check
     *
     * @throws MalformedExpressionException if the parentheses are unbalanced
     */
    public static void checkBalance(String expression) {
        int depth = 0;
        final int n = expression.length();
        for (int i = 0; i < n; i++) {
            char c = expression.charAt(i);
            if (c == '(')
                depth++;
            else if (c == ')') {
                depth--;
                if (depth < 0)
                    throw new MalformedExpressionException("Unexpected closing parenthesis at position " + i, expression);
            }
        }
        if (depth != 0)
            throw new MalformedExpressionException("Unbalanced parentheses", expression);
    }

    /**
     * @return TRUE if a sign symbol belongs to the exponent of a numeric literal (e.g. "1e-5")
     *
     * @param word		partial word accumulated so far
     * @param symbol	symbol found at the current position
     */
    private static boolean isExponentSign(CharSequence word, String symbol) {
        return (symbol.equals("-") || symbol.equals("+")) && EXPONENT_PREFIX.matcher(word).matches();
    }

    /**
     * Emit the accumulated word (if any) and clear the buffer.
     *
     * @param word		word buffer
     * @param grammar	controlling grammar
     * @param tokens	output token list
     */
    private static void flush(StringBuilder word, Grammar grammar, List<Token> tokens) {
        if (word.length() > 0) {
            emit(word.toString(), grammar, tokens);
            word.setLength(0);
        }
    }

    /**
     * Substitute a raw word through the alias table and emit the resulting tokens.
     *
     * @param raw		raw word
     * @param grammar	controlling grammar
     * @param tokens	output token list
     */
    private static void emit(String raw, Grammar grammar, List<Token> tokens) {
        for (String canonical : grammar.substitute(raw)) {
            if (grammar.isOperator(canonical))
                tokens.add(Token.operator(canonical));
            else
                tokens.add(Token.operand(canonical));
        }
    }

}
