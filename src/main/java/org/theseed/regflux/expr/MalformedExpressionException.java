/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This exception is thrown when a rule string cannot be tokenized or built into a tree,
 * for example because its parentheses are unbalanced or an operator is missing an operand.
 *
 */
public class MalformedExpressionException extends ExpressionException {

    /** serialization ID */
    private static final long serialVersionUID = -2186093340215740318L;
    /** expression that failed */
    private final String expression;

    /**
     * Construct a parse error for a specific expression.
     *
     * @param message		description of the problem
     * @param expression	text of the expression
     */
    public MalformedExpressionException(String message, String expression) {
        super(message + " in expression \"" + expression + "\".");
        this.expression = expression;
    }

    /**
     * @return the expression that could not be parsed
     */
    public String getExpression() {
        return this.expression;
    }

}
