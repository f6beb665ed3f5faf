/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This is the base class for errors found while evaluating a tree.  They occur when a
 * resolver cannot classify an operand or an operator.
 *
 */
public class EvaluationException extends ExpressionException {

    /** serialization ID */
    private static final long serialVersionUID = 7788209431657145250L;

    public EvaluationException(String message) {
        super(message);
    }

}
