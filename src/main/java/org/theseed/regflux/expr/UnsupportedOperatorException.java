/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This exception is thrown when an operator resolver has no mapping for a node's symbol.
 *
 */
public class UnsupportedOperatorException extends EvaluationException {

    /** serialization ID */
    private static final long serialVersionUID = -5330270183375417717L;
    /** offending operator */
    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Operator \"" + operator + "\" is not supported.");
        this.operator = operator;
    }

    /**
     * @return the unsupported operator symbol
     */
    public String getOperator() {
        return this.operator;
    }

}
