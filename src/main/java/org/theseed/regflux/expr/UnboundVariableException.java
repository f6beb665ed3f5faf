/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This exception is thrown when an arithmetic tree still contains a free identifier at
 * evaluation time.  All parameters must be substituted before numeric evaluation.
 *
 */
public class UnboundVariableException extends EvaluationException {

    /** serialization ID */
    private static final long serialVersionUID = 1648398470533016412L;
    /** name of the unbound identifier */
    private final String variable;

    public UnboundVariableException(String variable) {
        super("No value was supplied for \"" + variable + "\".");
        this.variable = variable;
    }

    /**
     * @return the name of the unbound identifier
     */
    public String getVariable() {
        return this.variable;
    }

}
