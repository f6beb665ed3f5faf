/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This exception is thrown when a relational condition has no recognizable comparison
 * operator or is missing one of its sides.
 *
 */
public class InvalidConditionException extends EvaluationException {

    /** serialization ID */
    private static final long serialVersionUID = -881254790468722358L;

    public InvalidConditionException(String condition) {
        super("Invalid condition format: \"" + condition + "\".");
    }

}
