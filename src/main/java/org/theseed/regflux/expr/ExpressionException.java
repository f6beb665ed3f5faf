/**
 *
 */
package org.theseed.regflux.expr;

/**
 * This is the base class for all errors raised by the rule language.  Parse errors and
 * evaluation errors both indicate a defect in the rule text, so they are unchecked and
 * propagate to the caller.
 *
 */
public class ExpressionException extends RuntimeException {

    /** serialization ID */
    private static final long serialVersionUID = 4129730577016393442L;

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }

}
