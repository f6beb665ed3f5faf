/**
 *
 */
package org.theseed.regflux.expr;

import java.util.function.BinaryOperator;

/**
 * A resolver supplies the two functions needed to evaluate an expression tree:  one that
 * converts a leaf value into a result and one that returns the combining function for an
 * operator.  A NULL operand result means "absent".
 *
 * @param <T>	type of the evaluation result
 */
public interface Resolver<T> {

    /**
     * @return the value of a leaf, or NULL if the operand is absent
     *
     * @param operand	leaf value (possibly the empty-leaf sentinel)
     */
    public T resolveOperand(String operand);

    /**
     * @return the function that combines the left and right operand values of an operator
     *
     * @param operator	operator symbol or function name
     *
     * @throws UnsupportedOperatorException if the operator has no mapping
     */
    public BinaryOperator<T> resolveOperator(String operator);

    /**
     * @return the function used to fold the arguments of a call with three or more arguments
     *
     * @param function	function name
     *
     * @throws UnsupportedOperatorException if the function cannot take that many arguments
     */
    public default BinaryOperator<T> resolveVariadic(String function) {
        throw new UnsupportedOperatorException(function);
    }

}
