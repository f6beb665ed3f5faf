/**
 *
 */
package org.theseed.regflux.expr;

import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * This class evaluates expression trees by a post-order walk.  All knowledge of what the
 * operands and operators mean is injected through two resolver functions; nothing in a rule
 * string is ever executed as code.
 *
 * An internal node whose left or right value is absent (NULL) passes the other value through
 * unchanged.  This lets the single binary node shape carry both unary and binary semantics.
 * A call with three or more arguments is evaluated by folding its arguments from the left with
 * the resolver's variadic function; the plain function-pair form has none.
 *
 */
public class TreeEvaluator {

    private TreeEvaluator() { }

    /**
     * Evaluate a tree.
     *
     * @param node			root of the tree
     * @param operandFn		function that converts a leaf value to a result (NULL means absent)
     * @param operatorFn	function that returns the combining function for an operator
     *
     * @return the value of the expression (NULL if every operand was absent)
     *
     * @throws UnsupportedOperatorException if an operator has no mapping
     */
    public static <T> T evaluate(ExprNode node, Function<String, T> operandFn,
            Function<String, BinaryOperator<T>> operatorFn) {
        if (operandFn == null || operatorFn == null)
            throw new IllegalArgumentException("Both an operand resolver and an operator resolver are required.");
        return walk(node, operandFn, operatorFn, x -> {
            throw new UnsupportedOperatorException(x);
        });
    }

    /**
     * Evaluate a tree using a resolver object.
     *
     * @param node			root of the tree
     * @param resolver		resolver for operands and operators
     *
     * @return the value of the expression
     */
    public static <T> T evaluate(ExprNode node, Resolver<T> resolver) {
        if (resolver == null)
            throw new IllegalArgumentException("A resolver is required.");
        return walk(node, resolver::resolveOperand, resolver::resolveOperator, resolver::resolveVariadic);
    }

    /**
     * Recursively evaluate a subtree.
     *
     * @param node			root of the subtree
     * @param operandFn		operand resolver
     * @param operatorFn	operator resolver
     * @param variadicFn	resolver for calls with three or more arguments
     *
     * @return the value of the subtree
     */
    private static <T> T walk(ExprNode node, Function<String, T> operandFn,
            Function<String, BinaryOperator<T>> operatorFn, Function<String, BinaryOperator<T>> variadicFn) {
        T retVal;
        if (node.isLeaf())
            retVal = operandFn.apply(node.getValue());
        else if (node.getArity() > ExprNode.BINARY_FUNCTION) {
            BinaryOperator<T> op = variadicFn.apply(node.getValue());
            retVal = null;
            for (ExprNode arg : node.getArguments()) {
                T argVal = walk(arg, operandFn, operatorFn, variadicFn);
                if (retVal == null)
                    retVal = argVal;
                else if (argVal != null)
                    retVal = op.apply(retVal, argVal);
            }
        } else {
            T leftVal = walk(node.getLeft(), operandFn, operatorFn, variadicFn);
            T rightVal = walk(node.getRight(), operandFn, operatorFn, variadicFn);
            if (leftVal == null)
                retVal = rightVal;
            else if (rightVal == null)
                retVal = leftVal;
            else {
                BinaryOperator<T> op = operatorFn.apply(node.getValue());
                if (op == null)
                    throw new UnsupportedOperatorException(node.getValue());
                retVal = op.apply(leftVal, rightVal);
            }
        }
        return retVal;
    }

}
