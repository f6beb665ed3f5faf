/**
 *
 */
package org.theseed.regflux.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * This resolver evaluates arithmetic expressions over real numbers.  Operands are numeric
 * literals, the constants "pi" and "e", or names bound in a variable map.  Operators are the
 * five infix operators plus a library of common functions.  "min" and "max" accept any
 * number of arguments.
 *
 * A one-argument function call is stored with an empty left operand, which this resolver
 * converts to zero; the unary functions therefore only look at their right value.  The same
 * convention makes a prefix sign "-x" evaluate as "0 - x".
 *
 */
public class ArithmeticResolver implements Resolver<Double> {

    // FIELDS
    /** variable bindings */
    private final Map<String, Double> variables;

    /** named constants */
    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

    /** functions that accept any number of arguments */
    private static final Map<String, BinaryOperator<Double>> VARIADICS = new HashMap<String, BinaryOperator<Double>>();

    /** binary operators and two-argument functions */
    private static final Map<String, BinaryOperator<Double>> OPERATORS = new HashMap<String, BinaryOperator<Double>>();

    static {
        OPERATORS.put("+", (x, y) -> x + y);
        OPERATORS.put("-", (x, y) -> x - y);
        OPERATORS.put("*", (x, y) -> x * y);
        OPERATORS.put("/", (x, y) -> x / y);
        OPERATORS.put(Grammar.POWER, (x, y) -> Math.pow(x, y));
        OPERATORS.put("pow", (x, y) -> Math.pow(x, y));
        OPERATORS.put("min", (x, y) -> Math.min(x, y));
        OPERATORS.put("max", (x, y) -> Math.max(x, y));
        VARIADICS.put("min", OPERATORS.get("min"));
        VARIADICS.put("max", OPERATORS.get("max"));
        unary("sqrt", Math::sqrt);
        unary("exp", Math::exp);
        unary("log", Math::log);
        unary("log10", Math::log10);
        unary("log2", x -> Math.log(x) / Math.log(2.0));
        unary("abs", Math::abs);
        unary("sin", Math::sin);
        unary("cos", Math::cos);
        unary("tan", Math::tan);
        unary("floor", Math::floor);
        unary("ceil", Math::ceil);
    }

    /**
     * Register a one-argument function.
     *
     * @param name		function name
     * @param fn		function to apply to the right operand
     */
    private static void unary(String name, DoubleUnaryOperator fn) {
        OPERATORS.put(name, (x, y) -> fn.applyAsDouble(y));
    }

    /**
     * Construct a resolver with no variable bindings.
     */
    public ArithmeticResolver() {
        this(Collections.emptyMap());
    }

    /**
     * Construct a resolver.
     *
     * @param variables		map of variable names to values
     */
    public ArithmeticResolver(Map<String, Double> variables) {
        this.variables = variables;
    }

    @Override
    public Double resolveOperand(String operand) {
        Double retVal;
        if (operand.equals(ExprNode.EMPTY_LEAF))
            retVal = 0.0;
        else if (ExprNode.isNumber(operand))
            retVal = Double.valueOf(operand);
        else {
            retVal = this.variables.get(operand);
            if (retVal == null)
                retVal = CONSTANTS.get(operand);
            if (retVal == null)
                throw new UnboundVariableException(operand);
        }
        return retVal;
    }

    @Override
    public BinaryOperator<Double> resolveOperator(String operator) {
        BinaryOperator<Double> retVal = OPERATORS.get(operator);
        if (retVal == null)
            throw new UnsupportedOperatorException(operator);
        return retVal;
    }

    @Override
    public BinaryOperator<Double> resolveVariadic(String function) {
        BinaryOperator<Double> retVal = VARIADICS.get(function);
        if (retVal == null)
            throw new UnsupportedOperatorException(function);
        return retVal;
    }

    /**
     * @return TRUE if the specified name is a function or operator known to this resolver
     *
     * @param name		name to check
     */
    public static boolean isKnown(String name) {
        return OPERATORS.containsKey(name);
    }

}
