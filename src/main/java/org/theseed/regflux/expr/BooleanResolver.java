/**
 *
 */
package org.theseed.regflux.expr;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * This resolver evaluates Boolean rules.  An identifier is TRUE if it is "1" or "TRUE" or a
 * member of the active set.  An identifier containing a relational operator is a condition
 * and is evaluated against the variable map.  Everything else, including the empty leaf, is
 * FALSE, so that the NOT node "@ ~ x" yields the negation of "x".
 *
 */
public class BooleanResolver implements Resolver<Boolean> {

    // FIELDS
    /** set of identifiers considered true */
    private final Set<String> active;
    /** variable values for conditions */
    private final Map<String, Double> variables;

    /** operator functions */
    private static final Map<String, BinaryOperator<Boolean>> OPERATORS = Map.of(
            Grammar.AND, (x, y) -> x && y,
            Grammar.OR, (x, y) -> x || y,
            Grammar.NOT, (x, y) -> ! y);

    /**
     * Construct a resolver with no condition variables.
     *
     * @param active	identifiers to be considered true
     */
    public BooleanResolver(Collection<String> active) {
        this(active, Collections.emptyMap());
    }

    /**
     * Construct a resolver.
     *
     * @param active		identifiers to be considered true
     * @param variables		variable values used for relational conditions
     */
    public BooleanResolver(Collection<String> active, Map<String, Double> variables) {
        this.active = (active instanceof Set ? (Set<String>) active : new HashSet<String>(active));
        this.variables = variables;
    }

    @Override
    public Boolean resolveOperand(String operand) {
        boolean retVal;
        if (operand.equals("1") || operand.equalsIgnoreCase("TRUE") || this.active.contains(operand))
            retVal = true;
        else if (ExprNode.isCondition(operand))
            retVal = ConditionEvaluator.evaluate(operand, this.variables);
        else
            retVal = false;
        return retVal;
    }

    @Override
    public BinaryOperator<Boolean> resolveOperator(String operator) {
        BinaryOperator<Boolean> retVal = OPERATORS.get(operator);
        if (retVal == null)
            throw new UnsupportedOperatorException(operator);
        return retVal;
    }

    /**
     * Evaluate a Boolean rule against a set of true identifiers.
     *
     * @param expression	rule to evaluate
     * @param active		identifiers to be considered true
     *
     * @return the truth value of the rule
     */
    public static boolean evaluate(String expression, Collection<String> active) {
        ExprNode tree = TreeBuilder.buildTree(expression, Grammar.BOOLEAN);
        return tree.evaluate(new BooleanResolver(active));
    }

}
