/**
 *
 */
package org.theseed.regflux.expr;

import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * This resolver computes a numeric expression level for a gene rule.  Each gene operand takes
 * its value from a map; genes not in the map take a default "unexpressed" value.  AND and OR
 * are replaced by caller-supplied aggregators, by default minimum and maximum.
 *
 */
public class GeneExpressionResolver implements Resolver<Double> {

    // FIELDS
    /** expression level for each gene */
    private final Map<String, Double> levels;
    /** value for genes not in the map */
    private double unexpressed;
    /** aggregator for AND */
    private BinaryOperator<Double> andFn;
    /** aggregator for OR */
    private BinaryOperator<Double> orFn;

    /** default value for unlisted genes */
    public static final double DEFAULT_UNEXPRESSED = 1.0;

    /**
     * Construct a resolver with the default aggregators.
     *
     * @param levels	map of gene IDs to expression levels
     */
    public GeneExpressionResolver(Map<String, Double> levels) {
        this.levels = levels;
        this.unexpressed = DEFAULT_UNEXPRESSED;
        this.andFn = Math::min;
        this.orFn = Math::max;
    }

    /**
     * Specify the aggregators.
     *
     * @param andFn		function to use for AND
     * @param orFn		function to use for OR
     *
     * @return this object, for chaining
     */
    public GeneExpressionResolver setAggregators(BinaryOperator<Double> andFn, BinaryOperator<Double> orFn) {
        this.andFn = andFn;
        this.orFn = orFn;
        return this;
    }

    /**
     * Specify the value for genes not in the level map.
     *
     * @param unexpressed	new default value
     *
     * @return this object, for chaining
     */
    public GeneExpressionResolver setUnexpressed(double unexpressed) {
        this.unexpressed = unexpressed;
        return this;
    }

    @Override
    public Double resolveOperand(String operand) {
        Double retVal;
        if (operand.equals(ExprNode.EMPTY_LEAF))
            retVal = null;
        else
            retVal = this.levels.getOrDefault(operand, this.unexpressed);
        return retVal;
    }

    @Override
    public BinaryOperator<Double> resolveOperator(String operator) {
        BinaryOperator<Double> retVal;
        switch (operator) {
        case Grammar.AND :
            retVal = this.andFn;
            break;
        case Grammar.OR :
            retVal = this.orFn;
            break;
        default :
            throw new UnsupportedOperatorException(operator);
        }
        return retVal;
    }

}
