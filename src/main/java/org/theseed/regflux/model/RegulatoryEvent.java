/**
 *
 */
package org.theseed.regflux.model;

import java.util.Collection;
import java.util.Map;

import org.theseed.regflux.expr.BooleanResolver;
import org.theseed.regflux.expr.ExprNode;
import org.theseed.regflux.expr.Grammar;
import org.theseed.regflux.expr.TreeBuilder;

/**
 * A regulatory event pairs a coefficient with a Boolean rule.  When the rule is satisfied by
 * the current regulatory state, the coefficient becomes the next value of the interaction's
 * target.
 *
 */
public class RegulatoryEvent {

    // FIELDS
    /** coefficient assigned to the target when the rule holds */
    private final double coefficient;
    /** text of the rule */
    private final String rule;
    /** parsed rule (built on first use) */
    private ExprNode tree;

    /**
     * Construct a regulatory event.
     *
     * @param coefficient	coefficient to assign when the rule is true
     * @param rule			Boolean rule text
     */
    public RegulatoryEvent(double coefficient, String rule) {
        this.coefficient = coefficient;
        this.rule = rule;
        this.tree = null;
    }

    /**
     * @return the coefficient assigned when the rule is true
     */
    public double getCoefficient() {
        return this.coefficient;
    }

    /**
     * @return the rule text
     */
    public String getRule() {
        return this.rule;
    }

    /**
     * @return the parsed rule
     */
    public ExprNode getTree() {
        if (this.tree == null)
            this.tree = TreeBuilder.buildTree(this.rule, Grammar.BOOLEAN);
        return this.tree;
    }

    /**
     * @return TRUE if this event's rule holds
     *
     * @param active		identifiers currently active
     * @param variables		current state values, for relational conditions
     */
    public boolean isTriggered(Collection<String> active, Map<String, Double> variables) {
        return this.getTree().evaluate(new BooleanResolver(active, variables));
    }

    @Override
    public String toString() {
        return this.coefficient + " if " + this.rule;
    }

}
