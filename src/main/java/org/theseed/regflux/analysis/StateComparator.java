/**
 *
 */
package org.theseed.regflux.analysis;

import java.util.HashSet;
import java.util.Set;

import org.theseed.regflux.model.RegModel;

/**
 * This object decides whether two regulatory states are the same for the purpose of
 * attractor detection.  Reaction and metabolite entries hold fluxes, and match if both or
 * neither carry non-negligible flux.  All other entries match if they are numerically equal
 * within the tolerance.  An entry missing from a state counts as 0.
 *
 */
public class StateComparator {

    // FIELDS
    /** model defining which identifiers are reactions and metabolites */
    private final RegModel model;
    /** numeric tolerance */
    private final double tolerance;

    /**
     * Construct a state comparator.
     *
     * @param model			controlling model
     * @param tolerance		numeric tolerance
     */
    public StateComparator(RegModel model, double tolerance) {
        this.model = model;
        this.tolerance = tolerance;
    }

    /**
     * @return TRUE if the two states match
     *
     * @param state1	first state
     * @param state2	second state
     */
    public boolean matches(RegulatoryState state1, RegulatoryState state2) {
        Set<String> ids = new HashSet<String>(state1.keySet());
        ids.addAll(state2.keySet());
        boolean retVal = true;
        for (String id : ids) {
            if (retVal) {
                double v1 = state1.get(id);
                double v2 = state2.get(id);
                if (this.model.isReaction(id) || this.model.isMetabolite(id))
                    retVal = (Math.abs(v1) > this.tolerance) == (Math.abs(v2) > this.tolerance);
                else
                    retVal = Math.abs(v1 - v2) <= this.tolerance;
            }
        }
        return retVal;
    }

    /**
     * @return the tolerance used for comparisons
     */
    public double getTolerance() {
        return this.tolerance;
    }

}
