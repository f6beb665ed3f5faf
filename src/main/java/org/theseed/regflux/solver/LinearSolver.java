/**
 *
 */
package org.theseed.regflux.solver;

import java.util.Map;

/**
 * This interface describes the capabilities required of a linear-programming back end.  A
 * solver holds a problem built from variables (one per reaction) and linear constraints (one
 * mass balance per metabolite).  Each call to {@link #solve} may temporarily override the
 * bounds of some variables; the overrides do not persist into later calls.
 *
 * Implementations are assumed to have a single owner and need not be thread-safe.
 *
 */
public interface LinearSolver {

    /**
     * Add a variable to the problem.
     *
     * @param id	variable identifier
     * @param lb	lower bound
     * @param ub	upper bound
     */
    public void addVariable(String id, double lb, double ub);

    /**
     * Add a linear constraint to the problem.
     *
     * @param id			constraint identifier
     * @param coefficients	map of variable identifiers to coefficients
     * @param sense			relational sense of the constraint
     * @param rhs			right-hand side
     */
    public void addConstraint(String id, Map<String, Double> coefficients, Sense sense, double rhs);

    /**
     * Optimize a linear objective.
     *
     * @param objective		map of variable identifiers to objective coefficients
     * @param minimize		TRUE to minimize, FALSE to maximize
     * @param constraints	temporary bound overrides for this call only, keyed by variable identifier
     *
     * @return the solution; infeasibility is reported in the solution status, never thrown
     */
    public Solution solve(Map<String, Double> objective, boolean minimize, Map<String, Bounds> constraints);

}
