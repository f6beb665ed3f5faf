/**
 *
 */
package org.theseed.regflux.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.theseed.regflux.solver.Solution;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object contains the result of a dynamic regulatory analysis:  one solution for each
 * state of the attractor (or of the whole trajectory if no attractor was found before the
 * iteration limit).
 *
 */
public class DynamicSolution {

    // FIELDS
    /** solutions for the attractor states, in order */
    private final List<Solution> solutions;
    /** states of the attractor, in order */
    private final List<RegulatoryState> states;
    /** TRUE if an attractor was found */
    private final boolean converged;
    /** number of state transitions performed */
    private final int iterations;

    /**
     * Construct a dynamic solution.
     *
     * @param states		attractor states
     * @param solutions		solution for each attractor state
     * @param converged		TRUE if an attractor was found
     * @param iterations	number of state transitions performed
     */
    public DynamicSolution(List<RegulatoryState> states, List<Solution> solutions, boolean converged, int iterations) {
        this.states = new ArrayList<RegulatoryState>(states);
        this.solutions = new ArrayList<Solution>(solutions);
        this.converged = converged;
        this.iterations = iterations;
    }

    /**
     * @return the solutions for the attractor states
     */
    public List<Solution> getSolutions() {
        return Collections.unmodifiableList(this.solutions);
    }

    /**
     * @return the attractor states
     */
    public List<RegulatoryState> getStates() {
        return Collections.unmodifiableList(this.states);
    }

    /**
     * @return the number of states in the attractor
     */
    public int size() {
        return this.solutions.size();
    }

    /**
     * @return TRUE if an attractor was found before the iteration limit
     */
    public boolean isConverged() {
        return this.converged;
    }

    /**
     * @return the number of state transitions performed
     */
    public int getIterations() {
        return this.iterations;
    }

    /**
     * @return a JSON rendering of this result
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("converged", this.converged);
        retVal.put("iterations", this.iterations);
        JsonArray solutionList = new JsonArray();
        for (Solution solution : this.solutions)
            solutionList.add(solution.toJson());
        retVal.put("solutions", solutionList);
        return retVal;
    }

    @Override
    public String toString() {
        return "DynamicSolution [" + this.solutions.size() + " states, "
                + (this.converged ? "converged" : "not converged") + "]";
    }

}
