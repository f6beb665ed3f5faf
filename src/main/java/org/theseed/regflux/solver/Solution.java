/**
 *
 */
package org.theseed.regflux.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents the result of an optimization.  It contains the status, the
 * objective value, and a map of identifiers to values.  For a solver result the values are
 * fluxes; for a regulatory analysis they also include the regulatory state.
 *
 */
public class Solution {

    // FIELDS
    /** optimization status */
    private final Status status;
    /** objective value (NaN if no solution) */
    private final double objectiveValue;
    /** map of identifiers to values */
    private final Map<String, Double> values;
    /** solver message (may be empty) */
    private final String message;

    /**
     * Enumeration of the keys used in the JSON rendering.
     */
    public static enum SolutionKeys implements JsonKey {
        STATUS("unknown"), OBJECTIVE_VALUE(Double.NaN), VALUES(null), MESSAGE("");

        private final Object m_value;

        private SolutionKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * Construct a solution.
     *
     * @param status			optimization status
     * @param objectiveValue	objective value
     * @param values			map of identifiers to values
     * @param message			solver message
     */
    public Solution(Status status, double objectiveValue, Map<String, Double> values, String message) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(values));
        this.message = (message == null ? "" : message);
    }

    /**
     * @return a solution with no values for a failed optimization
     *
     * @param status	failure status
     * @param message	explanatory message
     */
    public static Solution failed(Status status, String message) {
        return new Solution(status, Double.NaN, Collections.emptyMap(), message);
    }

    /**
     * @return a copy of this solution with a different value map
     *
     * @param newValues		replacement value map
     */
    public Solution withValues(Map<String, Double> newValues) {
        return new Solution(this.status, this.objectiveValue, newValues, this.message);
    }

    /**
     * @return the optimization status
     */
    public Status getStatus() {
        return this.status;
    }

    /**
     * @return the objective value
     */
    public double getObjectiveValue() {
        return this.objectiveValue;
    }

    /**
     * @return the map of identifiers to values
     */
    public Map<String, Double> getValues() {
        return this.values;
    }

    /**
     * @return the value of an identifier, or 0 if it has none
     *
     * @param id	identifier of interest
     */
    public double getValue(String id) {
        return this.values.getOrDefault(id, 0.0);
    }

    /**
     * @return the solver message
     */
    public String getMessage() {
        return this.message;
    }

    /**
     * @return a JSON rendering of this solution
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(SolutionKeys.STATUS.getKey(), this.status.name());
        retVal.put(SolutionKeys.OBJECTIVE_VALUE.getKey(), this.objectiveValue);
        JsonObject valueObject = new JsonObject();
        valueObject.putAll(this.values);
        retVal.put(SolutionKeys.VALUES.getKey(), valueObject);
        retVal.put(SolutionKeys.MESSAGE.getKey(), this.message);
        return retVal;
    }

    @Override
    public String toString() {
        return "Solution [" + this.status + ", objective = " + this.objectiveValue + "]";
    }

}
