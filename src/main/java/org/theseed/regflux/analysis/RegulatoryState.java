/**
 *
 */
package org.theseed.regflux.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A regulatory state maps identifiers (regulators, genes, reactions and metabolites) to
 * values.  Boolean variables hold 0 or 1; reactions and metabolites may hold fluxes.  An
 * identifier not in the state has the value 0.
 *
 * States are mutable while being assembled, but the analysis engine never changes a state
 * once it has been recorded in a trajectory:  each step produces a fresh copy.
 *
 */
public class RegulatoryState {

    // FIELDS
    /** map of identifiers to values */
    private final Map<String, Double> values;

    /**
     * Construct an empty state.
     */
    public RegulatoryState() {
        this.values = new LinkedHashMap<String, Double>();
    }

    /**
     * Construct a state from a map of values.
     *
     * @param values	initial values
     */
    public RegulatoryState(Map<String, Double> values) {
        this.values = new LinkedHashMap<String, Double>(values);
    }

    /**
     * @return the value of an identifier (0 if it is not in the state)
     *
     * @param id	identifier of interest
     */
    public double get(String id) {
        return this.values.getOrDefault(id, 0.0);
    }

    /**
     * @return TRUE if the identifier has an explicit value in this state
     *
     * @param id	identifier of interest
     */
    public boolean contains(String id) {
        return this.values.containsKey(id);
    }

    /**
     * Store a value.
     *
     * @param id		identifier to update
     * @param value		new value
     */
    public void put(String id, double value) {
        this.values.put(id, value);
    }

    /**
     * Store all the values in a map.
     *
     * @param other		map of identifiers to new values
     */
    public void putAll(Map<String, Double> other) {
        this.values.putAll(other);
    }

    /**
     * @return a new state containing this state's values overridden by another state's
     *
     * @param other		overriding state
     */
    public RegulatoryState merge(RegulatoryState other) {
        RegulatoryState retVal = this.copy();
        retVal.values.putAll(other.values);
        return retVal;
    }

    /**
     * @return a copy of this state
     */
    public RegulatoryState copy() {
        return new RegulatoryState(this.values);
    }

    /**
     * @return the set of identifiers with a nonzero value
     */
    public Set<String> getActive() {
        Set<String> retVal = new HashSet<String>();
        for (Map.Entry<String, Double> entry : this.values.entrySet()) {
            if (entry.getValue() != 0.0)
                retVal.add(entry.getKey());
        }
        return retVal;
    }

    /**
     * @return an unmodifiable view of the values in this state
     */
    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(this.values);
    }

    /**
     * @return the set of identifiers with explicit values
     */
    public Set<String> keySet() {
        return Collections.unmodifiableSet(this.values.keySet());
    }

    /**
     * @return the number of identifiers with explicit values
     */
    public int size() {
        return this.values.size();
    }

    @Override
    public String toString() {
        return this.values.toString();
    }

    @Override
    public int hashCode() {
        return this.values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RegulatoryState other = (RegulatoryState) obj;
        return this.values.equals(other.values);
    }

}
