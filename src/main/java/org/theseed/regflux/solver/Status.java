/**
 *
 */
package org.theseed.regflux.solver;

/**
 * Enumeration of the possible outcomes of an optimization.
 *
 */
public enum Status {
    OPTIMAL("optimal"), SUBOPTIMAL("suboptimal"), INFEASIBLE("infeasible"), UNBOUNDED("unbounded"),
    INF_OR_UNB("infeasible or unbounded"), UNKNOWN("unknown");

    /** display description */
    private final String description;

    private Status(String description) {
        this.description = description;
    }

    /**
     * @return TRUE if this status indicates that a usable flux vector was found
     */
    public boolean hasValues() {
        return this == OPTIMAL || this == SUBOPTIMAL;
    }

    @Override
    public String toString() {
        return this.description;
    }

}
