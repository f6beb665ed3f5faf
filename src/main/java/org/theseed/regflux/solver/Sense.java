/**
 *
 */
package org.theseed.regflux.solver;

/**
 * Enumeration of the relational senses of a linear constraint.
 *
 */
public enum Sense {
    /** left side less than or equal to the right side */
    LE {
        @Override
        public boolean test(double lhs, double rhs, double tolerance) {
            return lhs <= rhs + tolerance;
        }
    },
    /** left side equal to the right side */
    EQ {
        @Override
        public boolean test(double lhs, double rhs, double tolerance) {
            return Math.abs(lhs - rhs) <= tolerance;
        }
    },
    /** left side greater than or equal to the right side */
    GE {
        @Override
        public boolean test(double lhs, double rhs, double tolerance) {
            return lhs >= rhs - tolerance;
        }
    };

    /**
     * @return TRUE if the relation holds within the specified tolerance
     *
     * @param lhs			value of the left side
     * @param rhs			value of the right side
     * @param tolerance		allowable numeric error
     */
    public abstract boolean test(double lhs, double rhs, double tolerance);

}
