/**
 *
 */
package org.theseed.regflux.solver;

/**
 * This is a simple immutable object representing the lower and upper bounds on a flux.
 *
 */
public class Bounds {

    // FIELDS
    /** lower bound */
    private final double lower;
    /** upper bound */
    private final double upper;

    /** bounds that block a reaction completely */
    public static final Bounds ZERO = new Bounds(0.0, 0.0);

    /**
     * Construct a new bounds object.
     *
     * @param lower		lower bound
     * @param upper		upper bound
     */
    public Bounds(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @return the lower bound
     */
    public double getLower() {
        return this.lower;
    }

    /**
     * @return the upper bound
     */
    public double getUpper() {
        return this.upper;
    }

    /**
     * @return TRUE if these bounds permit no flux at all
     */
    public boolean isBlocked() {
        return this.lower == 0.0 && this.upper == 0.0;
    }

    /**
     * @return TRUE if these bounds admit at least one value
     */
    public boolean isConsistent() {
        return this.lower <= this.upper;
    }

    /**
     * @return the intersection of these bounds with another set of bounds
     *
     * @param other		other bounds to intersect
     */
    public Bounds intersect(Bounds other) {
        return new Bounds(Math.max(this.lower, other.lower), Math.min(this.upper, other.upper));
    }

    @Override
    public String toString() {
        return "(" + this.lower + ", " + this.upper + ")";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp = Double.doubleToLongBits(this.lower);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(this.upper);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Bounds other = (Bounds) obj;
        if (Double.doubleToLongBits(this.lower) != Double.doubleToLongBits(other.lower))
            return false;
        if (Double.doubleToLongBits(this.upper) != Double.doubleToLongBits(other.upper))
            return false;
        return true;
    }

}
