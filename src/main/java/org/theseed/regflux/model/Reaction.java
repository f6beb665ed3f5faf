/**
 *
 */
package org.theseed.regflux.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theseed.regflux.solver.Bounds;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a reaction present in a metabolic model.  The reaction contains
 * its flux bounds, the gene rule that determines whether an enzyme is available to
 * catalyze it, and the stoichiometry of the compounds involved.
 *
 * A reaction can be built directly or from a JSON object in the common constraint-based
 * model layout, where "metabolites" maps each compound ID to its coefficient.
 *
 */
public class Reaction implements Comparable<Reaction> {

    // FIELDS
    /** ID of this reaction */
    private String id;
    /** name of the reaction */
    private String name;
    /** lower flux bound */
    private double lowerBound;
    /** upper flux bound */
    private double upperBound;
    /** rule for triggering the reaction (text based on gene IDs) */
    private String reactionRule;
    /** metabolite list */
    private List<Stoich> metabolites;

    /** default magnitude for an unbounded flux */
    public static final double DEFAULT_BOUND = 1000.0;

    private static enum ReactionKeys implements JsonKey {
        ID(""), NAME(""), LOWER_BOUND(-DEFAULT_BOUND), UPPER_BOUND(DEFAULT_BOUND),
        GENE_REACTION_RULE(""), METABOLITES(null);

        private final Object m_value;

        private ReactionKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This is a simple object to represent stoichiometry.  The sort order puts reactants
     * before products.
     */
    public static class Stoich implements Comparable<Stoich> {

        /** stoichiometric coefficient (negative for reactants) */
        private double coefficient;
        /** identifier of metabolite */
        private String metabolite;

        /**
         * Construct a new stoichiometric representation.
         *
         * @param coeff		coefficient
         * @param meta		metabolite ID
         */
        public Stoich(double coeff, String meta) {
            this.coefficient = coeff;
            this.metabolite = meta;
        }

        @Override
        public int compareTo(Stoich o) {
            int retVal = Double.compare(this.coefficient, o.coefficient);
            if (retVal == 0)
                retVal = this.metabolite.compareTo(o.metabolite);
            return retVal;
        }

        /**
         * @return the coefficient (always positive)
         */
        public double getCoeff() {
            return Math.abs(this.coefficient);
        }

        /**
         * @return the signed coefficient
         */
        public double getCoefficient() {
            return this.coefficient;
        }

        /**
         * @return TRUE for a product, FALSE for a reactant
         */
        public boolean isProduct() {
            return (this.coefficient > 0);
        }

        @Override
        public String toString() {
            double coeff = this.getCoeff();
            String retVal;
            if (coeff == 1.0)
                retVal = this.metabolite;
            else if (coeff == Math.rint(coeff))
                retVal = String.format("%d*%s", (long) coeff, this.metabolite);
            else
                retVal = coeff + "*" + this.metabolite;
            return retVal;
        }

        public String getMetabolite() {
            return this.metabolite;
        }

    }

    /**
     * Construct a reaction with no metabolites and no gene rule.
     *
     * @param id		ID of this reaction
     * @param name		name of the reaction
     * @param lb		lower flux bound
     * @param ub		upper flux bound
     */
    public Reaction(String id, String name, double lb, double ub) {
        this.id = id;
        this.name = (StringUtils.isBlank(name) ? id : name);
        this.lowerBound = lb;
        this.upperBound = ub;
        this.reactionRule = "";
        this.metabolites = new ArrayList<Stoich>();
    }

    /**
     * Construct a reaction from a JSON object.
     *
     * @param reactionObject	JSON object containing the reaction
     */
    public Reaction(JsonObject reactionObject) {
        this.id = reactionObject.getStringOrDefault(ReactionKeys.ID);
        if (StringUtils.isBlank(this.id))
            throw new IllegalArgumentException("Reaction object has no ID.");
        String name = reactionObject.getStringOrDefault(ReactionKeys.NAME);
        this.name = (StringUtils.isBlank(name) ? this.id : name);
        this.lowerBound = reactionObject.getDoubleOrDefault(ReactionKeys.LOWER_BOUND);
        this.upperBound = reactionObject.getDoubleOrDefault(ReactionKeys.UPPER_BOUND);
        this.reactionRule = reactionObject.getStringOrDefault(ReactionKeys.GENE_REACTION_RULE);
        // For the metabolites map, we convert each entry to a stoichiometry.
        this.metabolites = new ArrayList<Stoich>();
        JsonObject metaMap = (JsonObject) reactionObject.get(ReactionKeys.METABOLITES.getKey());
        if (metaMap != null) {
            for (Map.Entry<String, Object> metaEntry : metaMap.entrySet()) {
                double coeff = ((Number) metaEntry.getValue()).doubleValue();
                this.metabolites.add(new Stoich(coeff, metaEntry.getKey()));
            }
            Collections.sort(this.metabolites);
        }
    }

    /**
     * Add a metabolite to this reaction.
     *
     * @param metabolite	ID of the metabolite
     * @param coeff			stoichiometric coefficient (negative for a reactant)
     *
     * @return this object, for chaining
     */
    public Reaction addMetabolite(String metabolite, double coeff) {
        this.metabolites.add(new Stoich(coeff, metabolite));
        Collections.sort(this.metabolites);
        return this;
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the reaction's name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the lower flux bound
     */
    public double getLowerBound() {
        return this.lowerBound;
    }

    /**
     * @return the upper flux bound
     */
    public double getUpperBound() {
        return this.upperBound;
    }

    /**
     * @return the flux bounds
     */
    public Bounds getBounds() {
        return new Bounds(this.lowerBound, this.upperBound);
    }

    /**
     * Specify new flux bounds.
     *
     * @param lb		new lower bound
     * @param ub		new upper bound
     */
    public void setBounds(double lb, double ub) {
        this.lowerBound = lb;
        this.upperBound = ub;
    }

    /**
     * @return the rule for triggering the reaction
     */
    public String getReactionRule() {
        return this.reactionRule;
    }

    /**
     * Specify a new gene rule.  Callers holding a parsed copy of the old rule must
     * refresh it; {@link RegModel#setReactionRule} does this for the model's cache.
     *
     * @param rule		new gene rule (may be empty)
     */
    protected void setReactionRule(String rule) {
        this.reactionRule = (rule == null ? "" : rule);
    }

    /**
     * @return TRUE if this reaction is reversible
     */
    public boolean isReversible() {
        return this.lowerBound < 0.0;
    }

    /**
     * @return TRUE if this reaction involves exactly one metabolite (an exchange or boundary reaction)
     */
    public boolean isExchange() {
        return this.metabolites.size() == 1;
    }

    /**
     * @return the components of the reaction (reactants and products with stoichometric coefficients)
     */
    public List<Stoich> getMetabolites() {
        return this.metabolites;
    }

    /**
     * @return a map of metabolite IDs to signed coefficients
     */
    public Map<String, Double> getStoichiometry() {
        Map<String, Double> retVal = new LinkedHashMap<String, Double>();
        for (Stoich stoich : this.metabolites)
            retVal.merge(stoich.getMetabolite(), stoich.getCoefficient(), Double::sum);
        return retVal;
    }

    /**
     * @return the coefficient of a metabolite in this reaction, or 0 if it is not involved
     *
     * @param metabolite	ID of the metabolite of interest
     */
    public double getCoefficient(String metabolite) {
        return this.getStoichiometry().getOrDefault(metabolite, 0.0);
    }

    /**
     * @return a JSON object describing this reaction
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(ReactionKeys.ID.getKey(), this.id);
        retVal.put(ReactionKeys.NAME.getKey(), this.name);
        retVal.put(ReactionKeys.LOWER_BOUND.getKey(), this.lowerBound);
        retVal.put(ReactionKeys.UPPER_BOUND.getKey(), this.upperBound);
        retVal.put(ReactionKeys.GENE_REACTION_RULE.getKey(), this.reactionRule);
        JsonObject metaMap = new JsonObject();
        metaMap.putAll(this.getStoichiometry());
        retVal.put(ReactionKeys.METABOLITES.getKey(), metaMap);
        return retVal;
    }

    @Override
    public int compareTo(Reaction o) {
        return this.id.compareTo(o.id);
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + "(" + this.getName() + ")";
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Reaction other = (Reaction) obj;
        return this.id.equals(other.id);
    }

}
