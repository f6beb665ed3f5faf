/**
 *
 */
package org.theseed.regflux.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.regflux.expr.ExprNode;
import org.theseed.regflux.expr.Grammar;
import org.theseed.regflux.expr.TreeBuilder;

/**
 * This object represents an integrated regulatory-metabolic model.  The metabolic side
 * consists of reactions connecting metabolites, each reaction gated by a gene rule.  The
 * regulatory side consists of regulators and interactions that compute the next value of
 * each target (a regulator, gene, reaction or metabolite) from the current state.
 *
 * Parsed gene rules are cached by reaction ID.  A rule is parsed on first access and
 * re-parsed only after it changes or is explicitly invalidated.
 *
 */
public class RegModel {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RegModel.class);
    /** name of model */
    private String name;
    /** map of reaction IDs to reactions */
    private Map<String, Reaction> reactionMap;
    /** set of metabolite IDs */
    private Set<String> metabolites;
    /** set of gene IDs */
    private Set<String> genes;
    /** set of regulator IDs */
    private Set<String> regulators;
    /** map of target IDs to interactions */
    private Map<String, Interaction> interactionMap;
    /** map of reaction IDs to objective coefficients */
    private Map<String, Double> objective;
    /** map of reaction IDs to parsed gene rules */
    private Map<String, ExprNode> gprCache;

    /**
     * Construct an empty model.
     *
     * @param name		name of the model
     */
    public RegModel(String name) {
        this.name = name;
        this.reactionMap = new LinkedHashMap<String, Reaction>();
        this.metabolites = new LinkedHashSet<String>();
        this.genes = new LinkedHashSet<String>();
        this.regulators = new LinkedHashSet<String>();
        this.interactionMap = new LinkedHashMap<String, Interaction>();
        this.objective = new LinkedHashMap<String, Double>();
        this.gprCache = new HashMap<String, ExprNode>();
    }

    /**
     * Add a reaction to the model.  Its metabolites and the genes named in its rule are
     * added as well.
     *
     * @param reaction	reaction to add
     *
     * @return this object, for chaining
     *
     * @throws org.theseed.regflux.expr.MalformedExpressionException if the reaction's gene rule cannot be parsed
     */
    public RegModel addReaction(Reaction reaction) {
        String id = reaction.getId();
        this.reactionMap.put(id, reaction);
        this.gprCache.remove(id);
        for (Reaction.Stoich stoich : reaction.getMetabolites())
            this.metabolites.add(stoich.getMetabolite());
        this.genes.addAll(this.getGpr(id).getOperands());
        return this;
    }

    /**
     * Add a gene to the model.
     *
     * @param gene	ID of the gene
     *
     * @return this object, for chaining
     */
    public RegModel addGene(String gene) {
        this.genes.add(gene);
        return this;
    }

    /**
     * Add a metabolite to the model.
     *
     * @param metabolite	ID of the metabolite
     *
     * @return this object, for chaining
     */
    public RegModel addMetabolite(String metabolite) {
        this.metabolites.add(metabolite);
        return this;
    }

    /**
     * Add a regulator to the model.
     *
     * @param regulator		ID of the regulator
     *
     * @return this object, for chaining
     */
    public RegModel addRegulator(String regulator) {
        this.regulators.add(regulator);
        return this;
    }

    /**
     * Add an interaction to the model.  It replaces any existing interaction for the same
     * target.
     *
     * @param interaction	interaction to add
     *
     * @return this object, for chaining
     */
    public RegModel addInteraction(Interaction interaction) {
        this.interactionMap.put(interaction.getTarget(), interaction);
        return this;
    }

    /**
     * Specify the objective coefficient for a reaction.
     *
     * @param reactionId	ID of the reaction
     * @param coeff			objective coefficient
     *
     * @return this object, for chaining
     */
    public RegModel setObjective(String reactionId, double coeff) {
        this.getReaction(reactionId);
        this.objective.put(reactionId, coeff);
        return this;
    }

    /**
     * @return the reaction with the specified ID
     *
     * @param id	ID of the desired reaction
     *
     * @throws IllegalArgumentException if the reaction is not in the model
     */
    public Reaction getReaction(String id) {
        Reaction retVal = this.reactionMap.get(id);
        if (retVal == null)
            throw new IllegalArgumentException("Reaction \"" + id + "\" is not in model " + this.name + ".");
        return retVal;
    }

    /**
     * @return the parsed gene rule for a reaction (an empty leaf if the reaction has no rule)
     *
     * @param reactionId	ID of the reaction of interest
     */
    public ExprNode getGpr(String reactionId) {
        ExprNode retVal = this.gprCache.get(reactionId);
        if (retVal == null) {
            String rule = this.getReaction(reactionId).getReactionRule();
            retVal = TreeBuilder.buildTree(rule, Grammar.BOOLEAN);
            this.gprCache.put(reactionId, retVal);
        }
        return retVal;
    }

    /**
     * Change the gene rule of a reaction.
     *
     * @param reactionId	ID of the reaction
     * @param rule			new gene rule
     */
    public void setReactionRule(String reactionId, String rule) {
        this.getReaction(reactionId).setReactionRule(rule);
        this.invalidateGpr(reactionId);
        this.genes.addAll(this.getGpr(reactionId).getOperands());
    }

    /**
     * Remove a reaction's parsed gene rule from the cache, forcing a re-parse on next access.
     *
     * @param reactionId	ID of the reaction
     */
    public void invalidateGpr(String reactionId) {
        this.gprCache.remove(reactionId);
    }

    /**
     * Parse every gene rule and every regulatory event rule.  Once this is done the model
     * can be read from several threads at once.
     *
     * @throws org.theseed.regflux.expr.MalformedExpressionException if a rule cannot be parsed
     */
    public void parseAll() {
        for (String reactionId : this.reactionMap.keySet())
            this.getGpr(reactionId);
        int events = 0;
        for (Interaction interaction : this.interactionMap.values()) {
            for (RegulatoryEvent event : interaction.getEvents()) {
                event.getTree();
                events++;
            }
        }
        log.debug("{} gene rules and {} event rules parsed for {}.", this.reactionMap.size(), events, this.name);
    }

    /**
     * @return the exchange reaction for a metabolite, or NULL if there is none
     *
     * @param metabolite	ID of the metabolite
     */
    public Reaction getExchangeReaction(String metabolite) {
        Reaction retVal = null;
        for (Reaction reaction : this.reactionMap.values()) {
            if (retVal == null && reaction.isExchange()
                    && reaction.getMetabolites().get(0).getMetabolite().equals(metabolite))
                retVal = reaction;
        }
        return retVal;
    }

    /**
     * @return a map of reaction IDs to the coefficients of a metabolite in each reaction
     *
     * @param metabolite	ID of the metabolite
     */
    public Map<String, Double> getMassBalance(String metabolite) {
        Map<String, Double> retVal = new LinkedHashMap<String, Double>();
        for (Reaction reaction : this.reactionMap.values()) {
            double coeff = reaction.getCoefficient(metabolite);
            if (coeff != 0.0)
                retVal.put(reaction.getId(), coeff);
        }
        return retVal;
    }

    /**
     * @return TRUE if the identifier is a reaction in this model
     *
     * @param id	identifier to check
     */
    public boolean isReaction(String id) {
        return this.reactionMap.containsKey(id);
    }

    /**
     * @return TRUE if the identifier is a metabolite in this model
     *
     * @param id	identifier to check
     */
    public boolean isMetabolite(String id) {
        return this.metabolites.contains(id);
    }

    /**
     * @return TRUE if the identifier is a gene in this model
     *
     * @param id	identifier to check
     */
    public boolean isGene(String id) {
        return this.genes.contains(id);
    }

    /**
     * @return TRUE if the identifier is a regulator in this model
     *
     * @param id	identifier to check
     */
    public boolean isRegulator(String id) {
        return this.regulators.contains(id);
    }

    /**
     * @return the reactions in this model
     */
    public Collection<Reaction> getReactions() {
        return Collections.unmodifiableCollection(this.reactionMap.values());
    }

    /**
     * @return the metabolite IDs in this model
     */
    public Set<String> getMetabolites() {
        return Collections.unmodifiableSet(this.metabolites);
    }

    /**
     * @return the gene IDs in this model
     */
    public Set<String> getGenes() {
        return Collections.unmodifiableSet(this.genes);
    }

    /**
     * @return the regulator IDs in this model
     */
    public Set<String> getRegulators() {
        return Collections.unmodifiableSet(this.regulators);
    }

    /**
     * @return the interactions in this model
     */
    public Collection<Interaction> getInteractions() {
        return Collections.unmodifiableCollection(this.interactionMap.values());
    }

    /**
     * @return the interaction for a target, or NULL if there is none
     *
     * @param target	ID of the target
     */
    public Interaction getInteraction(String target) {
        return this.interactionMap.get(target);
    }

    /**
     * @return the objective coefficients, keyed by reaction ID
     */
    public Map<String, Double> getObjective() {
        return Collections.unmodifiableMap(this.objective);
    }

    /**
     * @return the name of this model
     */
    public String getName() {
        return this.name;
    }

    /**
     * Write a summary of the model size to the log.
     */
    public void logSummary() {
        log.info("Model {} has {} reactions, {} metabolites, {} genes, {} regulators, and {} interactions.",
                this.name, this.reactionMap.size(), this.metabolites.size(), this.genes.size(),
                this.regulators.size(), this.interactionMap.size());
    }

    @Override
    public String toString() {
        return "RegModel " + this.name;
    }

}
