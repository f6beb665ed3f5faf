/**
 *
 */
package org.theseed.regflux.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.regflux.expr.BooleanResolver;
import org.theseed.regflux.expr.ExprNode;
import org.theseed.regflux.model.Interaction;
import org.theseed.regflux.model.Reaction;
import org.theseed.regflux.model.RegModel;
import org.theseed.regflux.solver.Bounds;
import org.theseed.regflux.solver.LinearSolver;
import org.theseed.regflux.solver.Sense;
import org.theseed.regflux.solver.Solution;

/**
 * This object performs regulatory flux balance analysis on a regulatory-metabolic model.
 * Each step evaluates every interaction against a single snapshot of the regulatory state,
 * uses the resulting gene activity to block reactions whose gene rules fail, and optimizes
 * the metabolic objective under the resulting flux bounds.
 *
 * In steady-state mode a single step is performed.  In dynamic mode steps are repeated until
 * a state recurs (a cyclic attractor), or until the iteration limit is reached, and one
 * solution is computed for each attractor state.
 *
 * The engine owns its solver and is not thread-safe.  Concurrent work requires one engine
 * per task.
 *
 */
public class Rfba {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Rfba.class);
    /** model being analyzed */
    private final RegModel model;
    /** solver holding the metabolic problem */
    private final LinearSolver solver;
    /** TRUE if the metabolic problem has been loaded into the solver */
    private boolean built;
    /** maximum number of state transitions in dynamic mode */
    private int iterations;
    /** tolerance for state comparison */
    private double tolerance;
    /** TRUE to minimize the objective instead of maximizing it */
    private boolean minimize;
    /** identifiers forced to 0 after every regulatory update */
    private Set<String> knockouts;

    /** default iteration limit for dynamic mode */
    public static final int DEFAULT_ITERATIONS = 10;
    /** default state comparison tolerance */
    public static final double DEFAULT_TOLERANCE = 1e-10;
    /** initial value for every regulator */
    public static final double REGULATOR_DEFAULT = 1.0;

    /**
     * This is a simple object that holds the outcome of one transition.
     */
    private static class Step {

        /** solver result for the transition */
        private final Solution solution;
        /** state after the transition */
        private final RegulatoryState next;

        private Step(Solution solution, RegulatoryState next) {
            this.solution = solution;
            this.next = next;
        }

    }

    /**
     * Construct an analysis engine.
     *
     * @param model		regulatory-metabolic model to analyze
     * @param solver	solver to hold the metabolic problem (will be owned by this engine)
     */
    public Rfba(RegModel model, LinearSolver solver) {
        this.model = model;
        this.solver = solver;
        this.built = false;
        this.iterations = DEFAULT_ITERATIONS;
        this.tolerance = DEFAULT_TOLERANCE;
        this.minimize = false;
        this.knockouts = Collections.emptySet();
    }

    /**
     * Load the metabolic problem into the solver:  one variable per reaction and one mass
     * balance constraint per metabolite.  This is done automatically by the first analysis.
     *
     * @return this object, for chaining
     */
    public Rfba build() {
        if (! this.built) {
            for (Reaction reaction : this.model.getReactions())
                this.solver.addVariable(reaction.getId(), reaction.getLowerBound(), reaction.getUpperBound());
            int balanced = 0;
            for (String metabolite : this.model.getMetabolites()) {
                Map<String, Double> balance = this.model.getMassBalance(metabolite);
                if (! balance.isEmpty()) {
                    this.solver.addConstraint(metabolite, balance, Sense.EQ, 0.0);
                    balanced++;
                }
            }
            log.info("Loaded {} reactions and {} mass balances from {} into the solver.",
                    this.model.getReactions().size(), balanced, this.model.getName());
            this.built = true;
        }
        return this;
    }

    /**
     * @return the starting regulatory state:  every regulator active, overridden by the caller's values
     *
     * @param overrides		caller-specified initial values (may be NULL)
     */
    public RegulatoryState initialState(Map<String, Double> overrides) {
        RegulatoryState retVal = new RegulatoryState();
        for (String regulator : this.model.getRegulators())
            retVal.put(regulator, REGULATOR_DEFAULT);
        if (overrides != null)
            retVal.putAll(overrides);
        return retVal;
    }

    /**
     * Compute the next value of every interaction target.  All interactions read the same
     * snapshot, so the result does not depend on the order of the interactions.
     *
     * @param state		current regulatory state
     *
     * @return a state containing the new value of each target
     */
    public RegulatoryState decodeRegulatoryState(RegulatoryState state) {
        return this.evaluateInteractions(state, false);
    }

    /**
     * Compute the next value of every interaction target that is not a regulator (that is,
     * of the genes, reactions and metabolites under regulatory control).
     *
     * @param state		current regulatory state
     *
     * @return a state containing the new value of each such target
     */
    public RegulatoryState decodeMetabolicState(RegulatoryState state) {
        return this.evaluateInteractions(state, true);
    }

    /**
     * Evaluate interactions against a snapshot.
     *
     * @param state				state snapshot
     * @param metabolicOnly		TRUE to skip interactions targeting regulators
     *
     * @return a state containing the computed target values
     */
    private RegulatoryState evaluateInteractions(RegulatoryState state, boolean metabolicOnly) {
        Set<String> active = state.getActive();
        Map<String, Double> variables = state.asMap();
        RegulatoryState retVal = new RegulatoryState();
        for (Interaction interaction : this.model.getInteractions()) {
            String target = interaction.getTarget();
            if (! metabolicOnly || ! this.model.isRegulator(target))
                retVal.put(target, interaction.evaluate(active, variables));
        }
        this.applyKnockouts(retVal);
        return retVal;
    }

    /**
     * Force the knocked-out identifiers in a state to 0.
     *
     * @param state		state to update
     */
    private void applyKnockouts(RegulatoryState state) {
        for (String id : this.knockouts)
            state.put(id, 0.0);
    }

    /**
     * Compute the flux constraints implied by a regulatory state.  A reaction whose gene rule
     * is false is blocked.  Genes missing from the state are assumed active.
     *
     * @param state		regulatory state
     *
     * @return a map of reaction IDs to bounds for the blocked reactions
     */
    public Map<String, Bounds> decodeConstraints(RegulatoryState state) {
        Set<String> active = state.getActive();
        for (String gene : this.model.getGenes()) {
            if (! state.contains(gene))
                active.add(gene);
        }
        Map<String, Double> variables = state.asMap();
        BooleanResolver resolver = new BooleanResolver(active, variables);
        Map<String, Bounds> retVal = new LinkedHashMap<String, Bounds>();
        for (Reaction reaction : this.model.getReactions()) {
            ExprNode gpr = this.model.getGpr(reaction.getId());
            if (! gpr.isEmptyLeaf() && ! gpr.evaluate(resolver))
                retVal.put(reaction.getId(), Bounds.ZERO);
        }
        log.debug("{} reactions blocked by regulation.", retVal.size());
        return retVal;
    }

    /**
     * @return the regulatory constraints merged over the caller's constraints
     *
     * @param state			regulatory state
     * @param constraints	caller-specified constraints (may be NULL)
     */
    private Map<String, Bounds> mergeConstraints(RegulatoryState state, Map<String, Bounds> constraints) {
        Map<String, Bounds> retVal = new LinkedHashMap<String, Bounds>();
        if (constraints != null)
            retVal.putAll(constraints);
        retVal.putAll(this.decodeConstraints(state));
        return retVal;
    }

    /**
     * Perform one state transition.
     *
     * @param state			current state
     * @param constraints	caller-specified constraints (may be NULL)
     *
     * @return the solver result and the next state
     */
    private Step step(RegulatoryState state, Map<String, Bounds> constraints) {
        RegulatoryState regulatory = this.decodeRegulatoryState(state);
        RegulatoryState metabolic = this.decodeMetabolicState(state.merge(regulatory));
        RegulatoryState decoded = state.merge(regulatory).merge(metabolic);
        Solution solution = this.solver.solve(this.model.getObjective(), this.minimize,
                this.mergeConstraints(decoded, constraints));
        // Reactions and metabolites under regulatory control take their value from the fluxes.
        RegulatoryState next = decoded.copy();
        for (String regulator : this.model.getRegulators()) {
            if (this.model.isReaction(regulator))
                next.put(regulator, solution.getValue(regulator));
            else if (this.model.isMetabolite(regulator)) {
                Reaction exchange = this.model.getExchangeReaction(regulator);
                if (exchange != null)
                    next.put(regulator, solution.getValue(exchange.getId()));
            }
        }
        return new Step(solution, next);
    }

    /**
     * @return the state that follows the specified state
     *
     * @param state			current state
     * @param constraints	caller-specified constraints (may be NULL)
     */
    public RegulatoryState nextState(RegulatoryState state, Map<String, Bounds> constraints) {
        this.build();
        return this.step(state, constraints).next;
    }

    /**
     * Perform a steady-state analysis.
     *
     * @param initial		caller-specified initial values (may be NULL)
     * @param constraints	caller-specified flux constraints (may be NULL)
     *
     * @return a solution whose values contain the regulatory state and the fluxes
     */
    public Solution optimize(Map<String, Double> initial, Map<String, Bounds> constraints) {
        this.build();
        RegulatoryState state = this.initialState(initial);
        RegulatoryState regulatory = this.decodeRegulatoryState(state);
        RegulatoryState merged = state.merge(regulatory);
        RegulatoryState decoded = merged.merge(this.decodeMetabolicState(merged));
        Solution solution = this.solver.solve(this.model.getObjective(), this.minimize,
                this.mergeConstraints(decoded, constraints));
        log.info("Steady-state analysis of {} returned {} with objective {}.", this.model.getName(),
                solution.getStatus(), solution.getObjectiveValue());
        return this.annotate(solution, decoded);
    }

    /**
     * Perform a dynamic analysis.  The first recorded state is the successor of the initial
     * state.  Transitions continue until a state matches one already recorded; the recorded
     * states from the match onward form the attractor.
     *
     * @param initial		caller-specified initial values (may be NULL)
     * @param constraints	caller-specified flux constraints (may be NULL)
     *
     * @return one solution per attractor state, or per trajectory state if the iteration limit was reached
     */
    public DynamicSolution optimizeDynamic(Map<String, Double> initial, Map<String, Bounds> constraints) {
        this.build();
        StateComparator comparator = new StateComparator(this.model, this.tolerance);
        List<RegulatoryState> trajectory = new ArrayList<RegulatoryState>();
        RegulatoryState current = this.step(this.initialState(initial), constraints).next;
        trajectory.add(current);
        int transitions = 1;
        int attractorStart = -1;
        while (attractorStart < 0 && transitions < this.iterations) {
            RegulatoryState next = this.step(current, constraints).next;
            transitions++;
            for (int i = 0; i < trajectory.size() && attractorStart < 0; i++) {
                if (comparator.matches(trajectory.get(i), next))
                    attractorStart = i;
            }
            if (attractorStart < 0) {
                trajectory.add(next);
                current = next;
            }
            log.debug("Transition {}: {}", transitions, next);
        }
        boolean converged = (attractorStart >= 0);
        List<RegulatoryState> window;
        if (converged) {
            window = trajectory.subList(attractorStart, trajectory.size());
            log.info("Attractor of length {} found after {} transitions.", window.size(), transitions);
        } else {
            window = trajectory;
            log.warn("No attractor found for {} after {} transitions.", this.model.getName(), transitions);
        }
        List<Solution> solutions = new ArrayList<Solution>(window.size());
        for (RegulatoryState state : window) {
            Solution solution = this.solver.solve(this.model.getObjective(), this.minimize,
                    this.mergeConstraints(state, constraints));
            solutions.add(this.annotate(solution, state));
        }
        return new DynamicSolution(window, solutions, converged, transitions);
    }

    /**
     * @return a solution whose values include the regulatory state underneath the fluxes
     *
     * @param solution	solver result
     * @param state		regulatory state that produced it
     */
    private Solution annotate(Solution solution, RegulatoryState state) {
        Map<String, Double> values = new LinkedHashMap<String, Double>(state.asMap());
        values.putAll(solution.getValues());
        return solution.withValues(values);
    }

    /**
     * Specify the iteration limit for dynamic mode.
     *
     * @param iterations	maximum number of state transitions (at least 1)
     *
     * @return this object, for chaining
     */
    public Rfba setIterations(int iterations) {
        if (iterations < 1)
            throw new IllegalArgumentException("Iteration limit must be positive.");
        this.iterations = iterations;
        return this;
    }

    /**
     * Specify the state comparison tolerance.
     *
     * @param tolerance		new tolerance (non-negative)
     *
     * @return this object, for chaining
     */
    public Rfba setTolerance(double tolerance) {
        if (tolerance < 0.0)
            throw new IllegalArgumentException("Tolerance cannot be negative.");
        this.tolerance = tolerance;
        return this;
    }

    /**
     * Specify the direction of optimization.
     *
     * @param minimize		TRUE to minimize the objective, FALSE to maximize it
     *
     * @return this object, for chaining
     */
    public Rfba setMinimize(boolean minimize) {
        this.minimize = minimize;
        return this;
    }

    /**
     * Specify identifiers to hold at 0 regardless of regulation.
     *
     * @param knockouts		identifiers to knock out
     *
     * @return this object, for chaining
     */
    public Rfba setKnockouts(Collection<String> knockouts) {
        this.knockouts = new HashSet<String>(knockouts);
        return this;
    }

    /**
     * @return the iteration limit for dynamic mode
     */
    public int getIterations() {
        return this.iterations;
    }

    /**
     * @return the state comparison tolerance
     */
    public double getTolerance() {
        return this.tolerance;
    }

    /**
     * @return the model being analyzed
     */
    public RegModel getModel() {
        return this.model;
    }

}
