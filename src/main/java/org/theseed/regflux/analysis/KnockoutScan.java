/**
 *
 */
package org.theseed.regflux.analysis;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.regflux.model.RegModel;
import org.theseed.regflux.solver.Bounds;
import org.theseed.regflux.solver.LinearSolver;
import org.theseed.regflux.solver.Solution;
import org.theseed.regflux.solver.Status;

/**
 * This object runs a steady-state regulatory analysis once for each of a set of gene
 * knockouts.  Each knockout gets its own analysis engine and its own solver, so the scan can
 * be run in parallel.  Infeasible knockouts are reported in the solution status.
 *
 */
public class KnockoutScan {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(KnockoutScan.class);
    /** model to analyze */
    private final RegModel model;
    /** source of solvers, one per knockout */
    private final Supplier<LinearSolver> solverFactory;
    /** TRUE to run the knockouts in parallel */
    private boolean parallel;
    /** initial state overrides */
    private Map<String, Double> initial;
    /** caller-specified flux constraints */
    private Map<String, Bounds> constraints;

    /**
     * Construct a knockout scan.
     *
     * @param model				model to analyze
     * @param solverFactory		source of a fresh solver for each knockout
     */
    public KnockoutScan(RegModel model, Supplier<LinearSolver> solverFactory) {
        this.model = model;
        this.solverFactory = solverFactory;
        this.parallel = false;
        this.initial = new HashMap<String, Double>();
        this.constraints = new HashMap<String, Bounds>();
    }

    /**
     * Specify whether the knockouts should be run in parallel.
     *
     * @param parallel		TRUE for a parallel scan
     *
     * @return this object, for chaining
     */
    public KnockoutScan setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /**
     * Specify the initial state overrides used for every knockout.
     *
     * @param initial		map of identifiers to initial values
     *
     * @return this object, for chaining
     */
    public KnockoutScan setInitial(Map<String, Double> initial) {
        this.initial = new HashMap<String, Double>(initial);
        return this;
    }

    /**
     * Specify the flux constraints used for every knockout.
     *
     * @param constraints	map of reaction IDs to bounds
     *
     * @return this object, for chaining
     */
    public KnockoutScan setConstraints(Map<String, Bounds> constraints) {
        this.constraints = new HashMap<String, Bounds>(constraints);
        return this;
    }

    /**
     * Analyze each knockout.
     *
     * @param genes		IDs of the genes to knock out, one at a time
     *
     * @return a sorted map of gene IDs to solutions
     */
    public SortedMap<String, Solution> run(Collection<String> genes) {
        // Parse all the rules up front so the model is read-only during the scan.
        this.model.parseAll();
        Stream<String> geneStream = (this.parallel ? genes.parallelStream() : genes.stream());
        SortedMap<String, Solution> retVal = geneStream.distinct().collect(Collectors.toMap(x -> x,
                x -> this.knockout(x), (a, b) -> a, TreeMap::new));
        long infeasible = retVal.values().stream().filter(x -> x.getStatus() == Status.INFEASIBLE).count();
        log.info("{} knockouts analyzed, {} infeasible.", retVal.size(), infeasible);
        return retVal;
    }

    /**
     * Analyze a single knockout.
     *
     * @param gene		ID of the gene to knock out
     *
     * @return the steady-state solution with the gene inactive
     */
    public Solution knockout(String gene) {
        Rfba engine = new Rfba(this.model, this.solverFactory.get());
        engine.setKnockouts(List.of(gene));
        Map<String, Double> start = new HashMap<String, Double>(this.initial);
        start.put(gene, 0.0);
        Solution retVal = engine.optimize(start, this.constraints);
        log.debug("Knockout of {} returned {}.", gene, retVal.getStatus());
        return retVal;
    }

}
