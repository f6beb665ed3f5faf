/**
 *
 */
package org.theseed.regflux.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.theseed.regflux.model.Interaction;
import org.theseed.regflux.model.Reaction;
import org.theseed.regflux.model.RegModel;
import org.theseed.regflux.solver.Bounds;
import org.theseed.regflux.solver.BoxSolver;
import org.theseed.regflux.solver.Solution;
import org.theseed.regflux.solver.Status;

public class KnockoutScanTest {

    /**
     * @return a model with one single-gene reaction and one reaction catalyzed by two isozymes
     */
    private static RegModel isozymeModel() {
        RegModel retVal = new RegModel("isozymes");
        retVal.addReaction(new Reaction("R1", "uptake", 0.0, 10.0).addMetabolite("A", 1.0));
        retVal.addReaction(new Reaction("R2", "conversion", 0.0, 10.0).addMetabolite("A", -1.0));
        retVal.setReactionRule("R1", "g1");
        retVal.setReactionRule("R2", "g2 or g3");
        retVal.setObjective("R1", 1.0).setObjective("R2", 1.0);
        return retVal;
    }

    @Test
    public void testSerialScan() {
        RegModel model = isozymeModel();
        AtomicInteger solvers = new AtomicInteger();
        KnockoutScan scan = new KnockoutScan(model, () -> {
            solvers.incrementAndGet();
            return new BoxSolver();
        });
        SortedMap<String, Solution> results = scan.run(List.of("g3", "g1", "g2", "g1"));
        assertThat(results.keySet(), contains("g1", "g2", "g3"));
        assertThat(solvers.get(), equalTo(3));
        assertThat(results.get("g1").getObjectiveValue(), closeTo(10.0, 1e-9));
        assertThat(results.get("g1").getValue("R1"), equalTo(0.0));
        assertThat(results.get("g1").getValue("g1"), equalTo(0.0));
        assertThat(results.get("g2").getObjectiveValue(), closeTo(20.0, 1e-9));
        assertThat(results.get("g3").getObjectiveValue(), closeTo(20.0, 1e-9));
    }

    @Test
    public void testParallelScan() {
        RegModel model = isozymeModel();
        AtomicInteger solvers = new AtomicInteger();
        KnockoutScan scan = new KnockoutScan(model, () -> {
            solvers.incrementAndGet();
            return new BoxSolver();
        }).setParallel(true);
        SortedMap<String, Solution> results = scan.run(model.getGenes());
        assertThat(results.size(), equalTo(3));
        assertThat(solvers.get(), equalTo(3));
        assertThat(results.get("g1").getObjectiveValue(), closeTo(10.0, 1e-9));
        assertThat(results.get("g2").getObjectiveValue(), closeTo(20.0, 1e-9));
        assertThat(results.get("g3").getObjectiveValue(), closeTo(20.0, 1e-9));
    }

    @Test
    public void testConstraintsAndRegulation() {
        RegModel model = isozymeModel();
        // The regulator switches on g1, but the knockout must hold it at 0.
        model.addRegulator("Reg");
        model.addInteraction(new Interaction("g1").addEvent(1.0, "Reg"));
        KnockoutScan scan = new KnockoutScan(model, BoxSolver::new)
                .setInitial(Map.of("Reg", 1.0))
                .setConstraints(Map.of("R2", new Bounds(0.0, 4.0)));
        Solution sol = scan.knockout("g1");
        assertThat(sol.getStatus(), equalTo(Status.OPTIMAL));
        assertThat(sol.getValue("g1"), equalTo(0.0));
        assertThat(sol.getValue("R1"), equalTo(0.0));
        assertThat(sol.getValue("R2"), closeTo(4.0, 1e-9));
        sol = scan.knockout("g2");
        assertThat(sol.getObjectiveValue(), closeTo(14.0, 1e-9));
        // An infeasible constraint is reported in the result, not thrown.
        scan.setConstraints(Map.of("R2", new Bounds(4.0, 0.0)));
        SortedMap<String, Solution> results = scan.run(List.of("g1", "g2"));
        for (Solution result : results.values())
            assertThat(result.getStatus(), equalTo(Status.INFEASIBLE));
    }

}
