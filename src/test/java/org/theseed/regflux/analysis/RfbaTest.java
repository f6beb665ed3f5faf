/**
 *
 */
package org.theseed.regflux.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.theseed.regflux.model.Interaction;
import org.theseed.regflux.model.Reaction;
import org.theseed.regflux.model.RegModel;
import org.theseed.regflux.solver.Bounds;
import org.theseed.regflux.solver.BoxSolver;
import org.theseed.regflux.solver.Solution;
import org.theseed.regflux.solver.Status;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

public class RfbaTest {

    /**
     * @return a two-reaction model in which the second reaction's gene is controlled by a regulator
     */
    private static RegModel knockoutModel() {
        RegModel retVal = new RegModel("two-reaction");
        Reaction r1 = new Reaction("R1", "uptake", 0.0, 10.0).addMetabolite("A", 1.0);
        retVal.addReaction(r1);
        Reaction r2 = new Reaction("R2", "conversion", 0.0, 10.0).addMetabolite("A", -1.0).addMetabolite("B", 1.0);
        retVal.addReaction(r2);
        retVal.setReactionRule("R1", "g1");
        retVal.setReactionRule("R2", "g2");
        retVal.addRegulator("Reg");
        retVal.addInteraction(new Interaction("g2").addEvent(1.0, "Reg"));
        retVal.setObjective("R1", 1.0).setObjective("R2", 1.0);
        return retVal;
    }

    /**
     * @return a model whose single regulator turns itself off and on in alternate steps
     */
    private static RegModel toggleModel() {
        RegModel retVal = new RegModel("toggle");
        retVal.addReaction(new Reaction("R1", "export", 0.0, 10.0).addMetabolite("X", -1.0));
        retVal.setReactionRule("R1", "g1");
        retVal.addRegulator("A");
        retVal.addInteraction(new Interaction("A").addEvent(1.0, "not A"));
        retVal.addInteraction(new Interaction("g1").addEvent(1.0, "A"));
        retVal.setObjective("R1", 1.0);
        return retVal;
    }

    @Test
    public void testBuild() {
        RegModel model = knockoutModel();
        BoxSolver solver = new BoxSolver();
        Rfba rfba = new Rfba(model, solver);
        rfba.build();
        rfba.build();
        assertThat(solver.getVariableCount(), equalTo(2));
        assertThat(solver.getConstraintCount(), equalTo(2));
        assertThat(solver.getConstraint("A"), equalTo(Map.of("R1", 1.0, "R2", -1.0)));
        assertThat(solver.getConstraint("B"), equalTo(Map.of("R2", 1.0)));
        assertThat(rfba.getIterations(), equalTo(Rfba.DEFAULT_ITERATIONS));
        assertThat(rfba.getTolerance(), equalTo(Rfba.DEFAULT_TOLERANCE));
        assertThrows(IllegalArgumentException.class, () -> rfba.setIterations(0));
        assertThrows(IllegalArgumentException.class, () -> rfba.setTolerance(-1.0));
    }

    @Test
    public void testInitialState() {
        Rfba rfba = new Rfba(knockoutModel(), new BoxSolver());
        RegulatoryState state = rfba.initialState(null);
        assertThat(state.asMap(), equalTo(Map.of("Reg", 1.0)));
        state = rfba.initialState(Map.of("Reg", 0.0, "g1", 1.0));
        assertThat(state.get("Reg"), equalTo(0.0));
        assertThat(state.get("g1"), equalTo(1.0));
        assertThat(state.get("g2"), equalTo(0.0));
        assertThat(state.contains("g2"), equalTo(false));
        assertThat(state.getActive(), contains("g1"));
    }

    @Test
    public void testSteadyState() {
        RegModel model = knockoutModel();
        BoxSolver solver = new BoxSolver();
        Rfba rfba = new Rfba(model, solver);
        // With the regulator active both reactions carry flux.
        Solution sol = rfba.optimize(null, null);
        assertThat(sol.getStatus(), equalTo(Status.OPTIMAL));
        assertThat(sol.getObjectiveValue(), closeTo(20.0, 1e-9));
        assertThat(solver.getLastOverrides().size(), equalTo(0));
        assertThat(sol.getValue("g2"), equalTo(1.0));
        // Forcing the regulator off blocks the second reaction.
        sol = rfba.optimize(Map.of("Reg", 0.0), null);
        assertThat(sol.getStatus(), equalTo(Status.OPTIMAL));
        assertThat(solver.getLastOverrides().get("R2"), equalTo(Bounds.ZERO));
        assertThat(solver.getLastOverrides(), not(hasKey("R1")));
        assertThat(sol.getValue("R2"), equalTo(0.0));
        assertThat(sol.getValue("R1"), closeTo(10.0, 1e-9));
        assertThat(sol.getValue("Reg"), equalTo(0.0));
        assertThat(sol.getValue("g2"), equalTo(0.0));
        assertThat(sol.getObjectiveValue(), closeTo(10.0, 1e-9));
        // Regulatory constraints take priority over the caller's.
        sol = rfba.optimize(Map.of("Reg", 0.0), Map.of("R2", new Bounds(1.0, 5.0), "R1", new Bounds(0.0, 3.0)));
        assertThat(sol.getValue("R2"), equalTo(0.0));
        assertThat(sol.getValue("R1"), closeTo(3.0, 1e-9));
        // Minimization drives the fluxes to their lower bounds.
        rfba.setMinimize(true);
        sol = rfba.optimize(null, Map.of("R1", new Bounds(2.0, 3.0)));
        assertThat(sol.getValue("R1"), closeTo(2.0, 1e-9));
        assertThat(sol.getValue("R2"), closeTo(0.0, 1e-9));
    }

    @Test
    public void testInfeasible() {
        RegModel model = knockoutModel();
        Rfba rfba = new Rfba(model, new BoxSolver());
        Solution sol = rfba.optimize(null, Map.of("R1", new Bounds(5.0, 1.0)));
        assertThat(sol.getStatus(), equalTo(Status.INFEASIBLE));
        assertThat(sol.getValue("Reg"), equalTo(1.0));
        DynamicSolution dyn = rfba.optimizeDynamic(null, Map.of("R1", new Bounds(5.0, 1.0)));
        assertThat(dyn.isConverged(), equalTo(true));
        for (Solution dynSol : dyn.getSolutions())
            assertThat(dynSol.getStatus(), equalTo(Status.INFEASIBLE));
    }

    @Test
    public void testDecode() {
        RegModel model = knockoutModel();
        Rfba rfba = new Rfba(model, new BoxSolver());
        RegulatoryState state = new RegulatoryState(Map.of("Reg", 0.0));
        RegulatoryState reg = rfba.decodeRegulatoryState(state);
        assertThat(reg.asMap(), equalTo(Map.of("g2", 0.0)));
        RegulatoryState met = rfba.decodeMetabolicState(state);
        assertThat(met.asMap(), equalTo(Map.of("g2", 0.0)));
        Map<String, Bounds> constraints = rfba.decodeConstraints(state.merge(reg));
        assertThat(constraints, equalTo(Map.of("R2", Bounds.ZERO)));
        // A gene missing from the state is assumed active.
        constraints = rfba.decodeConstraints(new RegulatoryState());
        assertThat(constraints.size(), equalTo(0));
        constraints = rfba.decodeConstraints(new RegulatoryState(Map.of("g1", 0.0, "g2", 1.0)));
        assertThat(constraints.keySet(), contains("R1"));
    }

    @Test
    public void testSynchronousUpdate() {
        // B copies A and A copies not-B.  A sequential update would let the second rule see the first result.
        RegModel model1 = new RegModel("forward");
        model1.addRegulator("A").addRegulator("B");
        model1.addInteraction(new Interaction("A").addEvent(1.0, "B"));
        model1.addInteraction(new Interaction("B").addEvent(1.0, "not A"));
        RegModel model2 = new RegModel("backward");
        model2.addRegulator("B").addRegulator("A");
        model2.addInteraction(new Interaction("B").addEvent(1.0, "not A"));
        model2.addInteraction(new Interaction("A").addEvent(1.0, "B"));
        RegulatoryState start = new RegulatoryState(Map.of("A", 1.0, "B", 0.0));
        RegulatoryState next1 = new Rfba(model1, new BoxSolver()).decodeRegulatoryState(start);
        RegulatoryState next2 = new Rfba(model2, new BoxSolver()).decodeRegulatoryState(start);
        assertThat(next1.get("A"), equalTo(0.0));
        assertThat(next1.get("B"), equalTo(0.0));
        assertThat(next2.asMap(), equalTo(next1.asMap()));
        assertThat(start.get("A"), equalTo(1.0));
    }

    @Test
    public void testToggle() {
        RegModel model = toggleModel();
        BoxSolver solver = new BoxSolver();
        Rfba rfba = new Rfba(model, solver);
        DynamicSolution dyn = rfba.optimizeDynamic(null, null);
        assertThat(dyn.isConverged(), equalTo(true));
        assertThat(dyn.size(), equalTo(2));
        assertThat(dyn.getIterations(), equalTo(3));
        List<RegulatoryState> states = dyn.getStates();
        assertThat(states.get(0).get("A"), equalTo(0.0));
        assertThat(states.get(1).get("A"), equalTo(1.0));
        List<Solution> sols = dyn.getSolutions();
        assertThat(sols.get(0).getValue("R1"), equalTo(0.0));
        assertThat(sols.get(1).getValue("R1"), closeTo(10.0, 1e-9));
        assertThat(sols.get(1).getValue("g1"), equalTo(1.0));
        // Three transitions plus one solve per attractor state.
        assertThat(solver.getSolveCount(), equalTo(5));
        JsonObject json = dyn.toJson();
        assertThat((Boolean) json.get("converged"), equalTo(true));
        assertThat(((JsonArray) json.get("solutions")).size(), equalTo(2));
    }

    @Test
    public void testFixedPoint() {
        RegModel model = toggleModel();
        model.addInteraction(new Interaction("A").addEvent(1.0, "A"));
        DynamicSolution dyn = new Rfba(model, new BoxSolver()).optimizeDynamic(null, null);
        assertThat(dyn.isConverged(), equalTo(true));
        assertThat(dyn.size(), equalTo(1));
        assertThat(dyn.getSolutions().get(0).getValue("R1"), closeTo(10.0, 1e-9));
        dyn = new Rfba(model, new BoxSolver()).optimizeDynamic(Map.of("A", 0.0), null);
        assertThat(dyn.size(), equalTo(1));
        assertThat(dyn.getSolutions().get(0).getValue("R1"), equalTo(0.0));
    }

    @Test
    public void testIterationLimit() {
        Rfba rfba = new Rfba(toggleModel(), new BoxSolver()).setIterations(2);
        DynamicSolution dyn = rfba.optimizeDynamic(null, null);
        assertThat(dyn.isConverged(), equalTo(false));
        assertThat(dyn.getIterations(), equalTo(2));
        assertThat(dyn.size(), equalTo(2));
        rfba.setIterations(1);
        dyn = rfba.optimizeDynamic(null, null);
        assertThat(dyn.isConverged(), equalTo(false));
        assertThat(dyn.size(), equalTo(1));
        assertThat(dyn.toString(), containsString("not converged"));
    }

    @Test
    public void testFluxRegulators() {
        // The metabolite regulator takes the flux of its exchange reaction and the reaction regulator its own flux.
        RegModel model = new RegModel("flux");
        model.addReaction(new Reaction("EX_glc", "glucose exchange", -10.0, 0.0).addMetabolite("glc", -1.0));
        model.addReaction(new Reaction("GLK", "glucokinase", 0.0, 8.0).addMetabolite("glc", -1.0)
                .addMetabolite("g6p", 1.0));
        model.addRegulator("glc").addRegulator("GLK");
        model.setObjective("EX_glc", -1.0).setObjective("GLK", 1.0);
        Rfba rfba = new Rfba(model, new BoxSolver());
        RegulatoryState next = rfba.nextState(rfba.initialState(null), null);
        assertThat(next.get("glc"), closeTo(-10.0, 1e-9));
        assertThat(next.get("GLK"), closeTo(8.0, 1e-9));
    }

    @Test
    public void testStateComparator() {
        RegModel model = knockoutModel();
        StateComparator comp = new StateComparator(model, 1e-6);
        RegulatoryState s1 = new RegulatoryState(Map.of("Reg", 1.0, "R1", 5.0));
        RegulatoryState s2 = new RegulatoryState(Map.of("Reg", 1.0 + 1e-9, "R1", 2.0));
        assertThat(comp.matches(s1, s2), equalTo(true));
        RegulatoryState s3 = new RegulatoryState(Map.of("Reg", 1.0, "R1", 1e-9));
        assertThat(comp.matches(s1, s3), equalTo(false));
        RegulatoryState s4 = new RegulatoryState(Map.of("R1", 5.0));
        assertThat(comp.matches(s1, s4), equalTo(false));
        RegulatoryState s5 = new RegulatoryState(Map.of("Reg", 0.0, "R1", 0.0));
        assertThat(comp.matches(s5, new RegulatoryState()), equalTo(true));
        assertThat(comp.getTolerance(), equalTo(1e-6));
    }

}
