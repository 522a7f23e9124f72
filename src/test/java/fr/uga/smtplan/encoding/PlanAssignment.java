package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundAction;
import fr.uga.smtplan.grounding.GroundNumericFluent;
import fr.uga.smtplan.grounding.GroundProposition;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.solver.SolverModel;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the values a plan gives to the variables of an encoding, named the way the
 * encoder names them. Boolean variables that are not set are false.
 */
public final class PlanAssignment {

    private final GroundedModel model;
    private final VariableNaming naming;
    private final Map<String, Boolean> booleans = new HashMap<>();
    private final Map<String, Double> reals = new HashMap<>();

    public PlanAssignment(GroundedModel model, boolean explanatory) {
        this.model = model;
        this.naming = explanatory ? new ExplanatoryNaming(model) : new TerseNaming();
    }

    /**
     * The robot of {@code moveXY} goes from x to y. An instantaneous move takes one
     * happening; a durative move of duration 1 starts at time 0 and ends at time 1.
     */
    public static SolverModel moveXY(GroundedModel model, boolean durative, boolean explanatory) {
        PlanAssignment plan = new PlanAssignment(model, explanatory)
            .time(0, 0.0)
            .holds(new GroundProposition("at", "x"), 0)
            .start("(move x y)", 0);
        if (!durative) {
            return plan.holds(new GroundProposition("at", "y"), 1).build();
        }
        return plan.time(1, 1.0)
            .running("(move x y)", 0)
            .end("(move x y)", 1)
            .timing("(move x y)", 0, 0.0, 1.0)
            .timing("(move x y)", 1, 0.0, 1.0)
            .holds(new GroundProposition("at", "y"), 2)
            .build();
    }

    public PlanAssignment time(int happening, double value) {
        return this.real(this.naming.time(happening), value);
    }

    public PlanAssignment holds(GroundProposition proposition, int state) {
        int index = this.model.indexOf(proposition);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown proposition " + proposition);
        }
        return this.bool(this.naming.proposition(index, state));
    }

    public PlanAssignment fluent(GroundNumericFluent fluent, int state, double value) {
        int index = this.model.indexOf(fluent);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown fluent " + fluent);
        }
        return this.real(this.naming.fluent(index, state), value);
    }

    public PlanAssignment start(String action, int happening) {
        return this.bool(this.naming.start(this.action(action), happening));
    }

    public PlanAssignment end(String action, int happening) {
        return this.bool(this.naming.end(this.action(action), happening));
    }

    public PlanAssignment running(String action, int happening) {
        return this.bool(this.naming.running(this.action(action), happening));
    }

    public PlanAssignment timing(String action, int happening, double startTime, double duration) {
        int index = this.action(action);
        this.real(this.naming.startTime(index, happening), startTime);
        return this.real(this.naming.duration(index, happening), duration);
    }

    public SolverModel build() {
        return new SolverModel(this.booleans, this.reals);
    }

    private int action(String name) {
        for (GroundAction action : this.model.getActions()) {
            if (action.getName().equals(name)) {
                return action.getIndex();
            }
        }
        throw new IllegalArgumentException("Unknown action " + name);
    }

    private PlanAssignment bool(String variable) {
        this.booleans.put(Smt.unquote(variable), true);
        return this;
    }

    private PlanAssignment real(String variable, double value) {
        this.reals.put(Smt.unquote(variable), value);
        return this;
    }
}
