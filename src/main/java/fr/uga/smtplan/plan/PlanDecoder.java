package fr.uga.smtplan.plan;

import fr.uga.smtplan.encoding.FormulaDocument;
import fr.uga.smtplan.encoding.Smt;
import fr.uga.smtplan.encoding.VariableNaming;
import fr.uga.smtplan.grounding.GroundAction;
import fr.uga.smtplan.solver.SolverModel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a temporal plan back from the model of a satisfiable formula: every true start
 * variable is an action starting at the timestamp of its happening.
 */
public final class PlanDecoder {

    private static final Logger LOGGER = LogManager.getLogger(PlanDecoder.class.getName());

    private PlanDecoder() {
    }

    public static TemporalPlan decode(FormulaDocument document, SolverModel model) {
        VariableNaming naming = document.getNaming();
        List<TemporalPlan.Step> steps = new ArrayList<>();
        for (int h = 0; h < document.getHappenings(); h++) {
            for (GroundAction action : document.getActions()) {
                if (!model.isTrue(Smt.unquote(naming.start(action.getIndex(), h)))) {
                    continue;
                }
                Double time = model.getReal(Smt.unquote(naming.time(h)));
                if (time == null) {
                    LOGGER.warn("No timestamp for happening {} in the model", h);
                    time = (double) h;
                }
                Double duration = null;
                if (action.isDurative()) {
                    duration = model.getReal(Smt.unquote(naming.duration(action.getIndex(), h)));
                }
                steps.add(new TemporalPlan.Step(time, action, duration));
                LOGGER.debug("Happening {}: {} starts at {}", h, action, time);
            }
        }
        return new TemporalPlan(steps);
    }
}
