package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundedModel;

/**
 * Names the solver variables of an encoding. Happenings are indexed 0..N-1 and states
 * 0..N, state 0 being the initial state and state h+1 the state right after happening h.
 * Naming is cosmetic: two namings of the same encoding are equisatisfiable.
 */
public interface VariableNaming {

    String time(int happening);

    String proposition(int proposition, int state);

    String fluent(int fluent, int state);

    /**
     * The start of a durative action, or the occurrence of an instantaneous one.
     */
    String start(int action, int happening);

    String end(int action, int happening);

    /**
     * True iff a durative action is executing in the interval that follows the happening.
     */
    String running(int action, int happening);

    /**
     * The time at which the instance of a durative action running after the happening
     * started.
     */
    String startTime(int action, int happening);

    /**
     * The duration of the instance of a durative action running after the happening.
     */
    String duration(int action, int happening);

    static VariableNaming of(boolean explanatory, GroundedModel model) {
        return explanatory ? new ExplanatoryNaming(model) : new TerseNaming();
    }
}
