package fr.uga.smtplan.grounding;

import java.util.List;

/**
 * An action schema bound to concrete objects. Instantaneous actions keep their
 * precondition and effect in the start slots; their over-all and end conditions are
 * {@code true} and their end effect is empty.
 */
public final class GroundAction {

    private final int index;
    private final String schema;
    private final List<String> arguments;
    private final boolean durative;
    private final GroundCondition startCondition;
    private final GroundCondition overAllCondition;
    private final GroundCondition endCondition;
    private final GroundEffect startEffect;
    private final GroundEffect endEffect;
    private final List<GroundDurationConstraint> duration;

    GroundAction(int index, String schema, List<String> arguments, boolean durative,
                 GroundCondition startCondition, GroundCondition overAllCondition, GroundCondition endCondition,
                 GroundEffect startEffect, GroundEffect endEffect, List<GroundDurationConstraint> duration) {
        this.index = index;
        this.schema = schema;
        this.arguments = List.copyOf(arguments);
        this.durative = durative;
        this.startCondition = startCondition;
        this.overAllCondition = overAllCondition;
        this.endCondition = endCondition;
        this.startEffect = startEffect;
        this.endEffect = endEffect;
        this.duration = List.copyOf(duration);
    }

    public int getIndex() {
        return this.index;
    }

    public String getSchema() {
        return this.schema;
    }

    public List<String> getArguments() {
        return this.arguments;
    }

    public boolean isDurative() {
        return this.durative;
    }

    public GroundCondition getStartCondition() {
        return this.startCondition;
    }

    public GroundCondition getOverAllCondition() {
        return this.overAllCondition;
    }

    public GroundCondition getEndCondition() {
        return this.endCondition;
    }

    public GroundEffect getStartEffect() {
        return this.startEffect;
    }

    public GroundEffect getEndEffect() {
        return this.endEffect;
    }

    public List<GroundDurationConstraint> getDuration() {
        return this.duration;
    }

    /**
     * The action in plan syntax, e.g. {@code (move x y)}.
     */
    public String getName() {
        StringBuilder sb = new StringBuilder("(").append(this.schema);
        this.arguments.forEach(a -> sb.append(' ').append(a));
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return getName();
    }
}
