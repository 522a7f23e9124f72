package fr.uga.smtplan.model;

import java.util.List;

/**
 * A parametric action. A schema without duration constraints is instantaneous; its
 * precondition and effect are not wrapped in temporal qualifiers.
 */
public final class ActionSchema {

    private final String name;
    private final List<Parameter> parameters;
    private final Expression precondition;
    private final Expression effect;
    private final List<DurationConstraint> duration;

    public ActionSchema(String name, List<Parameter> parameters, Expression precondition, Expression effect,
                        List<DurationConstraint> duration) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.precondition = precondition;
        this.effect = effect;
        this.duration = List.copyOf(duration);
    }

    public static ActionSchema instantaneous(String name, List<Parameter> parameters, Expression precondition,
                                             Expression effect) {
        return new ActionSchema(name, parameters, precondition, effect, List.of());
    }

    public String getName() {
        return this.name;
    }

    public List<Parameter> getParameters() {
        return this.parameters;
    }

    public Expression getPrecondition() {
        return this.precondition;
    }

    public Expression getEffect() {
        return this.effect;
    }

    public List<DurationConstraint> getDuration() {
        return this.duration;
    }

    public boolean isDurative() {
        return !this.duration.isEmpty();
    }

    @Override
    public String toString() {
        return this.name + this.parameters;
    }
}
