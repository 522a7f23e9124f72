package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundedModel;

/**
 * Human readable names embedding the predicate, function or action with its objects and
 * the happening, e.g. {@code |(at truck1 depot)@2|}.
 */
public class ExplanatoryNaming implements VariableNaming {

    private final GroundedModel model;

    public ExplanatoryNaming(GroundedModel model) {
        this.model = model;
    }

    @Override
    public String time(int happening) {
        return Smt.quote("time@" + happening);
    }

    @Override
    public String proposition(int proposition, int state) {
        return Smt.quote(this.model.getPropositions().get(proposition) + "@" + state);
    }

    @Override
    public String fluent(int fluent, int state) {
        return Smt.quote(this.model.getFluents().get(fluent) + "@" + state);
    }

    @Override
    public String start(int action, int happening) {
        return actionVariable("start", action, happening);
    }

    @Override
    public String end(int action, int happening) {
        return actionVariable("end", action, happening);
    }

    @Override
    public String running(int action, int happening) {
        return actionVariable("running", action, happening);
    }

    @Override
    public String startTime(int action, int happening) {
        return actionVariable("start-time", action, happening);
    }

    @Override
    public String duration(int action, int happening) {
        return actionVariable("duration", action, happening);
    }

    private String actionVariable(String role, int action, int happening) {
        return Smt.quote(role + " " + this.model.getActions().get(action).getName() + "@" + happening);
    }
}
