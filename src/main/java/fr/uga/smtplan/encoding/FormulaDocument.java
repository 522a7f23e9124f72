package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundAction;

import java.util.List;

/**
 * Summary of an emitted formula: its happening count, its size, the actions it encodes and
 * the naming used, which is all that is needed to read a plan back from a model.
 */
public final class FormulaDocument {

    private final int happenings;
    private final int variables;
    private final int assertions;
    private final List<GroundAction> actions;
    private final VariableNaming naming;

    FormulaDocument(int happenings, int variables, int assertions, List<GroundAction> actions,
                    VariableNaming naming) {
        this.happenings = happenings;
        this.variables = variables;
        this.assertions = assertions;
        this.actions = List.copyOf(actions);
        this.naming = naming;
    }

    public int getHappenings() {
        return this.happenings;
    }

    public int getVariableCount() {
        return this.variables;
    }

    public int getAssertionCount() {
        return this.assertions;
    }

    public List<GroundAction> getActions() {
        return this.actions;
    }

    public VariableNaming getNaming() {
        return this.naming;
    }

    @Override
    public String toString() {
        return "FormulaDocument{happenings=" + this.happenings + ", variables=" + this.variables
            + ", assertions=" + this.assertions + ", actions=" + this.actions.size() + "}";
    }
}
