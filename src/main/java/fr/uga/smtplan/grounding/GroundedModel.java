package fr.uga.smtplan.grounding;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The finite result of grounding: indexed propositions, fluents and actions, the initial
 * state and the goal. Other components refer to elements by index. Read-only.
 */
public final class GroundedModel {

    private final List<GroundProposition> propositions;
    private final List<GroundNumericFluent> fluents;
    private final List<GroundAction> actions;
    private final BitSet initialState;
    private final Map<Integer, Double> initialValues;
    private final GroundCondition goal;

    public GroundedModel(List<GroundProposition> propositions, List<GroundNumericFluent> fluents,
                         List<GroundAction> actions, BitSet initialState, Map<Integer, Double> initialValues,
                         GroundCondition goal) {
        this.propositions = List.copyOf(propositions);
        this.fluents = List.copyOf(fluents);
        this.actions = List.copyOf(actions);
        this.initialState = (BitSet) initialState.clone();
        this.initialValues = Collections.unmodifiableMap(new TreeMap<>(initialValues));
        this.goal = goal;
    }

    public List<GroundProposition> getPropositions() {
        return this.propositions;
    }

    public List<GroundNumericFluent> getFluents() {
        return this.fluents;
    }

    public List<GroundAction> getActions() {
        return this.actions;
    }

    public int propositionCount() {
        return this.propositions.size();
    }

    public int fluentCount() {
        return this.fluents.size();
    }

    public int actionCount() {
        return this.actions.size();
    }

    public boolean isInitiallyTrue(int proposition) {
        return this.initialState.get(proposition);
    }

    /**
     * A copy of the set of propositions true in the initial state.
     */
    public BitSet getInitialState() {
        return (BitSet) this.initialState.clone();
    }

    /**
     * The initial value of a fluent, or {@code null} if the problem leaves it undefined.
     */
    public Double getInitialValue(int fluent) {
        return this.initialValues.get(fluent);
    }

    public GroundCondition getGoal() {
        return this.goal;
    }

    /**
     * The index of a proposition, or -1 if it does not occur in this model.
     */
    public int indexOf(GroundProposition proposition) {
        return this.propositions.indexOf(proposition);
    }

    /**
     * The index of a fluent, or -1 if it does not occur in this model.
     */
    public int indexOf(GroundNumericFluent fluent) {
        return this.fluents.indexOf(fluent);
    }
}
