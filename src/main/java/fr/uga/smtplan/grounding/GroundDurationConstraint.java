package fr.uga.smtplan.grounding;

import fr.uga.smtplan.model.Comparator;

/**
 * A ground bound on the duration of an action, evaluated in the state in which the
 * action starts.
 */
public final class GroundDurationConstraint {

    private final Comparator comparator;
    private final GroundNumericExpression value;

    public GroundDurationConstraint(Comparator comparator, GroundNumericExpression value) {
        this.comparator = comparator;
        this.value = value;
    }

    public Comparator getComparator() {
        return this.comparator;
    }

    public GroundNumericExpression getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return "(" + this.comparator.getSymbol() + " ?duration " + this.value + ")";
    }
}
