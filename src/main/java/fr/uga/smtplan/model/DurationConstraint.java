package fr.uga.smtplan.model;

/**
 * One bound on the duration of a durative action, e.g. {@code (<= ?duration (fuel ?v))}.
 */
public final class DurationConstraint {

    private final Comparator comparator;
    private final NumericExpression value;

    public DurationConstraint(Comparator comparator, NumericExpression value) {
        this.comparator = comparator;
        this.value = value;
    }

    public static DurationConstraint fixed(double duration) {
        return new DurationConstraint(Comparator.EQUAL, NumericExpression.number(duration));
    }

    public Comparator getComparator() {
        return this.comparator;
    }

    public NumericExpression getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return "(" + this.comparator.getSymbol() + " ?duration " + this.value + ")";
    }
}
