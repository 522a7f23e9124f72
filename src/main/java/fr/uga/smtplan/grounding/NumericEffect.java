package fr.uga.smtplan.grounding;

/**
 * An update of one ground fluent. The value is evaluated in the state before the
 * happening at which the effect takes place.
 */
public final class NumericEffect {

    public enum Operation {
        ASSIGN,
        INCREASE,
        DECREASE
    }

    private final Operation operation;
    private final int fluent;
    private final GroundNumericExpression value;

    public NumericEffect(Operation operation, int fluent, GroundNumericExpression value) {
        this.operation = operation;
        this.fluent = fluent;
        this.value = value;
    }

    public Operation getOperation() {
        return this.operation;
    }

    public int getFluent() {
        return this.fluent;
    }

    public GroundNumericExpression getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return "(" + this.operation.name().toLowerCase() + " f" + this.fluent + " " + this.value + ")";
    }
}
