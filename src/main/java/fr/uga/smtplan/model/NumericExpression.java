package fr.uga.smtplan.model;

import java.util.List;

/**
 * A lifted numeric expression. The {@link Kind} tag decides which fields are set: a
 * {@code NUMBER} carries a value, a {@code FLUENT} carries a function atom, the arithmetic
 * kinds carry their operands as children and {@code DURATION} stands for the
 * {@code ?duration} variable of a durative action.
 */
public final class NumericExpression {

    public enum Kind {
        NUMBER,
        FLUENT,
        DURATION,
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE,
        NEGATE
    }

    private final Kind kind;
    private final double value;
    private final Atom fluent;
    private final List<NumericExpression> children;

    private NumericExpression(Kind kind, double value, Atom fluent, List<NumericExpression> children) {
        this.kind = kind;
        this.value = value;
        this.fluent = fluent;
        this.children = List.copyOf(children);
    }

    public static NumericExpression number(double value) {
        return new NumericExpression(Kind.NUMBER, value, null, List.of());
    }

    public static NumericExpression fluent(Atom fluent) {
        return new NumericExpression(Kind.FLUENT, 0, fluent, List.of());
    }

    public static NumericExpression duration() {
        return new NumericExpression(Kind.DURATION, 0, null, List.of());
    }

    public static NumericExpression negate(NumericExpression operand) {
        return new NumericExpression(Kind.NEGATE, 0, null, List.of(operand));
    }

    /**
     * Builds a binary operation of kind {@code ADD}, {@code SUBTRACT}, {@code MULTIPLY} or
     * {@code DIVIDE}.
     */
    public static NumericExpression binary(Kind kind, NumericExpression left, NumericExpression right) {
        switch (kind) {
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
                return new NumericExpression(kind, 0, null, List.of(left, right));
            default:
                throw new IllegalArgumentException("Not a binary operator: " + kind);
        }
    }

    public Kind getKind() {
        return this.kind;
    }

    public double getValue() {
        return this.value;
    }

    public Atom getFluent() {
        return this.fluent;
    }

    public List<NumericExpression> getChildren() {
        return this.children;
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case NUMBER:
                return Double.toString(this.value);
            case FLUENT:
                return this.fluent.toString();
            case DURATION:
                return "?duration";
            case NEGATE:
                return "(- " + this.children.get(0) + ")";
            case ADD:
                return "(+ " + this.children.get(0) + " " + this.children.get(1) + ")";
            case SUBTRACT:
                return "(- " + this.children.get(0) + " " + this.children.get(1) + ")";
            case MULTIPLY:
                return "(* " + this.children.get(0) + " " + this.children.get(1) + ")";
            default:
                return "(/ " + this.children.get(0) + " " + this.children.get(1) + ")";
        }
    }
}
