package fr.uga.smtplan.grounding;

import java.util.List;
import java.util.Set;

/**
 * A numeric expression over ground fluent indices. Operations on constants are folded
 * when the expression is built, so a {@code CONSTANT} never has constant siblings under
 * an arithmetic node.
 */
public final class GroundNumericExpression {

    public enum Kind {
        CONSTANT,
        FLUENT,
        DURATION,
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE,
        NEGATE
    }

    private static final GroundNumericExpression DURATION =
        new GroundNumericExpression(Kind.DURATION, 0, -1, List.of());

    private final Kind kind;
    private final double value;
    private final int fluent;
    private final List<GroundNumericExpression> children;

    private GroundNumericExpression(Kind kind, double value, int fluent, List<GroundNumericExpression> children) {
        this.kind = kind;
        this.value = value;
        this.fluent = fluent;
        this.children = children;
    }

    public static GroundNumericExpression constant(double value) {
        return new GroundNumericExpression(Kind.CONSTANT, value, -1, List.of());
    }

    public static GroundNumericExpression fluent(int index) {
        return new GroundNumericExpression(Kind.FLUENT, 0, index, List.of());
    }

    public static GroundNumericExpression duration() {
        return DURATION;
    }

    public static GroundNumericExpression negate(GroundNumericExpression operand) {
        if (operand.isConstant()) {
            return constant(-operand.value);
        }
        return new GroundNumericExpression(Kind.NEGATE, 0, -1, List.of(operand));
    }

    public static GroundNumericExpression binary(Kind kind, GroundNumericExpression left,
                                                 GroundNumericExpression right) {
        if (left.isConstant() && right.isConstant()) {
            switch (kind) {
                case ADD:
                    return constant(left.value + right.value);
                case SUBTRACT:
                    return constant(left.value - right.value);
                case MULTIPLY:
                    return constant(left.value * right.value);
                case DIVIDE:
                    if (right.value != 0) {
                        return constant(left.value / right.value);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Not a binary operator: " + kind);
            }
        }
        return new GroundNumericExpression(kind, 0, -1, List.of(left, right));
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isConstant() {
        return this.kind == Kind.CONSTANT;
    }

    public double getValue() {
        return this.value;
    }

    public int getFluent() {
        return this.fluent;
    }

    public List<GroundNumericExpression> getChildren() {
        return this.children;
    }

    /**
     * Adds the indices of all fluents read by this expression to {@code fluents}.
     */
    public void collectFluents(Set<Integer> fluents) {
        if (this.kind == Kind.FLUENT) {
            fluents.add(this.fluent);
        }
        for (GroundNumericExpression child : this.children) {
            child.collectFluents(fluents);
        }
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case CONSTANT:
                return Double.toString(this.value);
            case FLUENT:
                return "f" + this.fluent;
            case DURATION:
                return "?duration";
            case NEGATE:
                return "(- " + this.children.get(0) + ")";
            default:
                return "(" + this.kind + " " + this.children.get(0) + " " + this.children.get(1) + ")";
        }
    }
}
