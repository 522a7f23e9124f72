package fr.uga.smtplan.grounding;

import fr.uga.smtplan.model.Comparator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A condition over ground proposition and fluent indices. The factories simplify
 * on the fly: constants are absorbed by conjunctions and disjunctions, double
 * negations disappear and comparisons between constants are evaluated.
 */
public final class GroundCondition {

    public enum Kind {
        TRUE,
        FALSE,
        PROPOSITION,
        NOT,
        AND,
        OR,
        COMPARISON
    }

    private static final GroundCondition TRUE = new GroundCondition(Kind.TRUE, -1, List.of(), null, null, null);
    private static final GroundCondition FALSE = new GroundCondition(Kind.FALSE, -1, List.of(), null, null, null);

    private final Kind kind;
    private final int proposition;
    private final List<GroundCondition> children;
    private final Comparator comparator;
    private final GroundNumericExpression left;
    private final GroundNumericExpression right;

    private GroundCondition(Kind kind, int proposition, List<GroundCondition> children, Comparator comparator,
                            GroundNumericExpression left, GroundNumericExpression right) {
        this.kind = kind;
        this.proposition = proposition;
        this.children = children;
        this.comparator = comparator;
        this.left = left;
        this.right = right;
    }

    public static GroundCondition trueCondition() {
        return TRUE;
    }

    public static GroundCondition falseCondition() {
        return FALSE;
    }

    public static GroundCondition constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static GroundCondition proposition(int index) {
        return new GroundCondition(Kind.PROPOSITION, index, List.of(), null, null, null);
    }

    public static GroundCondition not(GroundCondition operand) {
        switch (operand.kind) {
            case TRUE:
                return FALSE;
            case FALSE:
                return TRUE;
            case NOT:
                return operand.children.get(0);
            default:
                return new GroundCondition(Kind.NOT, -1, List.of(operand), null, null, null);
        }
    }

    public static GroundCondition and(List<GroundCondition> operands) {
        List<GroundCondition> kept = new ArrayList<>();
        for (GroundCondition operand : operands) {
            if (operand.kind == Kind.FALSE) {
                return FALSE;
            } else if (operand.kind == Kind.AND) {
                kept.addAll(operand.children);
            } else if (operand.kind != Kind.TRUE) {
                kept.add(operand);
            }
        }
        if (kept.isEmpty()) {
            return TRUE;
        }
        return kept.size() == 1 ? kept.get(0) : new GroundCondition(Kind.AND, -1, List.copyOf(kept), null, null, null);
    }

    public static GroundCondition or(List<GroundCondition> operands) {
        List<GroundCondition> kept = new ArrayList<>();
        for (GroundCondition operand : operands) {
            if (operand.kind == Kind.TRUE) {
                return TRUE;
            } else if (operand.kind == Kind.OR) {
                kept.addAll(operand.children);
            } else if (operand.kind != Kind.FALSE) {
                kept.add(operand);
            }
        }
        if (kept.isEmpty()) {
            return FALSE;
        }
        return kept.size() == 1 ? kept.get(0) : new GroundCondition(Kind.OR, -1, List.copyOf(kept), null, null, null);
    }

    public static GroundCondition compare(Comparator comparator, GroundNumericExpression left,
                                          GroundNumericExpression right) {
        if (left.isConstant() && right.isConstant()) {
            return constant(comparator.test(left.getValue(), right.getValue()));
        }
        return new GroundCondition(Kind.COMPARISON, -1, List.of(), comparator, left, right);
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isTrue() {
        return this.kind == Kind.TRUE;
    }

    public boolean isFalse() {
        return this.kind == Kind.FALSE;
    }

    public int getProposition() {
        return this.proposition;
    }

    public List<GroundCondition> getChildren() {
        return this.children;
    }

    public Comparator getComparator() {
        return this.comparator;
    }

    public GroundNumericExpression getLeft() {
        return this.left;
    }

    public GroundNumericExpression getRight() {
        return this.right;
    }

    /**
     * Adds every proposition index mentioned by this condition, whatever its polarity.
     */
    public void collectPropositions(Set<Integer> propositions) {
        if (this.kind == Kind.PROPOSITION) {
            propositions.add(this.proposition);
        }
        for (GroundCondition child : this.children) {
            child.collectPropositions(propositions);
        }
    }

    /**
     * Adds every fluent index read by the comparisons of this condition.
     */
    public void collectFluents(Set<Integer> fluents) {
        if (this.kind == Kind.COMPARISON) {
            this.left.collectFluents(fluents);
            this.right.collectFluents(fluents);
        }
        for (GroundCondition child : this.children) {
            child.collectFluents(fluents);
        }
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case TRUE:
                return "true";
            case FALSE:
                return "false";
            case PROPOSITION:
                return "p" + this.proposition;
            case COMPARISON:
                return "(" + this.comparator.getSymbol() + " " + this.left + " " + this.right + ")";
            default:
                return "(" + this.kind.name().toLowerCase() + " "
                    + this.children.stream().map(GroundCondition::toString).collect(Collectors.joining(" ")) + ")";
        }
    }
}
