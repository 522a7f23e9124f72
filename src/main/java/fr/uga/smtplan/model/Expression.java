package fr.uga.smtplan.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A lifted logical formula or effect. Conditions and effects share this representation:
 * in an effect an {@code ATOM} adds a fact, a {@code NOT} around an atom deletes it and the
 * numeric kinds update a fluent. Consumers dispatch on {@link #getKind()}.
 */
public final class Expression {

    public enum Kind {
        TRUE,
        FALSE,
        ATOM,
        EQUALS,
        NOT,
        AND,
        OR,
        COMPARISON,
        AT_START,
        OVER_ALL,
        AT_END,
        ASSIGN,
        INCREASE,
        DECREASE
    }

    private static final Expression TRUE = new Expression(Kind.TRUE, null, List.of(), null, null, null);
    private static final Expression FALSE = new Expression(Kind.FALSE, null, List.of(), null, null, null);

    private final Kind kind;
    private final Atom atom;
    private final List<Expression> children;
    private final Comparator comparator;
    private final NumericExpression left;
    private final NumericExpression right;

    private Expression(Kind kind, Atom atom, List<Expression> children, Comparator comparator,
                       NumericExpression left, NumericExpression right) {
        this.kind = kind;
        this.atom = atom;
        this.children = List.copyOf(children);
        this.comparator = comparator;
        this.left = left;
        this.right = right;
    }

    public static Expression trueExpression() {
        return TRUE;
    }

    public static Expression falseExpression() {
        return FALSE;
    }

    public static Expression atom(Atom atom) {
        return new Expression(Kind.ATOM, atom, List.of(), null, null, null);
    }

    public static Expression atom(String symbol, String... arguments) {
        return atom(new Atom(symbol, arguments));
    }

    /**
     * Equality between two terms, as in {@code (= ?a ?b)}.
     */
    public static Expression equalTerms(String left, String right) {
        return new Expression(Kind.EQUALS, new Atom("=", left, right), List.of(), null, null, null);
    }

    public static Expression not(Expression operand) {
        return new Expression(Kind.NOT, null, List.of(operand), null, null, null);
    }

    public static Expression and(List<Expression> operands) {
        return new Expression(Kind.AND, null, operands, null, null, null);
    }

    public static Expression and(Expression... operands) {
        return and(List.of(operands));
    }

    public static Expression or(List<Expression> operands) {
        return new Expression(Kind.OR, null, operands, null, null, null);
    }

    public static Expression or(Expression... operands) {
        return or(List.of(operands));
    }

    public static Expression compare(Comparator comparator, NumericExpression left, NumericExpression right) {
        return new Expression(Kind.COMPARISON, null, List.of(), comparator, left, right);
    }

    public static Expression atStart(Expression operand) {
        return new Expression(Kind.AT_START, null, List.of(operand), null, null, null);
    }

    public static Expression overAll(Expression operand) {
        return new Expression(Kind.OVER_ALL, null, List.of(operand), null, null, null);
    }

    public static Expression atEnd(Expression operand) {
        return new Expression(Kind.AT_END, null, List.of(operand), null, null, null);
    }

    /**
     * A numeric effect of kind {@code ASSIGN}, {@code INCREASE} or {@code DECREASE} on a fluent.
     */
    public static Expression update(Kind kind, Atom fluent, NumericExpression value) {
        switch (kind) {
            case ASSIGN:
            case INCREASE:
            case DECREASE:
                return new Expression(kind, fluent, List.of(), null, null, value);
            default:
                throw new IllegalArgumentException("Not a numeric effect: " + kind);
        }
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * The atom of an {@code ATOM} or {@code EQUALS} expression, or the updated fluent of a
     * numeric effect.
     */
    public Atom getAtom() {
        return this.atom;
    }

    public List<Expression> getChildren() {
        return this.children;
    }

    public Comparator getComparator() {
        return this.comparator;
    }

    public NumericExpression getLeft() {
        return this.left;
    }

    /**
     * The right operand of a comparison, or the value of a numeric effect.
     */
    public NumericExpression getRight() {
        return this.right;
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case TRUE:
                return "true";
            case FALSE:
                return "false";
            case ATOM:
                return this.atom.toString();
            case EQUALS:
                return "(= " + this.atom.getArguments().get(0) + " " + this.atom.getArguments().get(1) + ")";
            case COMPARISON:
                return "(" + this.comparator.getSymbol() + " " + this.left + " " + this.right + ")";
            case ASSIGN:
            case INCREASE:
            case DECREASE:
                return "(" + this.kind.name().toLowerCase() + " " + this.atom + " " + this.right + ")";
            default:
                return "(" + this.kind.name().toLowerCase().replace('_', '-') + " "
                    + this.children.stream().map(Expression::toString).collect(Collectors.joining(" ")) + ")";
        }
    }
}
