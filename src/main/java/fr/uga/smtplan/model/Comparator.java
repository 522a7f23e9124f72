package fr.uga.smtplan.model;

/**
 * Numeric comparison operators of conditions and duration constraints.
 */
public enum Comparator {

    LESS("<"),
    LESS_OR_EQUAL("<="),
    EQUAL("="),
    GREATER_OR_EQUAL(">="),
    GREATER(">");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * The SMT-LIB (and PDDL) spelling of the operator.
     */
    public String getSymbol() {
        return this.symbol;
    }

    public boolean test(double left, double right) {
        switch (this) {
            case LESS:
                return left < right;
            case LESS_OR_EQUAL:
                return left <= right;
            case EQUAL:
                return left == right;
            case GREATER_OR_EQUAL:
                return left >= right;
            case GREATER:
                return left > right;
            default:
                throw new IllegalStateException("Unknown comparator " + this);
        }
    }
}
