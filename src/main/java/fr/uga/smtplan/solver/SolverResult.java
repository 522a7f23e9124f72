package fr.uga.smtplan.solver;

/**
 * A verdict, together with the model when the verdict is {@link Verdict#SAT} and a
 * message when it is {@link Verdict#ERROR}.
 */
public final class SolverResult {

    private static final SolverResult UNSAT = new SolverResult(Verdict.UNSAT, SolverModel.empty(), "");

    private final Verdict verdict;
    private final SolverModel model;
    private final String message;

    private SolverResult(Verdict verdict, SolverModel model, String message) {
        this.verdict = verdict;
        this.model = model;
        this.message = message;
    }

    public static SolverResult sat(SolverModel model) {
        return new SolverResult(Verdict.SAT, model, "");
    }

    public static SolverResult unsat() {
        return UNSAT;
    }

    public static SolverResult error(String message) {
        return new SolverResult(Verdict.ERROR, SolverModel.empty(), message);
    }

    public Verdict getVerdict() {
        return this.verdict;
    }

    public SolverModel getModel() {
        return this.model;
    }

    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return this.verdict + (this.message.isEmpty() ? "" : ": " + this.message);
    }
}
