package fr.uga.smtplan.solver;

/**
 * An external decision procedure for SMT-LIB 2 formulas. Implementations report their own
 * failures as {@link Verdict#ERROR} instead of throwing.
 */
public interface SmtSolver {

    /**
     * Checks the satisfiability of a complete SMT-LIB 2 script ending with
     * {@code (check-sat)}. Blocks until the solver answers.
     */
    SolverResult checkSat(String formula);
}
