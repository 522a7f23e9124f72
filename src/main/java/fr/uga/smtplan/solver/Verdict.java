package fr.uga.smtplan.solver;

/**
 * The answer of a solver to a satisfiability check.
 */
public enum Verdict {

    SAT,
    UNSAT,

    /**
     * The solver could not be run or answered neither sat nor unsat.
     */
    ERROR
}
