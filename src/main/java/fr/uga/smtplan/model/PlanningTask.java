package fr.uga.smtplan.model;

/**
 * A domain together with one of its problems.
 */
public final class PlanningTask {

    private final Domain domain;
    private final Problem problem;

    public PlanningTask(Domain domain, Problem problem) {
        this.domain = domain;
        this.problem = problem;
    }

    public Domain getDomain() {
        return this.domain;
    }

    public Problem getProblem() {
        return this.problem;
    }
}
