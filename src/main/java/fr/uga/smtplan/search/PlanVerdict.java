package fr.uga.smtplan.search;

import fr.uga.smtplan.plan.TemporalPlan;

/**
 * The outcome of a search: a plan found with some number of happenings, no plan within
 * the bounds, an emit-only run that never consulted the solver, or a search stopped by an
 * interrupt before it reached the upper bound.
 */
public final class PlanVerdict {

    public enum Status {
        FOUND,
        NOT_FOUND,
        NOT_SOLVED,
        INTERRUPTED
    }

    private final Status status;
    private final int happenings;
    private final TemporalPlan plan;

    private PlanVerdict(Status status, int happenings, TemporalPlan plan) {
        this.status = status;
        this.happenings = happenings;
        this.plan = plan;
    }

    public static PlanVerdict found(int happenings, TemporalPlan plan) {
        return new PlanVerdict(Status.FOUND, happenings, plan);
    }

    /**
     * @param lastTried the last happening count that was tried, or the upper bound if none.
     */
    public static PlanVerdict notFound(int lastTried) {
        return new PlanVerdict(Status.NOT_FOUND, lastTried, null);
    }

    public static PlanVerdict notSolved(int happenings) {
        return new PlanVerdict(Status.NOT_SOLVED, happenings, null);
    }

    /**
     * @param lastTried the last happening count that was solved, or 0 if none.
     */
    public static PlanVerdict interrupted(int lastTried) {
        return new PlanVerdict(Status.INTERRUPTED, lastTried, null);
    }

    public Status getStatus() {
        return this.status;
    }

    public boolean isFound() {
        return this.status == Status.FOUND;
    }

    public int getHappenings() {
        return this.happenings;
    }

    /**
     * The decoded plan of a {@link Status#FOUND} verdict, {@code null} otherwise.
     */
    public TemporalPlan getPlan() {
        return this.plan;
    }

    @Override
    public String toString() {
        return this.status + "(" + this.happenings + ")";
    }
}
