package fr.uga.smtplan.plan;

import fr.uga.smtplan.grounding.GroundAction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ground actions with their start times, and durations for durative actions, ordered by
 * start time.
 */
public final class TemporalPlan {

    /**
     * One action of a plan. The duration is {@code null} for instantaneous actions.
     */
    public static final class Step {

        private final double time;
        private final GroundAction action;
        private final Double duration;

        public Step(double time, GroundAction action, Double duration) {
            this.time = time;
            this.action = action;
            this.duration = duration;
        }

        public double getTime() {
            return this.time;
        }

        public GroundAction getAction() {
            return this.action;
        }

        public Double getDuration() {
            return this.duration;
        }

        @Override
        public String toString() {
            String line = String.format(Locale.ROOT, "%.3f: %s", this.time, this.action.getName());
            return this.duration == null ? line : line + String.format(Locale.ROOT, " [%.3f]", this.duration);
        }
    }

    private final List<Step> steps;

    public TemporalPlan(List<Step> steps) {
        List<Step> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingDouble(Step::getTime));
        this.steps = Collections.unmodifiableList(sorted);
    }

    public List<Step> getSteps() {
        return this.steps;
    }

    public int size() {
        return this.steps.size();
    }

    public boolean isEmpty() {
        return this.steps.isEmpty();
    }

    /**
     * The plan in the usual {@code time: (action) [duration]} format, one action per line.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Step step : this.steps) {
            sb.append(step).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
