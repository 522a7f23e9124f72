package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundAction;
import fr.uga.smtplan.grounding.GroundCondition;
import fr.uga.smtplan.grounding.GroundDurationConstraint;
import fr.uga.smtplan.grounding.GroundEffect;
import fr.uga.smtplan.grounding.GroundNumericExpression;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.grounding.NumericEffect;
import fr.uga.smtplan.rpg.ReachabilityResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Translates a ground model into an SMT-LIB 2 formula with a fixed number of happenings.
 *
 * <p>Happening h has a real timestamp and moves the world from state h to state h+1. State
 * 0 is the initial state and the goal must hold in state N. Timestamps strictly increase,
 * so everything that happens at the same instant belongs to the same happening. An
 * instantaneous action has one occurrence variable per happening. A durative action has
 * start, end and running variables, plus a start time and a duration that are carried from
 * the start happening to the end happening; at most one instance of a ground action runs at
 * any time.</p>
 */
public class Encoder {

    private static final Logger LOGGER = LogManager.getLogger(Encoder.class.getName());

    private final boolean prune;
    private final boolean explanatoryNames;

    private EncodingContext context;
    private Writer out;
    private int variables;
    private int assertions;

    /**
     * @param prune            restrict variables to the propositions and actions the relaxed
     *                         planning graph reaches.
     * @param explanatoryNames use human readable variable names.
     */
    public Encoder(boolean prune, boolean explanatoryNames) {
        this.prune = prune;
        this.explanatoryNames = explanatoryNames;
    }

    /**
     * Writes the formula for the given number of happenings.
     *
     * @throws EncodingException if writing to {@code out} fails.
     */
    public FormulaDocument encode(GroundedModel model, ReachabilityResult reachability, int happenings, Writer out)
        throws EncodingException {
        if (happenings < 1) {
            throw new IllegalArgumentException("The number of happenings must be positive: " + happenings);
        }
        LOGGER.debug("Encoding {} happenings", happenings);
        this.context = new EncodingContext(model, reachability, this.prune,
            VariableNaming.of(this.explanatoryNames, model), happenings);
        this.out = out;
        this.variables = 0;
        this.assertions = 0;
        try {
            // Encode the parts of the planning problem
            writeHeader();
            declareVariables();
            encodeTimestamps();
            encodeInitialState();
            encodeDurativeActions();
            encodePreconditions();
            encodeFrameAxioms();
            encodeNumericUpdates();
            encodeMutexes();
            encodeGoal();
            this.out.write("(check-sat)\n(get-model)\n");
            this.out.flush();

            FormulaDocument document = new FormulaDocument(happenings, this.variables, this.assertions,
                this.context.getActions(), this.context.getNaming());
            LOGGER.debug("Encoding complete: {}", document);
            return document;
        } catch (IOException e) {
            throw new EncodingException("Unable to write the encoding with " + happenings + " happenings", e);
        } finally {
            this.context = null;
            this.out = null;
        }
    }

    private void writeHeader() throws IOException {
        GroundedModel model = this.context.getModel();
        this.out.write("; " + this.context.getHappenings() + " happenings, "
            + this.context.getPropositions().size() + "/" + model.propositionCount() + " propositions, "
            + model.fluentCount() + " fluents, "
            + this.context.getActions().size() + "/" + model.actionCount() + " actions\n");
        this.out.write("(set-option :produce-models true)\n");
    }

    // --- declarations ---

    private void declareVariables() throws IOException {
        int n = this.context.getHappenings();
        for (int h = 0; h < n; h++) {
            declare(this.context.time(h), "Real");
        }
        for (int state = 0; state <= n; state++) {
            for (int p : this.context.getPropositions()) {
                declare(this.context.proposition(p, state), "Bool");
            }
            for (int f = 0; f < this.context.getModel().fluentCount(); f++) {
                declare(this.context.fluent(f, state), "Real");
            }
        }
        for (GroundAction action : this.context.getActions()) {
            for (int h = 0; h < n; h++) {
                declare(this.context.start(action, h), "Bool");
                if (action.isDurative()) {
                    declare(this.context.end(action, h), "Bool");
                    declare(this.context.running(action, h), "Bool");
                    declare(this.context.startTime(action, h), "Real");
                    declare(this.context.duration(action, h), "Real");
                }
            }
        }
    }

    private void declare(String name, String sort) throws IOException {
        this.out.write("(declare-fun " + name + " () " + sort + ")\n");
        this.variables++;
    }

    private void assertion(String term) throws IOException {
        if (Smt.TRUE.equals(term)) {
            return;
        }
        this.out.write("(assert " + term + ")\n");
        this.assertions++;
    }

    // --- constraints ---

    private void encodeTimestamps() throws IOException {
        assertion(Smt.apply(">=", this.context.time(0), Smt.real(0)));
        for (int h = 1; h < this.context.getHappenings(); h++) {
            assertion(Smt.apply("<", this.context.time(h - 1), this.context.time(h)));
        }
    }

    private void encodeInitialState() throws IOException {
        GroundedModel model = this.context.getModel();
        for (int p : this.context.getPropositions()) {
            String variable = this.context.proposition(p, 0);
            assertion(model.isInitiallyTrue(p) ? variable : Smt.not(variable));
        }
        for (int f = 0; f < model.fluentCount(); f++) {
            Double value = model.getInitialValue(f);
            if (value != null) {
                assertion(Smt.eq(this.context.fluent(f, 0), Smt.real(value)));
            }
        }
    }

    /**
     * Pairs the start and end of each durative action and fixes the time between them.
     */
    private void encodeDurativeActions() throws IOException {
        int n = this.context.getHappenings();
        for (GroundAction action : this.context.getActions()) {
            if (!action.isDurative()) {
                continue;
            }
            for (int h = 0; h < n; h++) {
                String start = this.context.start(action, h);
                String end = this.context.end(action, h);
                String running = this.context.running(action, h);
                String startTime = this.context.startTime(action, h);
                String duration = this.context.duration(action, h);

                List<String> bounds = new ArrayList<>();
                bounds.add(Smt.apply(">", duration, Smt.real(0)));
                for (GroundDurationConstraint constraint : action.getDuration()) {
                    bounds.add(Smt.apply(constraint.getComparator().getSymbol(), duration,
                        numeric(constraint.getValue(), h, null)));
                }
                assertion(Smt.implies(start, Smt.and(List.of(Smt.eq(startTime, this.context.time(h)),
                    Smt.and(bounds)))));

                if (h == 0) {
                    assertion(Smt.not(end));
                    assertion(Smt.eq(running, start));
                    continue;
                }
                String wasRunning = this.context.running(action, h - 1);
                assertion(Smt.eq(running, Smt.or(List.of(start, Smt.and(List.of(wasRunning, Smt.not(end)))))));
                assertion(Smt.implies(end, wasRunning));
                assertion(Smt.implies(start, Smt.or(List.of(Smt.not(wasRunning), end))));
                assertion(Smt.implies(Smt.not(start), Smt.and(List.of(
                    Smt.eq(startTime, this.context.startTime(action, h - 1)),
                    Smt.eq(duration, this.context.duration(action, h - 1))))));
                assertion(Smt.implies(end, Smt.eq(
                    Smt.apply("-", this.context.time(h), this.context.startTime(action, h - 1)),
                    this.context.duration(action, h - 1))));
            }
            assertion(Smt.not(this.context.running(action, n - 1)));
        }
    }

    private void encodePreconditions() throws IOException {
        int n = this.context.getHappenings();
        for (GroundAction action : this.context.getActions()) {
            for (int h = 0; h < n; h++) {
                String duration = action.isDurative() ? this.context.duration(action, h) : null;
                assertion(Smt.implies(this.context.start(action, h),
                    condition(action.getStartCondition(), h, duration)));
                if (!action.isDurative()) {
                    continue;
                }
                // Over-all conditions hold in every state reached while the action runs
                assertion(Smt.implies(this.context.running(action, h),
                    condition(action.getOverAllCondition(), h + 1, duration)));
                if (h > 0) {
                    assertion(Smt.implies(this.context.end(action, h),
                        condition(action.getEndCondition(), h, this.context.duration(action, h - 1))));
                }
            }
        }
    }

    private void encodeFrameAxioms() throws IOException {
        Map<Integer, List<Event>> adders = new HashMap<>();
        Map<Integer, List<Event>> deleters = new HashMap<>();
        for (Event event : events()) {
            for (int p : event.effect.getAdds()) {
                adders.computeIfAbsent(p, k -> new ArrayList<>()).add(event);
            }
            for (int p : event.effect.getDeletes()) {
                deleters.computeIfAbsent(p, k -> new ArrayList<>()).add(event);
            }
        }

        for (int h = 0; h < this.context.getHappenings(); h++) {
            for (int p : this.context.getPropositions()) {
                List<String> added = new ArrayList<>();
                for (Event event : adders.getOrDefault(p, List.of())) {
                    if (event.occursAt(h)) {
                        added.add(event.variable(h));
                    }
                }
                List<String> deleted = new ArrayList<>();
                for (Event event : deleters.getOrDefault(p, List.of())) {
                    if (event.occursAt(h)) {
                        deleted.add(event.variable(h));
                    }
                }
                // Added effects win over deleted ones
                String before = this.context.proposition(p, h);
                String persists = Smt.and(List.of(before, Smt.not(Smt.or(deleted))));
                added.add(0, persists);
                assertion(Smt.eq(this.context.proposition(p, h + 1), Smt.or(added)));
            }
        }
    }

    private void encodeNumericUpdates() throws IOException {
        Map<Integer, List<Event>> writers = new HashMap<>();
        for (Event event : events()) {
            for (NumericEffect effect : event.effect.getNumeric()) {
                List<Event> list = writers.computeIfAbsent(effect.getFluent(), k -> new ArrayList<>());
                if (!list.contains(event)) {
                    list.add(event);
                }
            }
        }

        for (int h = 0; h < this.context.getHappenings(); h++) {
            for (int f = 0; f < this.context.getModel().fluentCount(); f++) {
                String before = this.context.fluent(f, h);
                List<String> increments = new ArrayList<>();
                List<String[]> assignments = new ArrayList<>();
                for (Event event : writers.getOrDefault(f, List.of())) {
                    if (!event.occursAt(h)) {
                        continue;
                    }
                    for (NumericEffect effect : event.effect.getNumeric()) {
                        if (effect.getFluent() != f) {
                            continue;
                        }
                        String value = numeric(effect.getValue(), h, event.duration(h));
                        switch (effect.getOperation()) {
                            case INCREASE:
                                increments.add(Smt.ite(event.variable(h), value, Smt.real(0)));
                                break;
                            case DECREASE:
                                increments.add(Smt.ite(event.variable(h), "(- " + value + ")", Smt.real(0)));
                                break;
                            default:
                                assignments.add(new String[] {event.variable(h), value});
                        }
                    }
                }
                String after = before;
                if (!increments.isEmpty()) {
                    List<String> sum = new ArrayList<>();
                    sum.add(before);
                    sum.addAll(increments);
                    after = Smt.apply("+", sum);
                }
                for (String[] assignment : assignments) {
                    after = Smt.ite(assignment[0], assignment[1], after);
                }
                assertion(Smt.eq(this.context.fluent(f, h + 1), after));
            }
        }
    }

    /**
     * Forbids interfering events at the same happening.
     */
    private void encodeMutexes() throws IOException {
        List<Event> events = events();
        List<int[]> conflicts = conflictingPairs(events);
        LOGGER.debug("{} conflicting event pairs", conflicts.size());
        for (int h = 0; h < this.context.getHappenings(); h++) {
            for (int[] pair : conflicts) {
                Event first = events.get(pair[0]);
                Event second = events.get(pair[1]);
                if (first.occursAt(h) && second.occursAt(h)) {
                    assertion(Smt.not(Smt.and(List.of(first.variable(h), second.variable(h)))));
                }
            }
        }
    }

    private List<int[]> conflictingPairs(List<Event> events) {
        // Group events by the propositions and fluents they touch, so that only events
        // sharing an element are compared
        Map<String, List<Integer>> touching = new TreeMap<>();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            for (int p : event.touchedPropositions()) {
                touching.computeIfAbsent("p" + p, k -> new ArrayList<>()).add(i);
            }
            for (int f : event.touchedFluents()) {
                touching.computeIfAbsent("f" + f, k -> new ArrayList<>()).add(i);
            }
        }
        Set<Long> seen = new HashSet<>();
        List<int[]> conflicts = new ArrayList<>();
        for (List<Integer> group : touching.values()) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    int first = Math.min(group.get(i), group.get(j));
                    int second = Math.max(group.get(i), group.get(j));
                    if (first != second && seen.add((long) first * events.size() + second)
                        && events.get(first).interferesWith(events.get(second))) {
                        conflicts.add(new int[] {first, second});
                    }
                }
            }
        }
        return conflicts;
    }

    private void encodeGoal() throws IOException {
        assertion(condition(this.context.getModel().getGoal(), this.context.getHappenings(), null));
    }

    // --- terms ---

    private String condition(GroundCondition condition, int state, String duration) {
        switch (condition.getKind()) {
            case TRUE:
                return Smt.TRUE;
            case FALSE:
                return Smt.FALSE;
            case PROPOSITION:
                return this.context.proposition(condition.getProposition(), state);
            case NOT:
                return Smt.not(condition(condition.getChildren().get(0), state, duration));
            case AND:
            case OR: {
                List<String> children = new ArrayList<>();
                for (GroundCondition child : condition.getChildren()) {
                    children.add(condition(child, state, duration));
                }
                return condition.getKind() == GroundCondition.Kind.AND ? Smt.and(children) : Smt.or(children);
            }
            case COMPARISON:
                return Smt.apply(condition.getComparator().getSymbol(),
                    numeric(condition.getLeft(), state, duration),
                    numeric(condition.getRight(), state, duration));
            default:
                throw new IllegalStateException("Unknown condition kind " + condition.getKind());
        }
    }

    private String numeric(GroundNumericExpression expression, int state, String duration) {
        switch (expression.getKind()) {
            case CONSTANT:
                return Smt.real(expression.getValue());
            case FLUENT:
                return this.context.fluent(expression.getFluent(), state);
            case DURATION:
                if (duration == null) {
                    throw new IllegalStateException("?duration outside a durative action");
                }
                return duration;
            case NEGATE:
                return "(- " + numeric(expression.getChildren().get(0), state, duration) + ")";
            default:
                String left = numeric(expression.getChildren().get(0), state, duration);
                String right = numeric(expression.getChildren().get(1), state, duration);
                return Smt.apply(operator(expression.getKind()), left, right);
        }
    }

    private static String operator(GroundNumericExpression.Kind kind) {
        switch (kind) {
            case ADD:
                return "+";
            case SUBTRACT:
                return "-";
            case MULTIPLY:
                return "*";
            case DIVIDE:
                return "/";
            default:
                throw new IllegalArgumentException("Not a binary operator: " + kind);
        }
    }

    // --- events ---

    private List<Event> events() {
        List<Event> events = new ArrayList<>();
        for (GroundAction action : this.context.getActions()) {
            events.add(new Event(action, false));
            if (action.isDurative()) {
                events.add(new Event(action, true));
            }
        }
        return events;
    }

    /**
     * The start or the end of an action, i.e. the unit that may happen at a happening.
     */
    private final class Event {

        private final GroundAction action;
        private final boolean atEnd;
        private final GroundEffect effect;
        private final Set<Integer> readPropositions = new HashSet<>();
        private final Set<Integer> readFluents = new HashSet<>();
        private final Map<Integer, Boolean> writtenFluents = new HashMap<>();

        private Event(GroundAction action, boolean atEnd) {
            this.action = action;
            this.atEnd = atEnd;
            this.effect = atEnd ? action.getEndEffect() : action.getStartEffect();
            GroundCondition condition = atEnd ? action.getEndCondition() : action.getStartCondition();
            condition.collectPropositions(this.readPropositions);
            condition.collectFluents(this.readFluents);
            for (NumericEffect numeric : this.effect.getNumeric()) {
                numeric.getValue().collectFluents(this.readFluents);
                this.writtenFluents.merge(numeric.getFluent(),
                    numeric.getOperation() == NumericEffect.Operation.ASSIGN, Boolean::logicalOr);
            }
            if (!atEnd) {
                for (GroundDurationConstraint constraint : action.getDuration()) {
                    constraint.getValue().collectFluents(this.readFluents);
                }
            }
        }

        private boolean occursAt(int happening) {
            return !this.atEnd || happening > 0;
        }

        private String variable(int happening) {
            return this.atEnd
                ? Encoder.this.context.end(this.action, happening)
                : Encoder.this.context.start(this.action, happening);
        }

        private String duration(int happening) {
            if (!this.action.isDurative()) {
                return null;
            }
            return Encoder.this.context.duration(this.action, this.atEnd ? happening - 1 : happening);
        }

        private Set<Integer> touchedPropositions() {
            Set<Integer> touched = new LinkedHashSet<>(this.readPropositions);
            touched.addAll(this.effect.getAdds());
            touched.addAll(this.effect.getDeletes());
            return touched;
        }

        private Set<Integer> touchedFluents() {
            Set<Integer> touched = new LinkedHashSet<>(this.readFluents);
            touched.addAll(this.writtenFluents.keySet());
            return touched;
        }

        private boolean interferesWith(Event other) {
            return interferes(this, other) || interferes(other, this);
        }

        private boolean interferes(Event first, Event second) {
            for (int p : first.effect.getAdds()) {
                if (second.effect.getDeletes().contains(p) || second.readPropositions.contains(p)) {
                    return true;
                }
            }
            for (int p : first.effect.getDeletes()) {
                if (second.readPropositions.contains(p)) {
                    return true;
                }
            }
            for (Map.Entry<Integer, Boolean> written : first.writtenFluents.entrySet()) {
                Boolean otherWrite = second.writtenFluents.get(written.getKey());
                if (otherWrite != null && (written.getValue() || otherWrite)) {
                    return true;
                }
                if (second.readFluents.contains(written.getKey())) {
                    return true;
                }
            }
            return false;
        }
    }
}
