package fr.uga.smtplan.grounding;

import fr.uga.smtplan.model.ActionSchema;
import fr.uga.smtplan.model.Atom;
import fr.uga.smtplan.model.Domain;
import fr.uga.smtplan.model.DurationConstraint;
import fr.uga.smtplan.model.Expression;
import fr.uga.smtplan.model.NumericExpression;
import fr.uga.smtplan.model.Parameter;
import fr.uga.smtplan.model.Problem;
import fr.uga.smtplan.model.Signature;
import fr.uga.smtplan.model.TypeHierarchy;
import fr.uga.smtplan.model.TypedObject;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instantiates the action schemas of a domain over the objects of a problem.
 *
 * <p>Predicates that no action adds or deletes and functions that no action updates are
 * static: they are evaluated against the initial state while grounding and never reach the
 * ground model. A ground action whose condition simplifies to {@code false} is dropped.</p>
 */
public class Grounder {

    private static final Logger LOGGER = LogManager.getLogger(Grounder.class.getName());

    private Domain domain;
    private TypeHierarchy types;
    private Map<String, TypedObject> objects;
    private Set<String> staticPredicates;
    private Set<String> staticFunctions;
    private Set<Atom> initialFacts;
    private Map<Atom, Double> initialValues;

    private List<GroundProposition> propositions;
    private Map<GroundProposition, Integer> propositionIndex;
    private List<GroundNumericFluent> fluents;
    private Map<GroundNumericFluent, Integer> fluentIndex;

    /**
     * Builds the ground model of a domain and problem.
     *
     * @throws GroundingException if a schema, the initial state or the goal references an
     *                            undeclared predicate, function, type, parameter or object.
     */
    public GroundedModel ground(Domain domain, Problem problem) throws GroundingException {
        this.domain = domain;
        this.types = domain.getTypes();
        this.propositions = new ArrayList<>();
        this.propositionIndex = new HashMap<>();
        this.fluents = new ArrayList<>();
        this.fluentIndex = new HashMap<>();

        this.objects = collectObjects(domain, problem);
        for (ActionSchema schema : domain.getActions()) {
            validateSchema(schema);
        }
        validateInitialState(problem);
        validateCondition(problem.getGoal(), Set.of(), "goal", false);

        this.staticPredicates = new HashSet<>(domain.getPredicates().keySet());
        this.staticFunctions = new HashSet<>(domain.getFunctions().keySet());
        for (ActionSchema schema : domain.getActions()) {
            removeModified(schema.getEffect());
        }
        LOGGER.debug("Static predicates: {}, static functions: {}", this.staticPredicates, this.staticFunctions);

        this.initialFacts = new HashSet<>(problem.getInitialFacts());
        this.initialValues = new HashMap<>(problem.getInitialValues());

        // Initial facts first so that they get the lowest indices
        BitSet initialState = new BitSet();
        for (Atom fact : problem.getInitialFacts()) {
            if (!this.staticPredicates.contains(fact.getSymbol())) {
                initialState.set(proposition(new GroundProposition(fact.getSymbol(), fact.getArguments())));
            }
        }
        Map<Integer, Double> values = new HashMap<>();
        problem.getInitialValues().forEach((fluent, value) -> {
            if (!this.staticFunctions.contains(fluent.getSymbol())) {
                values.put(fluent(new GroundNumericFluent(fluent.getSymbol(), fluent.getArguments())), value);
            }
        });

        List<TypedObject> allObjects = new ArrayList<>(this.objects.values());
        List<GroundAction> actions = new ArrayList<>();
        for (ActionSchema schema : domain.getActions()) {
            List<List<String>> eligible = ArgumentCombinations.eligibleObjects(schema.getParameters(), allObjects,
                this.types);
            LOGGER.debug("Schema {}: {} candidate substitutions", schema.getName(),
                ArgumentCombinations.count(eligible));
            int dropped = 0;
            ArgumentCombinations.Iterator<String> it = ArgumentCombinations.iterator(eligible);
            while (it.hasNext()) {
                List<String> arguments = it.next();
                Map<String, String> binding = new HashMap<>();
                for (int i = 0; i < arguments.size(); i++) {
                    binding.put(schema.getParameters().get(i).getName(), arguments.get(i));
                }
                GroundAction action = groundAction(schema, arguments, binding, actions.size());
                if (action == null) {
                    dropped++;
                } else {
                    actions.add(action);
                }
            }
            LOGGER.debug("Schema {}: {} substitutions statically inapplicable", schema.getName(), dropped);
        }

        GroundCondition goal = groundCondition(problem.getGoal(), Map.of());
        if (goal.isFalse()) {
            LOGGER.warn("The goal is statically false");
        }

        LOGGER.info("Grounded {} propositions, {} fluents, {} actions", this.propositions.size(),
            this.fluents.size(), actions.size());
        return new GroundedModel(this.propositions, this.fluents, actions, initialState, values, goal);
    }

    // --- validation ---

    private Map<String, TypedObject> collectObjects(Domain domain, Problem problem) throws GroundingException {
        Map<String, TypedObject> all = new LinkedHashMap<>();
        List<TypedObject> declared = new ArrayList<>(domain.getConstants());
        declared.addAll(problem.getObjects());
        for (TypedObject object : declared) {
            for (String type : object.getTypes()) {
                checkType(type, "object " + object.getName());
            }
            if (all.putIfAbsent(object.getName(), object) != null) {
                LOGGER.debug("Object {} declared twice, keeping the first declaration", object.getName());
            }
        }
        return all;
    }

    private void checkType(String type, String context) throws GroundingException {
        if (!this.types.isDeclared(type)) {
            throw new GroundingException("Undeclared type " + type + " in " + context);
        }
    }

    private void validateSchema(ActionSchema schema) throws GroundingException {
        String context = "action " + schema.getName();
        Set<String> scope = new HashSet<>();
        for (Parameter parameter : schema.getParameters()) {
            for (String type : parameter.getTypes()) {
                checkType(type, context);
            }
            if (!scope.add(parameter.getName())) {
                throw new GroundingException("Parameter " + parameter.getName() + " declared twice in " + context);
            }
        }
        validateCondition(schema.getPrecondition(), scope, context, schema.isDurative());
        validateEffect(schema.getEffect(), scope, context, schema.isDurative());
        for (DurationConstraint constraint : schema.getDuration()) {
            validateNumeric(constraint.getValue(), scope, context, false);
        }
    }

    private void validateCondition(Expression condition, Set<String> scope, String context, boolean durative)
        throws GroundingException {
        switch (condition.getKind()) {
            case TRUE:
            case FALSE:
                break;
            case ATOM:
                validateAtom(condition.getAtom(), this.domain.getPredicates(), "predicate", scope, context);
                break;
            case EQUALS:
                for (String term : condition.getAtom().getArguments()) {
                    validateTerm(term, scope, context);
                }
                break;
            case COMPARISON:
                validateNumeric(condition.getLeft(), scope, context, durative);
                validateNumeric(condition.getRight(), scope, context, durative);
                break;
            case AT_START:
            case OVER_ALL:
            case AT_END:
                if (!durative) {
                    throw new GroundingException("Temporal qualifier outside a durative action in " + context);
                }
                validateCondition(condition.getChildren().get(0), scope, context, durative);
                break;
            case NOT:
            case AND:
            case OR:
                for (Expression child : condition.getChildren()) {
                    validateCondition(child, scope, context, durative);
                }
                break;
            default:
                throw new GroundingException("Effect " + condition + " used as a condition in " + context);
        }
    }

    private void validateEffect(Expression effect, Set<String> scope, String context, boolean durative)
        throws GroundingException {
        switch (effect.getKind()) {
            case TRUE:
                break;
            case ATOM:
                validateAtom(effect.getAtom(), this.domain.getPredicates(), "predicate", scope, context);
                break;
            case NOT:
                Expression deleted = effect.getChildren().get(0);
                if (deleted.getKind() != Expression.Kind.ATOM) {
                    throw new GroundingException("Only atoms can be deleted, found " + effect + " in " + context);
                }
                validateAtom(deleted.getAtom(), this.domain.getPredicates(), "predicate", scope, context);
                break;
            case ASSIGN:
            case INCREASE:
            case DECREASE:
                validateAtom(effect.getAtom(), this.domain.getFunctions(), "function", scope, context);
                validateNumeric(effect.getRight(), scope, context, durative);
                break;
            case AT_START:
            case AT_END:
                if (!durative) {
                    throw new GroundingException("Temporal qualifier outside a durative action in " + context);
                }
                validateEffect(effect.getChildren().get(0), scope, context, durative);
                break;
            case AND:
                for (Expression child : effect.getChildren()) {
                    validateEffect(child, scope, context, durative);
                }
                break;
            default:
                throw new GroundingException("Unsupported effect " + effect + " in " + context);
        }
    }

    private void validateNumeric(NumericExpression expression, Set<String> scope, String context,
                                 boolean durationAllowed) throws GroundingException {
        switch (expression.getKind()) {
            case NUMBER:
                break;
            case FLUENT:
                validateAtom(expression.getFluent(), this.domain.getFunctions(), "function", scope, context);
                break;
            case DURATION:
                if (!durationAllowed) {
                    throw new GroundingException("?duration used outside a durative action effect or condition in "
                        + context);
                }
                break;
            default:
                for (NumericExpression child : expression.getChildren()) {
                    validateNumeric(child, scope, context, durationAllowed);
                }
        }
    }

    private void validateAtom(Atom atom, Map<String, Signature> declared, String what, Set<String> scope,
                              String context) throws GroundingException {
        Signature signature = declared.get(atom.getSymbol());
        if (signature == null) {
            throw new GroundingException("Undeclared " + what + " " + atom.getSymbol() + " in " + context);
        }
        if (signature.arity() != atom.arity()) {
            throw new GroundingException("Wrong number of arguments for " + what + " " + atom + " in " + context
                + ", expected " + signature.arity());
        }
        for (String term : atom.getArguments()) {
            validateTerm(term, scope, context);
        }
    }

    private void validateTerm(String term, Set<String> scope, String context) throws GroundingException {
        if (Atom.isVariable(term)) {
            if (!scope.contains(term)) {
                throw new GroundingException("Undeclared parameter " + term + " in " + context);
            }
        } else if (!this.objects.containsKey(term)) {
            throw new GroundingException("Undeclared object " + term + " in " + context);
        }
    }

    private void validateInitialState(Problem problem) throws GroundingException {
        for (Atom fact : problem.getInitialFacts()) {
            validateAtom(fact, this.domain.getPredicates(), "predicate", Set.of(), "initial state");
            checkArgumentTypes(fact, this.domain.getPredicates().get(fact.getSymbol()));
        }
        for (Atom fluent : problem.getInitialValues().keySet()) {
            validateAtom(fluent, this.domain.getFunctions(), "function", Set.of(), "initial state");
            checkArgumentTypes(fluent, this.domain.getFunctions().get(fluent.getSymbol()));
        }
    }

    private void checkArgumentTypes(Atom atom, Signature signature) {
        for (int i = 0; i < atom.arity(); i++) {
            TypedObject object = this.objects.get(atom.getArguments().get(i));
            if (!signature.getParameters().get(i).accepts(object, this.types)) {
                LOGGER.warn("Initial fact {} does not match the types of {}", atom, signature);
            }
        }
    }

    private void removeModified(Expression effect) {
        switch (effect.getKind()) {
            case ATOM:
                this.staticPredicates.remove(effect.getAtom().getSymbol());
                break;
            case ASSIGN:
            case INCREASE:
            case DECREASE:
                this.staticFunctions.remove(effect.getAtom().getSymbol());
                break;
            default:
                for (Expression child : effect.getChildren()) {
                    removeModified(child);
                }
        }
    }

    // --- instantiation ---

    private GroundAction groundAction(ActionSchema schema, List<String> arguments, Map<String, String> binding,
                                      int index) {
        int propositionMark = this.propositions.size();
        int fluentMark = this.fluents.size();

        List<Expression> start = new ArrayList<>();
        List<Expression> overAll = new ArrayList<>();
        List<Expression> end = new ArrayList<>();
        if (schema.isDurative()) {
            splitTimed(schema.getPrecondition(), start, overAll, end);
        } else {
            start.add(schema.getPrecondition());
        }

        GroundCondition startCondition = groundConjunction(start, binding);
        GroundCondition overAllCondition = groundConjunction(overAll, binding);
        GroundCondition endCondition = groundConjunction(end, binding);
        if (startCondition.isFalse() || overAllCondition.isFalse() || endCondition.isFalse()) {
            rollback(propositionMark, fluentMark);
            return null;
        }

        EffectBuilder startEffect = new EffectBuilder();
        EffectBuilder endEffect = new EffectBuilder();
        if (!groundEffect(schema.getEffect(), binding, startEffect, endEffect, startEffect)) {
            rollback(propositionMark, fluentMark);
            return null;
        }

        List<GroundDurationConstraint> duration = new ArrayList<>();
        for (DurationConstraint constraint : schema.getDuration()) {
            GroundNumericExpression value = groundNumeric(constraint.getValue(), binding);
            if (value == null) {
                rollback(propositionMark, fluentMark);
                return null;
            }
            duration.add(new GroundDurationConstraint(constraint.getComparator(), value));
        }

        return new GroundAction(index, schema.getName(), arguments, schema.isDurative(), startCondition,
            overAllCondition, endCondition, startEffect.build(), endEffect.build(), duration);
    }

    private void splitTimed(Expression condition, List<Expression> start, List<Expression> overAll,
                            List<Expression> end) {
        switch (condition.getKind()) {
            case AND:
                for (Expression child : condition.getChildren()) {
                    splitTimed(child, start, overAll, end);
                }
                break;
            case AT_START:
                start.add(condition.getChildren().get(0));
                break;
            case OVER_ALL:
                overAll.add(condition.getChildren().get(0));
                break;
            case AT_END:
                end.add(condition.getChildren().get(0));
                break;
            default:
                // Unqualified conditions of durative actions are checked when the action starts
                start.add(condition);
        }
    }

    private GroundCondition groundConjunction(List<Expression> conditions, Map<String, String> binding) {
        List<GroundCondition> grounded = new ArrayList<>();
        for (Expression condition : conditions) {
            GroundCondition g = groundCondition(condition, binding);
            if (g.isFalse()) {
                return g;
            }
            grounded.add(g);
        }
        return GroundCondition.and(grounded);
    }

    private GroundCondition groundCondition(Expression condition, Map<String, String> binding) {
        switch (condition.getKind()) {
            case TRUE:
                return GroundCondition.trueCondition();
            case FALSE:
                return GroundCondition.falseCondition();
            case ATOM: {
                Atom atom = condition.getAtom();
                List<String> arguments = substitute(atom, binding);
                if (this.staticPredicates.contains(atom.getSymbol())) {
                    return GroundCondition.constant(this.initialFacts.contains(new Atom(atom.getSymbol(), arguments)));
                }
                return GroundCondition.proposition(proposition(new GroundProposition(atom.getSymbol(), arguments)));
            }
            case EQUALS: {
                List<String> terms = substitute(condition.getAtom(), binding);
                return GroundCondition.constant(terms.get(0).equals(terms.get(1)));
            }
            case NOT:
                return GroundCondition.not(groundCondition(condition.getChildren().get(0), binding));
            case AND:
            case OR: {
                List<GroundCondition> children = new ArrayList<>();
                for (Expression child : condition.getChildren()) {
                    children.add(groundCondition(child, binding));
                }
                return condition.getKind() == Expression.Kind.AND
                    ? GroundCondition.and(children)
                    : GroundCondition.or(children);
            }
            case COMPARISON: {
                GroundNumericExpression left = groundNumeric(condition.getLeft(), binding);
                GroundNumericExpression right = groundNumeric(condition.getRight(), binding);
                if (left == null || right == null) {
                    // Comparisons over undefined values never hold
                    return GroundCondition.falseCondition();
                }
                return GroundCondition.compare(condition.getComparator(), left, right);
            }
            case AT_START:
            case OVER_ALL:
            case AT_END:
                return groundCondition(condition.getChildren().get(0), binding);
            default:
                throw new IllegalStateException("Not a condition: " + condition);
        }
    }

    /**
     * Grounds an effect into the builder of its end point.
     *
     * @return false if a numeric effect depends on an undefined static value.
     */
    private boolean groundEffect(Expression effect, Map<String, String> binding, EffectBuilder start,
                                 EffectBuilder end, EffectBuilder current) {
        switch (effect.getKind()) {
            case TRUE:
                return true;
            case ATOM:
                current.adds.add(proposition(new GroundProposition(effect.getAtom().getSymbol(),
                    substitute(effect.getAtom(), binding))));
                return true;
            case NOT: {
                Atom atom = effect.getChildren().get(0).getAtom();
                current.deletes.add(proposition(new GroundProposition(atom.getSymbol(), substitute(atom, binding))));
                return true;
            }
            case ASSIGN:
            case INCREASE:
            case DECREASE: {
                GroundNumericExpression value = groundNumeric(effect.getRight(), binding);
                if (value == null) {
                    return false;
                }
                int fluent = fluent(new GroundNumericFluent(effect.getAtom().getSymbol(),
                    substitute(effect.getAtom(), binding)));
                current.numeric.add(new NumericEffect(NumericEffect.Operation.valueOf(effect.getKind().name()),
                    fluent, value));
                return true;
            }
            case AT_START:
                return groundEffect(effect.getChildren().get(0), binding, start, end, start);
            case AT_END:
                return groundEffect(effect.getChildren().get(0), binding, start, end, end);
            case AND:
                for (Expression child : effect.getChildren()) {
                    if (!groundEffect(child, binding, start, end, current)) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Not an effect: " + effect);
        }
    }

    /**
     * Grounds a numeric expression, replacing static fluents by their initial value.
     *
     * @return the ground expression, or {@code null} if it depends on an undefined static value.
     */
    private GroundNumericExpression groundNumeric(NumericExpression expression, Map<String, String> binding) {
        switch (expression.getKind()) {
            case NUMBER:
                return GroundNumericExpression.constant(expression.getValue());
            case DURATION:
                return GroundNumericExpression.duration();
            case FLUENT: {
                Atom atom = expression.getFluent();
                List<String> arguments = substitute(atom, binding);
                if (this.staticFunctions.contains(atom.getSymbol())) {
                    Double value = this.initialValues.get(new Atom(atom.getSymbol(), arguments));
                    return value == null ? null : GroundNumericExpression.constant(value);
                }
                return GroundNumericExpression.fluent(fluent(new GroundNumericFluent(atom.getSymbol(), arguments)));
            }
            case NEGATE: {
                GroundNumericExpression operand = groundNumeric(expression.getChildren().get(0), binding);
                return operand == null ? null : GroundNumericExpression.negate(operand);
            }
            default: {
                GroundNumericExpression left = groundNumeric(expression.getChildren().get(0), binding);
                GroundNumericExpression right = groundNumeric(expression.getChildren().get(1), binding);
                if (left == null || right == null) {
                    return null;
                }
                return GroundNumericExpression.binary(
                    GroundNumericExpression.Kind.valueOf(expression.getKind().name()), left, right);
            }
        }
    }

    private static List<String> substitute(Atom atom, Map<String, String> binding) {
        List<String> arguments = new ArrayList<>(atom.arity());
        for (String term : atom.getArguments()) {
            arguments.add(Atom.isVariable(term) ? binding.get(term) : term);
        }
        return arguments;
    }

    // --- indexing ---

    private int proposition(GroundProposition proposition) {
        return this.propositionIndex.computeIfAbsent(proposition, p -> {
            this.propositions.add(p);
            return this.propositions.size() - 1;
        });
    }

    private int fluent(GroundNumericFluent fluent) {
        return this.fluentIndex.computeIfAbsent(fluent, f -> {
            this.fluents.add(f);
            return this.fluents.size() - 1;
        });
    }

    /**
     * Forgets the propositions and fluents registered while grounding a dropped action.
     */
    private void rollback(int propositionMark, int fluentMark) {
        while (this.propositions.size() > propositionMark) {
            this.propositionIndex.remove(this.propositions.remove(this.propositions.size() - 1));
        }
        while (this.fluents.size() > fluentMark) {
            this.fluentIndex.remove(this.fluents.remove(this.fluents.size() - 1));
        }
    }

    private static final class EffectBuilder {

        private final Set<Integer> adds = new LinkedHashSet<>();
        private final Set<Integer> deletes = new LinkedHashSet<>();
        private final List<NumericEffect> numeric = new ArrayList<>();

        private GroundEffect build() {
            if (this.adds.isEmpty() && this.deletes.isEmpty() && this.numeric.isEmpty()) {
                return GroundEffect.empty();
            }
            return new GroundEffect(new ArrayList<>(this.adds), new ArrayList<>(this.deletes), this.numeric);
        }
    }
}
