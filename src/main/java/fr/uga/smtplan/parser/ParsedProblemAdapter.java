package fr.uga.smtplan.parser;

import fr.uga.smtplan.model.ActionSchema;
import fr.uga.smtplan.model.Atom;
import fr.uga.smtplan.model.Comparator;
import fr.uga.smtplan.model.Domain;
import fr.uga.smtplan.model.DurationConstraint;
import fr.uga.smtplan.model.Expression;
import fr.uga.smtplan.model.NumericExpression;
import fr.uga.smtplan.model.Parameter;
import fr.uga.smtplan.model.PlanningTask;
import fr.uga.smtplan.model.Problem;
import fr.uga.smtplan.model.Signature;
import fr.uga.smtplan.model.TypeHierarchy;
import fr.uga.smtplan.model.TypedObject;

import fr.uga.pddl4j.parser.Connector;
import fr.uga.pddl4j.parser.DefaultParsedProblem;
import fr.uga.pddl4j.parser.ErrorManager;
import fr.uga.pddl4j.parser.Message;
import fr.uga.pddl4j.parser.NamedTypedList;
import fr.uga.pddl4j.parser.ParsedAction;
import fr.uga.pddl4j.parser.Parser;
import fr.uga.pddl4j.parser.Symbol;
import fr.uga.pddl4j.parser.TypedSymbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a domain and a problem with the PDDL4J parser and converts the parsed structures
 * into the planner's lifted model.
 */
public class ParsedProblemAdapter {

    private static final Logger LOGGER = LogManager.getLogger(ParsedProblemAdapter.class.getName());

    private static final String DURATION_VARIABLE = "?duration";

    /**
     * Parses the two files.
     *
     * @throws ParseException if a file cannot be read, the parser reports an error, or the
     *                        files use an unsupported construct.
     */
    public PlanningTask parse(String domainPath, String problemPath) throws ParseException {
        final Parser parser = new Parser();
        final DefaultParsedProblem parsed;
        try {
            parsed = parser.parse(domainPath, problemPath);
        } catch (Exception e) {
            throw new ParseException("Cannot parse " + domainPath + " and " + problemPath + ": " + e.getMessage(), e);
        }
        final ErrorManager errors = parser.getErrorManager();
        final List<String> reported = new ArrayList<>();
        if (!errors.isEmpty()) {
            for (Message message : errors.getMessages()) {
                if (message.getType().name().endsWith("ERROR")) {
                    reported.add(message.toString());
                } else {
                    LOGGER.warn("{}", message);
                }
            }
        }
        if (!reported.isEmpty()) {
            throw new ParseException(String.join(System.lineSeparator(), reported));
        }
        if (parsed == null) {
            throw new ParseException("The parser returned no problem for " + domainPath + " and " + problemPath);
        }
        return this.convert(parsed);
    }

    /**
     * Converts an already parsed problem.
     */
    public PlanningTask convert(DefaultParsedProblem parsed) throws ParseException {
        final Domain domain = new Domain(String.valueOf(parsed.getDomainName()), this.types(parsed),
            this.objects(parsed.getConstants()), this.signatures(parsed.getPredicates()),
            this.signatures(parsed.getFunctions()), this.actions(parsed.getActions()));

        final List<Atom> facts = new ArrayList<>();
        final Map<Atom, Double> values = new LinkedHashMap<>();
        for (fr.uga.pddl4j.parser.Expression<String> fact : parsed.getInit()) {
            this.initialFact(fact, facts, values);
        }
        final Expression goal = parsed.getGoal() == null
            ? Expression.trueExpression() : this.condition(parsed.getGoal());
        final Problem problem = new Problem(String.valueOf(parsed.getProblemName()),
            this.objects(parsed.getObjects()), facts, values, goal);
        LOGGER.debug("Converted domain {} with {} actions and problem {} with {} objects",
            domain.getName(), domain.getActions().size(), problem.getName(), problem.getObjects().size());
        return new PlanningTask(domain, problem);
    }

    private TypeHierarchy types(DefaultParsedProblem parsed) {
        final Map<String, List<String>> parents = new LinkedHashMap<>();
        if (parsed.getTypes() != null) {
            for (TypedSymbol<String> type : parsed.getTypes()) {
                parents.put(type.getValue(), this.typeNames(type));
            }
        }
        return new TypeHierarchy(parents);
    }

    private List<String> typeNames(TypedSymbol<String> symbol) {
        final List<String> names = new ArrayList<>();
        if (symbol.getTypes() != null) {
            for (Symbol<String> type : symbol.getTypes()) {
                names.add(type.getValue());
            }
        }
        if (names.isEmpty()) {
            names.add(TypeHierarchy.OBJECT);
        }
        return names;
    }

    private List<TypedObject> objects(List<TypedSymbol<String>> symbols) {
        final List<TypedObject> objects = new ArrayList<>();
        if (symbols != null) {
            for (TypedSymbol<String> symbol : symbols) {
                objects.add(new TypedObject(symbol.getValue(), this.typeNames(symbol)));
            }
        }
        return objects;
    }

    private List<Parameter> parameters(List<TypedSymbol<String>> symbols) {
        final List<Parameter> parameters = new ArrayList<>();
        if (symbols != null) {
            for (TypedSymbol<String> symbol : symbols) {
                parameters.add(new Parameter(symbol.getValue(), this.typeNames(symbol)));
            }
        }
        return parameters;
    }

    private List<Signature> signatures(List<NamedTypedList> lists) {
        final List<Signature> signatures = new ArrayList<>();
        if (lists != null) {
            for (NamedTypedList list : lists) {
                signatures.add(new Signature(list.getName().getValue(), this.parameters(list.getArguments())));
            }
        }
        return signatures;
    }

    private List<ActionSchema> actions(List<ParsedAction> parsedActions) throws ParseException {
        final List<ActionSchema> actions = new ArrayList<>();
        if (parsedActions == null) {
            return actions;
        }
        for (ParsedAction action : parsedActions) {
            final String name = action.getName().getValue();
            final Expression precondition = action.getPreconditions() == null
                ? Expression.trueExpression() : this.condition(action.getPreconditions());
            final Expression effect = action.getEffects() == null
                ? Expression.trueExpression() : this.condition(action.getEffects());
            final List<Parameter> parameters = this.parameters(action.getParameters());
            if (action.getDuration() == null) {
                actions.add(ActionSchema.instantaneous(name, parameters, precondition, effect));
            } else {
                actions.add(new ActionSchema(name, parameters, precondition, effect,
                    this.durationConstraints(name, action.getDuration())));
            }
        }
        return actions;
    }

    private List<DurationConstraint> durationConstraints(String action, fr.uga.pddl4j.parser.Expression<String> exp)
        throws ParseException {
        final List<DurationConstraint> constraints = new ArrayList<>();
        if (exp.getConnector() == Connector.AND) {
            for (fr.uga.pddl4j.parser.Expression<String> child : exp.getChildren()) {
                constraints.addAll(this.durationConstraints(action, child));
            }
            return constraints;
        }
        final Comparator comparator = comparator(exp.getConnector());
        if (comparator == null || exp.getChildren().isEmpty()) {
            throw new ParseException("Unsupported duration constraint in action " + action + ": " + exp);
        }
        // The value is the operand that is not ?duration
        final List<fr.uga.pddl4j.parser.Expression<String>> children = exp.getChildren();
        constraints.add(new DurationConstraint(comparator, this.numeric(children.get(children.size() - 1))));
        return constraints;
    }

    private void initialFact(fr.uga.pddl4j.parser.Expression<String> fact, List<Atom> facts,
                             Map<Atom, Double> values) throws ParseException {
        final List<fr.uga.pddl4j.parser.Expression<String>> children = fact.getChildren();
        if (children.size() == 2 && children.get(0).getConnector() == Connector.FN_HEAD
            && children.get(1).getConnector() == Connector.NUMBER) {
            values.put(this.atom(children.get(0)), children.get(1).getValue());
            return;
        }
        if (fact.getConnector() == Connector.ATOM) {
            facts.add(this.atom(fact));
            return;
        }
        throw new ParseException("Unsupported initial fact: " + fact);
    }

    private Atom atom(fr.uga.pddl4j.parser.Expression<String> exp) {
        final List<String> arguments = new ArrayList<>();
        for (Symbol<String> argument : exp.getArguments()) {
            arguments.add(argument.getValue());
        }
        return new Atom(exp.getSymbol().getValue(), arguments);
    }

    /**
     * Converts a goal, precondition or effect.
     */
    Expression condition(fr.uga.pddl4j.parser.Expression<String> exp) throws ParseException {
        switch (exp.getConnector()) {
            case TRUE:
                return Expression.trueExpression();
            case FALSE:
                return Expression.falseExpression();
            case ATOM:
                return Expression.atom(this.atom(exp));
            case EQUAL_ATOM:
                return Expression.equalTerms(exp.getArguments().get(0).getValue(),
                    exp.getArguments().get(1).getValue());
            case NOT:
                return Expression.not(this.condition(exp.getChildren().get(0)));
            case AND:
                return Expression.and(this.conditions(exp.getChildren()));
            case OR:
                return Expression.or(this.conditions(exp.getChildren()));
            case AT_START:
                return Expression.atStart(this.condition(exp.getChildren().get(0)));
            case OVER_ALL:
                return Expression.overAll(this.condition(exp.getChildren().get(0)));
            case AT_END:
                return Expression.atEnd(this.condition(exp.getChildren().get(0)));
            case LESS_COMPARISON:
            case LESS_OR_EQUAL_COMPARISON:
            case EQUAL_COMPARISON:
            case GREATER_OR_EQUAL_COMPARISON:
            case GREATER_COMPARISON:
                return Expression.compare(comparator(exp.getConnector()),
                    this.numeric(exp.getChildren().get(0)), this.numeric(exp.getChildren().get(1)));
            case ASSIGN:
                return this.update(Expression.Kind.ASSIGN, exp);
            case INCREASE:
                return this.update(Expression.Kind.INCREASE, exp);
            case DECREASE:
                return this.update(Expression.Kind.DECREASE, exp);
            default:
                if (exp.getSymbol() == null && exp.getChildren().size() == 1) {
                    return this.condition(exp.getChildren().get(0));
                }
                throw new ParseException("Unsupported expression " + exp.getConnector() + ": " + exp);
        }
    }

    private List<Expression> conditions(List<fr.uga.pddl4j.parser.Expression<String>> children)
        throws ParseException {
        final List<Expression> operands = new ArrayList<>();
        for (fr.uga.pddl4j.parser.Expression<String> child : children) {
            operands.add(this.condition(child));
        }
        return operands;
    }

    private Expression update(Expression.Kind kind, fr.uga.pddl4j.parser.Expression<String> exp)
        throws ParseException {
        final fr.uga.pddl4j.parser.Expression<String> head = exp.getChildren().get(0);
        if (head.getConnector() != Connector.FN_HEAD) {
            throw new ParseException("A numeric effect must update a function: " + exp);
        }
        return Expression.update(kind, this.atom(head), this.numeric(exp.getChildren().get(1)));
    }

    /**
     * Converts a numeric expression.
     */
    NumericExpression numeric(fr.uga.pddl4j.parser.Expression<String> exp) throws ParseException {
        if (exp.getSymbol() != null && DURATION_VARIABLE.equals(exp.getSymbol().getValue())) {
            return NumericExpression.duration();
        }
        switch (exp.getConnector()) {
            case NUMBER:
                return NumericExpression.number(exp.getValue());
            case FN_HEAD:
                return NumericExpression.fluent(this.atom(exp));
            case UMINUS:
                return NumericExpression.negate(this.numeric(exp.getChildren().get(0)));
            case MINUS:
                if (exp.getChildren().size() == 1) {
                    return NumericExpression.negate(this.numeric(exp.getChildren().get(0)));
                }
                return this.binary(NumericExpression.Kind.SUBTRACT, exp);
            case PLUS:
                return this.binary(NumericExpression.Kind.ADD, exp);
            case MUL:
                return this.binary(NumericExpression.Kind.MULTIPLY, exp);
            case DIV:
                return this.binary(NumericExpression.Kind.DIVIDE, exp);
            default:
                if (exp.getSymbol() == null && exp.getChildren().size() == 1) {
                    return this.numeric(exp.getChildren().get(0));
                }
                throw new ParseException("Unsupported numeric expression " + exp.getConnector() + ": " + exp);
        }
    }

    private NumericExpression binary(NumericExpression.Kind kind, fr.uga.pddl4j.parser.Expression<String> exp)
        throws ParseException {
        // n-ary sums and products fold to the left
        NumericExpression result = this.numeric(exp.getChildren().get(0));
        for (int i = 1; i < exp.getChildren().size(); i++) {
            result = NumericExpression.binary(kind, result, this.numeric(exp.getChildren().get(i)));
        }
        return result;
    }

    private static Comparator comparator(Connector connector) {
        switch (connector) {
            case LESS_COMPARISON:
                return Comparator.LESS;
            case LESS_OR_EQUAL_COMPARISON:
                return Comparator.LESS_OR_EQUAL;
            case EQUAL_COMPARISON:
                return Comparator.EQUAL;
            case GREATER_OR_EQUAL_COMPARISON:
                return Comparator.GREATER_OR_EQUAL;
            case GREATER_COMPARISON:
                return Comparator.GREATER;
            default:
                return null;
        }
    }
}
