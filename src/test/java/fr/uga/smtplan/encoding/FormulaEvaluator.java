package fr.uga.smtplan.encoding;

import fr.uga.smtplan.solver.SmtModelParser;
import fr.uga.smtplan.solver.SolverModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the assertions of an emitted formula under a fixed assignment of its
 * variables. Boolean variables the assignment leaves out are false; real variables it
 * leaves out are NaN, which fails every comparison.
 */
public final class FormulaEvaluator {

    private static final double EPSILON = 1e-9;

    private final Map<String, String> sorts = new HashMap<>();
    private final List<Object> assertions = new ArrayList<>();

    public FormulaEvaluator(String formula) {
        for (Object expression : SmtModelParser.read(formula)) {
            if (!(expression instanceof List)) {
                continue;
            }
            List<?> list = (List<?>) expression;
            if ("declare-fun".equals(list.get(0))) {
                this.sorts.put(Smt.unquote((String) list.get(1)), (String) list.get(3));
            } else if ("assert".equals(list.get(0))) {
                this.assertions.add(list.get(1));
            }
        }
    }

    public int assertionCount() {
        return this.assertions.size();
    }

    /**
     * Returns the assertions that do not hold under the assignment, rendered as text.
     */
    public List<String> falsified(SolverModel assignment) {
        List<String> failed = new ArrayList<>();
        for (Object assertion : this.assertions) {
            if (!((Boolean) this.value(assertion, assignment))) {
                failed.add(render(assertion));
            }
        }
        return failed;
    }

    private Object value(Object term, SolverModel assignment) {
        if (term instanceof String) {
            return this.atom((String) term, assignment);
        }
        List<?> list = (List<?>) term;
        String operator = (String) list.get(0);
        List<?> operands = list.subList(1, list.size());
        switch (operator) {
            case "and":
                for (Object operand : operands) {
                    if (!this.bool(operand, assignment)) {
                        return false;
                    }
                }
                return true;
            case "or":
                for (Object operand : operands) {
                    if (this.bool(operand, assignment)) {
                        return true;
                    }
                }
                return false;
            case "not":
                return !this.bool(operands.get(0), assignment);
            case "=>":
                return !this.bool(operands.get(0), assignment) || this.bool(operands.get(1), assignment);
            case "ite":
                return this.bool(operands.get(0), assignment)
                    ? this.value(operands.get(1), assignment) : this.value(operands.get(2), assignment);
            case "=":
                return this.equal(this.value(operands.get(0), assignment), this.value(operands.get(1), assignment));
            case "<":
                return this.real(operands.get(0), assignment) < this.real(operands.get(1), assignment);
            case "<=":
                return this.real(operands.get(0), assignment) <= this.real(operands.get(1), assignment) + EPSILON;
            case ">":
                return this.real(operands.get(0), assignment) > this.real(operands.get(1), assignment);
            case ">=":
                return this.real(operands.get(0), assignment) + EPSILON >= this.real(operands.get(1), assignment);
            case "-":
                if (operands.size() == 1) {
                    return -this.real(operands.get(0), assignment);
                }
                return this.fold(operator, operands, assignment);
            case "+":
            case "*":
            case "/":
                return this.fold(operator, operands, assignment);
            default:
                throw new IllegalArgumentException("Unknown operator " + operator);
        }
    }

    private double fold(String operator, List<?> operands, SolverModel assignment) {
        double result = this.real(operands.get(0), assignment);
        for (Object operand : operands.subList(1, operands.size())) {
            double value = this.real(operand, assignment);
            switch (operator) {
                case "+":
                    result += value;
                    break;
                case "-":
                    result -= value;
                    break;
                case "*":
                    result *= value;
                    break;
                default:
                    result /= value;
                    break;
            }
        }
        return result;
    }

    private Object atom(String atom, SolverModel assignment) {
        if (Smt.TRUE.equals(atom)) {
            return true;
        } else if (Smt.FALSE.equals(atom)) {
            return false;
        }
        String name = Smt.unquote(atom);
        String sort = this.sorts.get(name);
        if ("Bool".equals(sort)) {
            return assignment.isTrue(name);
        } else if ("Real".equals(sort)) {
            Double value = assignment.getReal(name);
            return value == null ? Double.NaN : value;
        }
        return Double.valueOf(atom);
    }

    private boolean equal(Object left, Object right) {
        if (left instanceof Boolean) {
            return left.equals(right);
        }
        return Math.abs((Double) left - (Double) right) <= EPSILON;
    }

    private boolean bool(Object term, SolverModel assignment) {
        return (Boolean) this.value(term, assignment);
    }

    private double real(Object term, SolverModel assignment) {
        return (Double) this.value(term, assignment);
    }

    private static String render(Object term) {
        if (term instanceof String) {
            return (String) term;
        }
        List<String> parts = new ArrayList<>();
        for (Object child : (List<?>) term) {
            parts.add(render(child));
        }
        return "(" + String.join(" ", parts) + ")";
    }
}
