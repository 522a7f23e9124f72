package fr.uga.smtplan.solver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the answer of {@code (get-model)}: a list of {@code define-fun} entries, with or
 * without a leading {@code model} keyword. Boolean values and real values written as
 * decimals, negations, sums, products and quotients are understood; other entries are
 * ignored.
 */
public final class SmtModelParser {

    private static final Logger LOGGER = LogManager.getLogger(SmtModelParser.class.getName());

    private SmtModelParser() {
    }

    public static SolverModel parse(String text) {
        Map<String, Boolean> booleans = new HashMap<>();
        Map<String, Double> reals = new HashMap<>();
        for (Object expression : read(text)) {
            collect(expression, booleans, reals);
        }
        return new SolverModel(booleans, reals);
    }

    private static void collect(Object expression, Map<String, Boolean> booleans, Map<String, Double> reals) {
        if (!(expression instanceof List)) {
            return;
        }
        List<?> list = (List<?>) expression;
        if (list.size() == 5 && "define-fun".equals(list.get(0)) && list.get(1) instanceof String) {
            String name = unquote((String) list.get(1));
            Object sort = list.get(3);
            Object value = list.get(4);
            if ("Bool".equals(sort)) {
                booleans.put(name, "true".equals(value));
            } else if ("Real".equals(sort) || "Int".equals(sort)) {
                Double number = evaluate(value);
                if (number == null) {
                    LOGGER.debug("Ignoring value of {}: {}", name, value);
                } else {
                    reals.put(name, number);
                }
            }
            return;
        }
        for (Object child : list) {
            collect(child, booleans, reals);
        }
    }

    /**
     * Evaluates a numeral, decimal or arithmetic term over them.
     *
     * @return the value, or {@code null} if the term is not understood.
     */
    static Double evaluate(Object term) {
        if (term instanceof String) {
            try {
                return Double.valueOf((String) term);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        List<?> list = (List<?>) term;
        if (list.size() < 2 || !(list.get(0) instanceof String)) {
            return null;
        }
        List<Double> operands = new ArrayList<>();
        for (Object operand : list.subList(1, list.size())) {
            Double value = evaluate(operand);
            if (value == null) {
                return null;
            }
            operands.add(value);
        }
        double result = operands.get(0);
        switch ((String) list.get(0)) {
            case "-":
                if (operands.size() == 1) {
                    return -result;
                }
                for (double operand : operands.subList(1, operands.size())) {
                    result -= operand;
                }
                return result;
            case "+":
                for (double operand : operands.subList(1, operands.size())) {
                    result += operand;
                }
                return result;
            case "*":
                for (double operand : operands.subList(1, operands.size())) {
                    result *= operand;
                }
                return result;
            case "/":
                for (double operand : operands.subList(1, operands.size())) {
                    result /= operand;
                }
                return result;
            default:
                return null;
        }
    }

    /**
     * Splits a text into s-expressions: nested lists of atoms. Quoted symbols keep their bars.
     */
    public static List<Object> read(String text) {
        List<List<Object>> stack = new ArrayList<>();
        List<Object> top = new ArrayList<>();
        stack.add(top);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '(') {
                List<Object> list = new ArrayList<>();
                stack.get(stack.size() - 1).add(list);
                stack.add(list);
                i++;
            } else if (c == ')') {
                if (stack.size() > 1) {
                    stack.remove(stack.size() - 1);
                }
                i++;
            } else if (c == '|') {
                int close = text.indexOf('|', i + 1);
                int stop = close < 0 ? text.length() : close + 1;
                stack.get(stack.size() - 1).add(text.substring(i, stop));
                i = stop;
            } else {
                int start = i;
                while (i < text.length() && !Character.isWhitespace(text.charAt(i))
                    && text.charAt(i) != '(' && text.charAt(i) != ')') {
                    i++;
                }
                stack.get(stack.size() - 1).add(text.substring(start, i));
            }
        }
        return top;
    }

    private static String unquote(String symbol) {
        if (symbol.length() >= 2 && symbol.startsWith("|") && symbol.endsWith("|")) {
            return symbol.substring(1, symbol.length() - 1);
        }
        return symbol;
    }
}
