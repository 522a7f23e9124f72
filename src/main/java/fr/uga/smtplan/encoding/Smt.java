package fr.uga.smtplan.encoding;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for SMT-LIB 2 terms. Conjunctions and disjunctions absorb the constants
 * {@code true} and {@code false} and are rendered without the connective when at most one
 * operand remains.
 */
public final class Smt {

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    private Smt() {
    }

    public static String and(List<String> operands) {
        List<String> kept = new ArrayList<>();
        for (String operand : operands) {
            if (FALSE.equals(operand)) {
                return FALSE;
            } else if (!TRUE.equals(operand)) {
                kept.add(operand);
            }
        }
        if (kept.isEmpty()) {
            return TRUE;
        }
        return kept.size() == 1 ? kept.get(0) : apply("and", kept);
    }

    public static String or(List<String> operands) {
        List<String> kept = new ArrayList<>();
        for (String operand : operands) {
            if (TRUE.equals(operand)) {
                return TRUE;
            } else if (!FALSE.equals(operand)) {
                kept.add(operand);
            }
        }
        if (kept.isEmpty()) {
            return FALSE;
        }
        return kept.size() == 1 ? kept.get(0) : apply("or", kept);
    }

    public static String not(String operand) {
        if (TRUE.equals(operand)) {
            return FALSE;
        } else if (FALSE.equals(operand)) {
            return TRUE;
        }
        return "(not " + operand + ")";
    }

    /**
     * An implication, folded to {@code true} when it cannot fail and to the conclusion when
     * the premise is {@code true}.
     */
    public static String implies(String premise, String conclusion) {
        if (TRUE.equals(conclusion) || FALSE.equals(premise)) {
            return TRUE;
        } else if (TRUE.equals(premise)) {
            return conclusion;
        }
        return "(=> " + premise + " " + conclusion + ")";
    }

    public static String eq(String left, String right) {
        return "(= " + left + " " + right + ")";
    }

    public static String ite(String condition, String then, String otherwise) {
        return "(ite " + condition + " " + then + " " + otherwise + ")";
    }

    public static String apply(String function, List<String> operands) {
        StringBuilder sb = new StringBuilder("(").append(function);
        for (String operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.append(')').toString();
    }

    public static String apply(String function, String... operands) {
        return apply(function, List.of(operands));
    }

    /**
     * A real literal in decimal notation; negative values are written as {@code (- x)}.
     */
    public static String real(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Not a finite real: " + value);
        }
        String digits = BigDecimal.valueOf(Math.abs(value)).toPlainString();
        if (digits.indexOf('.') < 0) {
            digits = digits + ".0";
        }
        return value < 0 ? "(- " + digits + ")" : digits;
    }

    /**
     * Wraps a symbol in bars so that it may contain spaces and parentheses.
     */
    public static String quote(String symbol) {
        return "|" + symbol + "|";
    }

    /**
     * Removes the bars of a quoted symbol, leaving simple symbols unchanged.
     */
    public static String unquote(String symbol) {
        if (symbol.length() >= 2 && symbol.startsWith("|") && symbol.endsWith("|")) {
            return symbol.substring(1, symbol.length() - 1);
        }
        return symbol;
    }
}
