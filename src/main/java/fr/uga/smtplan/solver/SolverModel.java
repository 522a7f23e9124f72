package fr.uga.smtplan.solver;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The boolean and real values a solver assigned to the variables of a satisfiable formula.
 * Variable names are stored without the bars of quoted symbols.
 */
public final class SolverModel {

    private static final SolverModel EMPTY = new SolverModel(Map.of(), Map.of());

    private final Map<String, Boolean> booleans;
    private final Map<String, Double> reals;

    public SolverModel(Map<String, Boolean> booleans, Map<String, Double> reals) {
        this.booleans = Collections.unmodifiableMap(new HashMap<>(booleans));
        this.reals = Collections.unmodifiableMap(new HashMap<>(reals));
    }

    public static SolverModel empty() {
        return EMPTY;
    }

    /**
     * The value of a boolean variable, false if the model does not mention it.
     */
    public boolean isTrue(String variable) {
        return this.booleans.getOrDefault(variable, Boolean.FALSE);
    }

    /**
     * The value of a real variable, or {@code null} if the model does not mention it.
     */
    public Double getReal(String variable) {
        return this.reals.get(variable);
    }

    public boolean isEmpty() {
        return this.booleans.isEmpty() && this.reals.isEmpty();
    }

    public int size() {
        return this.booleans.size() + this.reals.size();
    }
}
