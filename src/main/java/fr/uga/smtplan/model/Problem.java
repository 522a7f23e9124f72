package fr.uga.smtplan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed planning problem: objects, initial state and goal. Immutable.
 */
public final class Problem {

    private final String name;
    private final List<TypedObject> objects;
    private final List<Atom> initialFacts;
    private final Map<Atom, Double> initialValues;
    private final Expression goal;

    public Problem(String name, List<TypedObject> objects, List<Atom> initialFacts, Map<Atom, Double> initialValues,
                   Expression goal) {
        this.name = name;
        this.objects = List.copyOf(objects);
        this.initialFacts = List.copyOf(initialFacts);
        this.initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
        this.goal = goal;
    }

    public String getName() {
        return this.name;
    }

    public List<TypedObject> getObjects() {
        return this.objects;
    }

    public List<Atom> getInitialFacts() {
        return this.initialFacts;
    }

    public Map<Atom, Double> getInitialValues() {
        return this.initialValues;
    }

    public Expression getGoal() {
        return this.goal;
    }
}
