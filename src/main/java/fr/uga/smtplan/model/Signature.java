package fr.uga.smtplan.model;

import java.util.List;

/**
 * The declaration of a predicate or numeric function.
 */
public final class Signature {

    private final String name;
    private final List<Parameter> parameters;

    public Signature(String name, List<Parameter> parameters) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
    }

    public String getName() {
        return this.name;
    }

    public List<Parameter> getParameters() {
        return this.parameters;
    }

    public int arity() {
        return this.parameters.size();
    }

    @Override
    public String toString() {
        return "(" + this.name + (this.parameters.isEmpty() ? "" : " " + this.parameters) + ")";
    }
}
