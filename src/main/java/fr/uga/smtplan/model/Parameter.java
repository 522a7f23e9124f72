package fr.uga.smtplan.model;

import java.util.List;

/**
 * A typed variable of an action schema, predicate or function signature.
 */
public final class Parameter {

    private final String name;
    private final List<String> types;

    public Parameter(String name, List<String> types) {
        this.name = name;
        this.types = types.isEmpty() ? List.of(TypeHierarchy.OBJECT) : List.copyOf(types);
    }

    public Parameter(String name, String type) {
        this(name, List.of(type));
    }

    public String getName() {
        return this.name;
    }

    public List<String> getTypes() {
        return this.types;
    }

    /**
     * True iff the object may be bound to this parameter.
     */
    public boolean accepts(TypedObject object, TypeHierarchy hierarchy) {
        for (String type : this.types) {
            if (object.isOfType(type, hierarchy)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return this.name + " - " + String.join("|", this.types);
    }
}
