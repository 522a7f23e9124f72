package fr.uga.smtplan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed planning domain. Immutable.
 */
public final class Domain {

    private final String name;
    private final TypeHierarchy types;
    private final List<TypedObject> constants;
    private final Map<String, Signature> predicates;
    private final Map<String, Signature> functions;
    private final List<ActionSchema> actions;

    public Domain(String name, TypeHierarchy types, List<TypedObject> constants, List<Signature> predicates,
                  List<Signature> functions, List<ActionSchema> actions) {
        this.name = name;
        this.types = types;
        this.constants = List.copyOf(constants);
        this.predicates = index(predicates);
        this.functions = index(functions);
        this.actions = List.copyOf(actions);
    }

    private static Map<String, Signature> index(List<Signature> signatures) {
        Map<String, Signature> map = new LinkedHashMap<>();
        for (Signature signature : signatures) {
            map.put(signature.getName(), signature);
        }
        return Collections.unmodifiableMap(map);
    }

    public String getName() {
        return this.name;
    }

    public TypeHierarchy getTypes() {
        return this.types;
    }

    public List<TypedObject> getConstants() {
        return this.constants;
    }

    public Map<String, Signature> getPredicates() {
        return this.predicates;
    }

    public Map<String, Signature> getFunctions() {
        return this.functions;
    }

    public List<ActionSchema> getActions() {
        return this.actions;
    }
}
