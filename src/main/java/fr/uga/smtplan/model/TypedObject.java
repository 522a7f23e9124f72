package fr.uga.smtplan.model;

import java.util.List;

/**
 * A domain constant or problem object with its declared types. More than one type
 * stands for an {@code either} declaration.
 */
public final class TypedObject {

    private final String name;
    private final List<String> types;

    public TypedObject(String name, List<String> types) {
        this.name = name;
        this.types = types.isEmpty() ? List.of(TypeHierarchy.OBJECT) : List.copyOf(types);
    }

    public TypedObject(String name, String type) {
        this(name, List.of(type));
    }

    public String getName() {
        return this.name;
    }

    public List<String> getTypes() {
        return this.types;
    }

    /**
     * True iff one of the declared types of this object is {@code type} or one of its subtypes.
     */
    public boolean isOfType(String type, TypeHierarchy hierarchy) {
        for (String own : this.types) {
            if (hierarchy.isSubtype(own, type)) {
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
