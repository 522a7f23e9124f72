package fr.uga.smtplan.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The declared types of a domain together with their parent links. The root type
 * {@link #OBJECT} is always declared.
 */
public final class TypeHierarchy {

    public static final String OBJECT = "object";

    private final Map<String, List<String>> parents;

    /**
     * @param parents for each declared type, the list of its direct super types.
     */
    public TypeHierarchy(Map<String, List<String>> parents) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        copy.put(OBJECT, Collections.emptyList());
        parents.forEach((type, supers) -> {
            if (!OBJECT.equals(type)) {
                copy.put(type, List.copyOf(supers));
            }
        });
        this.parents = Collections.unmodifiableMap(copy);
    }

    public boolean isDeclared(String type) {
        return this.parents.containsKey(type);
    }

    public Set<String> getTypes() {
        return this.parents.keySet();
    }

    public List<String> getParents(String type) {
        return this.parents.getOrDefault(type, Collections.emptyList());
    }

    /**
     * True iff {@code type} equals {@code ancestor} or reaches it through parent links.
     * Every declared type is a subtype of {@link #OBJECT}.
     */
    public boolean isSubtype(String type, String ancestor) {
        if (type.equals(ancestor) || OBJECT.equals(ancestor)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> open = new ArrayDeque<>();
        open.push(type);
        while (!open.isEmpty()) {
            String current = open.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String parent : getParents(current)) {
                if (parent.equals(ancestor)) {
                    return true;
                }
                open.push(parent);
            }
        }
        return false;
    }
}
