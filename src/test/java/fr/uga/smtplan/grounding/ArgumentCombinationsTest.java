package fr.uga.smtplan.grounding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fr.uga.smtplan.model.Parameter;
import fr.uga.smtplan.model.TypeHierarchy;
import fr.uga.smtplan.model.TypedObject;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArgumentCombinationsTest {

    @Test
    public void iteratesTheCartesianProduct() {
        List<List<String>> eligible = List.of(List.of("a", "b"), List.of("1", "2", "3"));
        ArgumentCombinations.Iterator<String> it = ArgumentCombinations.iterator(eligible);
        List<List<String>> all = new ArrayList<>();
        while (it.hasNext()) {
            all.add(it.next());
        }

        assertEquals(6, all.size());
        assertTrue(all.contains(List.of("a", "1")));
        assertTrue(all.contains(List.of("b", "3")));
        assertEquals(6, ArgumentCombinations.count(eligible));
    }

    @Test
    public void emptyDomainHasNoCombination() {
        List<List<String>> eligible = List.of(List.of("a"), List.of());
        ArgumentCombinations.Iterator<String> it = ArgumentCombinations.iterator(eligible);

        assertFalse(it.hasNext());
        assertEquals(0, ArgumentCombinations.count(eligible));
    }

    @Test
    public void eligibleObjectsIncludeSubtypes() {
        Map<String, List<String>> parents = new LinkedHashMap<>();
        parents.put("vehicle", List.of(TypeHierarchy.OBJECT));
        parents.put("truck", List.of("vehicle"));
        parents.put("place", List.of(TypeHierarchy.OBJECT));
        TypeHierarchy types = new TypeHierarchy(parents);
        List<TypedObject> objects = List.of(new TypedObject("t1", "truck"), new TypedObject("v1", "vehicle"),
            new TypedObject("p1", "place"));

        List<List<String>> eligible = ArgumentCombinations.eligibleObjects(
            List.of(new Parameter("?v", "vehicle"), new Parameter("?t", "truck"), new Parameter("?o", "object")),
            objects, types);

        assertEquals(List.of("t1", "v1"), eligible.get(0));
        assertEquals(List.of("t1"), eligible.get(1));
        assertEquals(3, eligible.get(2).size());
    }
}
