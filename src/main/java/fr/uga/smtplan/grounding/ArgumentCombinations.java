package fr.uga.smtplan.grounding;

import fr.uga.smtplan.model.Parameter;
import fr.uga.smtplan.model.TypeHierarchy;
import fr.uga.smtplan.model.TypedObject;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Tools for iterating over all argument combinations of a parameter list.
 */
public final class ArgumentCombinations {

    private ArgumentCombinations() {
    }

    /**
     * Given a list of possible values at each position, iterates over all combinations
     * in lexicographic order. An empty list of positions yields exactly one empty
     * combination; an empty position yields none.
     */
    public static final class Iterator<T> implements java.util.Iterator<List<T>> {

        private final List<List<T>> eligible;
        private final int[] current;
        private boolean hasNext;

        public Iterator(List<List<T>> eligible) {
            this.eligible = eligible;
            this.current = new int[eligible.size()];
            this.hasNext = true;
            for (List<T> values : eligible) {
                if (values.isEmpty()) {
                    this.hasNext = false;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return this.hasNext;
        }

        @Override
        public List<T> next() {
            if (!this.hasNext) {
                throw new NoSuchElementException();
            }
            List<T> values = new ArrayList<>(this.current.length);
            for (int pos = 0; pos < this.current.length; pos++) {
                values.add(this.eligible.get(pos).get(this.current[pos]));
            }

            // Advance the right-most position that still has options, reset the ones after it
            this.hasNext = false;
            for (int pos = this.current.length - 1; pos >= 0; pos--) {
                if (this.current[pos] + 1 < this.eligible.get(pos).size()) {
                    this.current[pos]++;
                    for (int after = pos + 1; after < this.current.length; after++) {
                        this.current[after] = 0;
                    }
                    this.hasNext = true;
                    break;
                }
            }
            return values;
        }
    }

    public static <T> Iterator<T> iterator(List<List<T>> eligible) {
        return new Iterator<>(eligible);
    }

    /**
     * For each parameter, the names of the objects whose type is compatible with it.
     */
    public static List<List<String>> eligibleObjects(List<Parameter> parameters, List<TypedObject> objects,
                                                     TypeHierarchy types) {
        List<List<String>> eligible = new ArrayList<>();
        for (Parameter parameter : parameters) {
            List<String> atPosition = new ArrayList<>();
            for (TypedObject object : objects) {
                if (parameter.accepts(object, types)) {
                    atPosition.add(object.getName());
                }
            }
            eligible.add(atPosition);
        }
        return eligible;
    }

    /**
     * The number of combinations the iterator would produce.
     */
    public static long count(List<? extends List<?>> eligible) {
        long count = 1;
        for (List<?> values : eligible) {
            count *= values.size();
        }
        return count;
    }
}
