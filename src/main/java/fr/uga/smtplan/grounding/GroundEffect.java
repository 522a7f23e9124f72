package fr.uga.smtplan.grounding;

import java.util.List;

/**
 * The effects of an action at one of its end points.
 */
public final class GroundEffect {

    private static final GroundEffect EMPTY = new GroundEffect(List.of(), List.of(), List.of());

    private final List<Integer> adds;
    private final List<Integer> deletes;
    private final List<NumericEffect> numeric;

    public GroundEffect(List<Integer> adds, List<Integer> deletes, List<NumericEffect> numeric) {
        this.adds = List.copyOf(adds);
        this.deletes = List.copyOf(deletes);
        this.numeric = List.copyOf(numeric);
    }

    public static GroundEffect empty() {
        return EMPTY;
    }

    public List<Integer> getAdds() {
        return this.adds;
    }

    public List<Integer> getDeletes() {
        return this.deletes;
    }

    public List<NumericEffect> getNumeric() {
        return this.numeric;
    }

    public boolean isEmpty() {
        return this.adds.isEmpty() && this.deletes.isEmpty() && this.numeric.isEmpty();
    }

    @Override
    public String toString() {
        return "add" + this.adds + " del" + this.deletes + " num" + this.numeric;
    }
}
