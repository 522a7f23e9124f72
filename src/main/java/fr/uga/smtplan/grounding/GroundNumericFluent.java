package fr.uga.smtplan.grounding;

import java.util.List;
import java.util.Objects;

/**
 * A numeric function applied to objects. Its value is not stored here: the encoding
 * defines one value per state.
 */
public final class GroundNumericFluent {

    private final String function;
    private final List<String> arguments;

    public GroundNumericFluent(String function, List<String> arguments) {
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    public GroundNumericFluent(String function, String... arguments) {
        this(function, List.of(arguments));
    }

    public String getFunction() {
        return this.function;
    }

    public List<String> getArguments() {
        return this.arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroundNumericFluent)) {
            return false;
        }
        GroundNumericFluent other = (GroundNumericFluent) o;
        return this.function.equals(other.function) && this.arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.function, this.arguments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(this.function);
        this.arguments.forEach(a -> sb.append(' ').append(a));
        return sb.append(')').toString();
    }
}
