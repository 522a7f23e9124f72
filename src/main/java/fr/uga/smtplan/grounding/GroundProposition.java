package fr.uga.smtplan.grounding;

import java.util.List;
import java.util.Objects;

/**
 * A predicate applied to objects. Identity is structural.
 */
public final class GroundProposition {

    private final String predicate;
    private final List<String> arguments;

    public GroundProposition(String predicate, List<String> arguments) {
        this.predicate = predicate;
        this.arguments = List.copyOf(arguments);
    }

    public GroundProposition(String predicate, String... arguments) {
        this(predicate, List.of(arguments));
    }

    public String getPredicate() {
        return this.predicate;
    }

    public List<String> getArguments() {
        return this.arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroundProposition)) {
            return false;
        }
        GroundProposition other = (GroundProposition) o;
        return this.predicate.equals(other.predicate) && this.arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.predicate, this.arguments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(this.predicate);
        this.arguments.forEach(a -> sb.append(' ').append(a));
        return sb.append(')').toString();
    }
}
