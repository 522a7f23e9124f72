package fr.uga.smtplan.model;

import java.util.List;
import java.util.Objects;

/**
 * A predicate or function symbol applied to terms. A term starting with {@code ?} is a
 * variable, any other term names an object.
 */
public final class Atom {

    private final String symbol;
    private final List<String> arguments;

    public Atom(String symbol, List<String> arguments) {
        this.symbol = symbol;
        this.arguments = List.copyOf(arguments);
    }

    public Atom(String symbol, String... arguments) {
        this(symbol, List.of(arguments));
    }

    public static boolean isVariable(String term) {
        return term.startsWith("?");
    }

    public String getSymbol() {
        return this.symbol;
    }

    public List<String> getArguments() {
        return this.arguments;
    }

    public int arity() {
        return this.arguments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Atom)) {
            return false;
        }
        Atom other = (Atom) o;
        return this.symbol.equals(other.symbol) && this.arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.symbol, this.arguments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(this.symbol);
        for (String argument : this.arguments) {
            sb.append(' ').append(argument);
        }
        return sb.append(')').toString();
    }
}
