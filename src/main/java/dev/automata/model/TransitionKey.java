package dev.automata.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite (state, symbol) key indexing transition data.
 */
public record TransitionKey(String state, String symbol) implements Comparable<TransitionKey> {

    /** Separator between state and symbol in the persisted composite key. */
    public static final String SEPARATOR = ",";

    private static final Comparator<TransitionKey> ORDER =
        Comparator.comparing(TransitionKey::state).thenComparing(TransitionKey::symbol);

    public TransitionKey {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(symbol, "symbol");
    }

    public String toCompositeKey() {
        return state + SEPARATOR + symbol;
    }

    @Override
    public int compareTo(TransitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + symbol + ")";
    }
}
