package dev.automata.runtime;

import java.util.Set;

/**
 * Mutable handle for feeding an automaton one symbol at a time.
 */
public interface StepCursor {

    /**
     * States the automaton is currently in. A deterministic automaton is in at most one;
     * an empty set means the input has fallen off the transition table.
     */
    Set<String> current();

    boolean isAccepting();

    /**
     * @throws IllegalArgumentException if the symbol is not in the alphabet
     */
    void push(String symbol);
}
