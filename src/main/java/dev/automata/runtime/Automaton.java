package dev.automata.runtime;

import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;

import java.util.List;

/**
 * An executable automaton built from a validated definition.
 */
public interface Automaton {

    AutomatonDefinition definition();

    default Kind kind() {
        return definition().kind();
    }

    /**
     * Run the whole word and report whether it ends in a final state.
     *
     * @throws IllegalArgumentException if the word contains a symbol outside the alphabet
     */
    boolean accepts(List<String> word);

    /** An equivalent deterministic automaton; deterministic automata return themselves. */
    Automaton toDeterministic();

    /** An equivalent deterministic automaton with unreachable states removed and equivalent states merged. */
    Automaton canonicalize();

    /** A fresh incremental-execution handle positioned at the initial state. */
    StepCursor stepCursor();
}
