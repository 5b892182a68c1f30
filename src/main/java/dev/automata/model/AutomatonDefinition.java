package dev.automata.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * The fully validated, immutable structural description of an automaton.
 * Instances are only produced by the definition assembler.
 */
public record AutomatonDefinition(
    Kind kind,
    SortedSet<String> alphabet,
    SortedSet<String> states,
    String initial,
    SortedSet<String> finals,
    SortedMap<TransitionKey, Target> transitions
) {

    /** Successor states for a pair, or an empty set when the pair has no transition. */
    public Set<String> targets(String state, String symbol) {
        Target target = transitions.get(new TransitionKey(state, symbol));
        return target == null ? Collections.emptySet() : target.states();
    }

    public boolean isFinal(String state) {
        return finals.contains(state);
    }
}
