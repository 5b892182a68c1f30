package dev.automata.runtime;

import dev.automata.model.AutomatonDefinition;

/**
 * Instantiates the executable form of a definition, chosen by its kind tag.
 */
public final class AutomatonFactory {

    private AutomatonFactory() {}

    public static Automaton instantiate(AutomatonDefinition definition) {
        return switch (definition.kind()) {
            case DETERMINISTIC -> new DeterministicAutomaton(definition);
            case NONDETERMINISTIC -> new NondeterministicAutomaton(definition);
        };
    }
}
