package dev.automata.runtime;

import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Deterministic automaton over a possibly partial transition function. Reading a symbol
 * with no transition leaves the automaton in no state, which rejects.
 */
public final class DeterministicAutomaton extends AbstractAutomaton {

    DeterministicAutomaton(AutomatonDefinition definition) {
        super(definition);
        if (definition.kind() != Kind.DETERMINISTIC) {
            throw new IllegalArgumentException("Definition is not deterministic: " + definition.kind());
        }
    }

    @Override
    protected SortedSet<String> start() {
        var start = new TreeSet<String>();
        start.add(definition.initial());
        return start;
    }

    @Override
    protected SortedSet<String> step(Set<String> current, String symbol) {
        return move(current, symbol);
    }

    @Override
    public Automaton toDeterministic() {
        return this;
    }

    @Override
    public Automaton canonicalize() {
        return new DeterministicAutomaton(DeterministicMinimizer.minimize(definition));
    }
}
