package dev.automata.runtime;

import dev.automata.engine.MembershipValidator;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Nondeterministic automaton. Transitions on the empty symbol are epsilon moves and are
 * followed without consuming input.
 */
public final class NondeterministicAutomaton extends AbstractAutomaton {

    NondeterministicAutomaton(AutomatonDefinition definition) {
        super(definition);
        if (definition.kind() != Kind.NONDETERMINISTIC) {
            throw new IllegalArgumentException("Definition is not nondeterministic: " + definition.kind());
        }
    }

    @Override
    protected SortedSet<String> start() {
        var start = new TreeSet<String>();
        start.add(definition.initial());
        return closure(start);
    }

    @Override
    protected SortedSet<String> step(Set<String> current, String symbol) {
        return closure(move(current, symbol));
    }

    /** All states reachable from {@code states} through epsilon moves alone. */
    SortedSet<String> closure(Set<String> states) {
        var closed = new TreeSet<String>(states);
        Deque<String> pending = new ArrayDeque<>(states);
        while (!pending.isEmpty()) {
            String state = pending.pop();
            for (String next : definition.targets(state, MembershipValidator.EPSILON)) {
                if (closed.add(next)) {
                    pending.push(next);
                }
            }
        }
        return closed;
    }

    @Override
    public Automaton toDeterministic() {
        return new DeterministicAutomaton(SubsetConstruction.determinize(this));
    }

    @Override
    public Automaton canonicalize() {
        return toDeterministic().canonicalize();
    }
}
