package dev.automata.runtime;

import dev.automata.model.AutomatonDefinition;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs both kinds as a set simulation; subclasses decide how a configuration advances.
 */
abstract class AbstractAutomaton implements Automaton {

    protected final AutomatonDefinition definition;

    protected AbstractAutomaton(AutomatonDefinition definition) {
        this.definition = definition;
    }

    @Override
    public AutomatonDefinition definition() {
        return definition;
    }

    /** Configuration before any input is read. */
    protected abstract SortedSet<String> start();

    /** Configuration after reading {@code symbol} from {@code current}. */
    protected abstract SortedSet<String> step(Set<String> current, String symbol);

    @Override
    public boolean accepts(List<String> word) {
        StepCursor cursor = stepCursor();
        for (String symbol : word) {
            cursor.push(symbol);
        }
        return cursor.isAccepting();
    }

    @Override
    public StepCursor stepCursor() {
        return new Cursor(start());
    }

    protected SortedSet<String> move(Set<String> current, String symbol) {
        var next = new TreeSet<String>();
        for (String state : current) {
            next.addAll(definition.targets(state, symbol));
        }
        return next;
    }

    private void requireSymbol(String symbol) {
        if (!definition.alphabet().contains(symbol)) {
            throw new IllegalArgumentException(
                "Symbol '%s' not in alphabet %s".formatted(symbol, definition.alphabet()));
        }
    }

    private final class Cursor implements StepCursor {
        private SortedSet<String> current;

        private Cursor(SortedSet<String> current) {
            this.current = current;
        }

        @Override
        public Set<String> current() {
            return Collections.unmodifiableSet(current);
        }

        @Override
        public boolean isAccepting() {
            for (String state : current) {
                if (definition.isFinal(state)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void push(String symbol) {
            requireSymbol(symbol);
            current = step(current, symbol);
        }
    }
}
