package dev.automata.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Where a transition leads. Exactly one of two forms: a single state (deterministic kind)
 * or a set of states (nondeterministic kind).
 */
public sealed interface Target {

    /** All states this target names, in sorted order. */
    Set<String> states();

    /** Exactly one successor state. */
    record Single(String state) implements Target {
        @Override
        public Set<String> states() {
            return Collections.singleton(state);
        }
    }

    /** Zero or more successor states; immutable and sorted once built. */
    record Multiple(SortedSet<String> states) implements Target {
        public Multiple {
            states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        }

        public static Multiple of(Iterable<String> states) {
            var sorted = new TreeSet<String>();
            states.forEach(sorted::add);
            return new Multiple(sorted);
        }
    }
}
