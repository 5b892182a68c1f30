package dev.automata.runtime;

import dev.automata.engine.DefinitionAssembler;
import dev.automata.engine.DefinitionException;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Subset construction over the reachable subsets of a nondeterministic automaton.
 * Each subset becomes a state named {@code {a|b}}; the empty subset is kept as an explicit
 * dead state {@code {}} when reached.
 */
final class SubsetConstruction {

    private static final Logger logger = LogManager.getLogger(SubsetConstruction.class.getSimpleName());

    private static final String MEMBER_SEPARATOR = "|";

    private SubsetConstruction() {}

    static AutomatonDefinition determinize(NondeterministicAutomaton nfa) {
        AutomatonDefinition source = nfa.definition();
        Map<SortedSet<String>, String> names = new HashMap<>();
        Deque<SortedSet<String>> pending = new ArrayDeque<>();

        Set<String> states = new LinkedHashSet<>();
        Set<String> finals = new LinkedHashSet<>();
        Map<TransitionKey, Target> transitions = new LinkedHashMap<>();

        SortedSet<String> start = nfa.start();
        String initial = name(start);
        names.put(start, initial);
        pending.push(start);

        while (!pending.isEmpty()) {
            SortedSet<String> subset = pending.pop();
            String subsetName = names.get(subset);
            states.add(subsetName);
            if (subset.stream().anyMatch(source::isFinal)) {
                finals.add(subsetName);
            }

            for (String symbol : source.alphabet()) {
                SortedSet<String> successor = nfa.step(subset, symbol);
                String successorName = names.get(successor);
                if (successorName == null) {
                    successorName = name(successor);
                    names.put(successor, successorName);
                    pending.push(successor);
                }
                transitions.put(new TransitionKey(subsetName, symbol), new Target.Single(successorName));
            }
        }

        logger.debug("Determinized {} states into {} subsets", source.states().size(), states.size());
        var raw = new RawDefinition(Kind.DETERMINISTIC, source.alphabet(), states, initial, finals, transitions);
        try {
            return DefinitionAssembler.assemble(raw);
        } catch (DefinitionException e) {
            throw new IllegalStateException("Subset construction produced an invalid definition", e);
        }
    }

    private static String name(Set<String> subset) {
        return "{" + String.join(MEMBER_SEPARATOR, subset) + "}";
    }
}
