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
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reduces a deterministic definition: unreachable states are dropped, then states that no
 * input can tell apart are merged by partition refinement. A missing transition counts as
 * its own distinguishing outcome. Each merged block takes the name of its smallest state.
 */
final class DeterministicMinimizer {

    private static final Logger logger = LogManager.getLogger(DeterministicMinimizer.class.getSimpleName());

    private static final int NO_TRANSITION = -1;

    private DeterministicMinimizer() {}

    static AutomatonDefinition minimize(AutomatonDefinition dfa) {
        List<String> reachable = reachable(dfa);
        List<String> symbols = new ArrayList<>(dfa.alphabet());

        Map<String, Integer> block = new HashMap<>();
        for (String state : reachable) {
            block.put(state, dfa.isFinal(state) ? 1 : 0);
        }

        int blockCount = countBlocks(block);
        while (true) {
            Map<List<Integer>, Integer> signatures = new LinkedHashMap<>();
            Map<String, Integer> refined = new HashMap<>();
            for (String state : reachable) {
                List<Integer> signature = new ArrayList<>();
                signature.add(block.get(state));
                for (String symbol : symbols) {
                    String next = successor(dfa, state, symbol);
                    signature.add(next == null ? NO_TRANSITION : block.get(next));
                }
                Integer id = signatures.computeIfAbsent(signature, s -> signatures.size());
                refined.put(state, id);
            }
            block = refined;
            if (signatures.size() == blockCount) {
                break;
            }
            blockCount = signatures.size();
        }

        Map<Integer, String> blockNames = new HashMap<>();
        for (String state : new TreeSet<>(reachable)) {
            blockNames.putIfAbsent(block.get(state), state);
        }

        Set<String> states = new LinkedHashSet<>(blockNames.values());
        Set<String> finals = new LinkedHashSet<>();
        Map<TransitionKey, Target> transitions = new LinkedHashMap<>();
        for (String representative : states) {
            if (dfa.isFinal(representative)) {
                finals.add(representative);
            }
            for (String symbol : symbols) {
                String next = successor(dfa, representative, symbol);
                if (next != null) {
                    transitions.put(new TransitionKey(representative, symbol),
                        new Target.Single(blockNames.get(block.get(next))));
                }
            }
        }

        logger.debug("Minimized {} states ({} reachable) to {}", dfa.states().size(), reachable.size(), states.size());
        String initial = blockNames.get(block.get(dfa.initial()));
        var raw = new RawDefinition(Kind.DETERMINISTIC, dfa.alphabet(), states, initial, finals, transitions);
        try {
            return DefinitionAssembler.assemble(raw);
        } catch (DefinitionException e) {
            throw new IllegalStateException("Minimization produced an invalid definition", e);
        }
    }

    private static List<String> reachable(AutomatonDefinition dfa) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        seen.add(dfa.initial());
        pending.add(dfa.initial());
        while (!pending.isEmpty()) {
            String state = pending.poll();
            for (String symbol : dfa.alphabet()) {
                String next = successor(dfa, state, symbol);
                if (next != null && seen.add(next)) {
                    pending.add(next);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    private static String successor(AutomatonDefinition dfa, String state, String symbol) {
        Set<String> targets = dfa.targets(state, symbol);
        return targets.isEmpty() ? null : targets.iterator().next();
    }

    private static int countBlocks(Map<String, Integer> block) {
        return new LinkedHashSet<>(block.values()).size();
    }
}
