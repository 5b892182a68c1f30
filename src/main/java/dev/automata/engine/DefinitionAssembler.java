package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns builder output into a finished {@link AutomatonDefinition}.
 * <p>
 * States and alphabet are the union of what was declared and what the builder discovered.
 * Every invariant is then checked against that union: the initial state and all final states
 * are states, every transition endpoint is a state and every transition symbol is in the
 * alphabet (the epsilon symbol is allowed for the nondeterministic kind only). The first
 * violation aborts the assembly.
 */
public final class DefinitionAssembler {

    private static final Logger logger = LogManager.getLogger(DefinitionAssembler.class.getSimpleName());

    private DefinitionAssembler() {}

    public static AutomatonDefinition assemble(RawDefinition raw) throws DefinitionException {
        return assemble(raw, Set.of(), Set.of());
    }

    public static AutomatonDefinition assemble(RawDefinition raw, Set<String> declaredAlphabet,
                                               Set<String> declaredStates) throws DefinitionException {
        if (raw.kind() == null) {
            throw new DefinitionException(Code.INTERNAL_ERROR, "Definition has no kind");
        }
        SortedSet<String> alphabet = union(declaredAlphabet, raw.alphabet());
        SortedSet<String> states = union(declaredStates, raw.states());

        for (String symbol : alphabet) {
            if (MembershipValidator.isEpsilon(symbol)) {
                throw new DefinitionException(Code.UNKNOWN_SYMBOL,
                    "Alphabet %s contains the empty symbol, which is reserved for unlabeled transitions"
                        .formatted(alphabet));
            }
        }

        for (String state : states) {
            if (state.contains(TransitionKey.SEPARATOR)) {
                throw new DefinitionException(Code.MALFORMED_RECORD,
                    "State name '%s' contains the transition key separator '%s'"
                        .formatted(state, TransitionKey.SEPARATOR));
            }
        }

        if (raw.initial() == null) {
            throw new DefinitionException(Code.MISSING_INITIAL_STATE);
        }
        MembershipValidator.requireState(raw.initial(), states, "Initial state");

        SortedSet<String> finals = union(raw.finals(), Set.of());
        for (String state : finals) {
            MembershipValidator.requireState(state, states, "Final state");
        }

        SortedMap<TransitionKey, Target> transitions = new TreeMap<>();
        for (var entry : raw.transitions().entrySet()) {
            TransitionKey key = entry.getKey();
            Target target = checkTarget(key, entry.getValue(), raw.kind());
            String context = "Transition " + key;

            MembershipValidator.requireState(key.state(), states, context);
            if (!(raw.kind() == Kind.NONDETERMINISTIC && MembershipValidator.isEpsilon(key.symbol()))) {
                MembershipValidator.requireSymbol(key.symbol(), alphabet, context);
            }
            for (String next : target.states()) {
                MembershipValidator.requireState(next, states, context);
            }
            transitions.put(key, target);
        }

        logger.debug("Assembled {} definition: states={} alphabet={} initial={} final={}",
            raw.kind().code(), states, alphabet, raw.initial(), finals);
        return new AutomatonDefinition(
            raw.kind(),
            alphabet,
            states,
            raw.initial(),
            finals,
            Collections.unmodifiableSortedMap(transitions)
        );
    }

    private static Target checkTarget(TransitionKey key, Target target, Kind kind) throws DefinitionException {
        if (target == null) {
            throw new DefinitionException(Code.INTERNAL_ERROR, "Transition %s has no target".formatted(key));
        }
        if (kind == Kind.DETERMINISTIC) {
            if (!(target instanceof Target.Single)) {
                throw new DefinitionException(Code.INTERNAL_ERROR,
                    "Deterministic transition %s has a set-valued target %s".formatted(key, target.states()));
            }
            return target;
        }
        if (!(target instanceof Target.Multiple) || target.states().isEmpty()) {
            throw new DefinitionException(Code.INTERNAL_ERROR,
                "Nondeterministic transition %s must target a non-empty set, got %s".formatted(key, target));
        }
        return target;
    }

    private static SortedSet<String> union(Set<String> first, Set<String> second) {
        var merged = new TreeSet<String>(first);
        merged.addAll(second);
        return Collections.unmodifiableSortedSet(merged);
    }
}
