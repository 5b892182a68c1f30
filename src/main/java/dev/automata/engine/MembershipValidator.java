package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;

import java.util.Collection;
import java.util.Set;

/**
 * Membership predicates shared by every builder, so that failures read the same
 * whichever input path produced them.
 */
public final class MembershipValidator {

    /** The unlabeled symbol. Never part of an alphabet. */
    public static final String EPSILON = "";

    private MembershipValidator() {}

    public static boolean stateExists(String state, Set<String> states) {
        return state != null && states.contains(state);
    }

    public static boolean symbolExists(String symbol, Set<String> alphabet) {
        return symbol != null && alphabet.contains(symbol);
    }

    public static boolean allIn(Collection<String> values, Set<String> set) {
        for (String value : values) {
            if (value == null || !set.contains(value)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isEpsilon(String symbol) {
        return EPSILON.equals(symbol);
    }

    /**
     * @param context what referenced the state, e.g. a record or "initial state"
     */
    public static void requireState(String state, Set<String> states, String context)
            throws DefinitionException {
        if (!stateExists(state, states)) {
            throw new DefinitionException(Code.UNKNOWN_STATE,
                "%s: state '%s' is not defined in states %s".formatted(context, state, states));
        }
    }

    public static void requireSymbol(String symbol, Set<String> alphabet, String context)
            throws DefinitionException {
        if (!symbolExists(symbol, alphabet)) {
            throw new DefinitionException(Code.UNKNOWN_SYMBOL,
                "%s: symbol '%s' is not defined in alphabet %s".formatted(context, symbol, alphabet));
        }
    }
}
