package dev.automata.model;

import java.util.Map;
import java.util.Set;

/**
 * Builder output that has not yet been cross-validated. Only the assembler turns this
 * into an {@link AutomatonDefinition}.
 */
public record RawDefinition(
    Kind kind,
    Set<String> alphabet,
    Set<String> states,
    String initial, // nullable until validated
    Set<String> finals,
    Map<TransitionKey, Target> transitions
) {}
