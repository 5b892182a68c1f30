package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.Kind;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a transition table from flat {@code state,symbol,target...} records.
 * <p>
 * Deterministic records carry exactly one target and may not repeat a (state, symbol) pair.
 * Nondeterministic records carry one or more targets; repeated pairs are merged by set union.
 * The build stops at the first invalid record and returns nothing.
 */
public final class FlatTransitionBuilder {

    private static final Logger logger = LogManager.getLogger(FlatTransitionBuilder.class.getSimpleName());

    private static final String FIELD_SEPARATOR = ",";

    private FlatTransitionBuilder() {}

    public static Map<TransitionKey, Target> build(List<String> records, Set<String> alphabet,
                                                   Set<String> states, Kind kind)
            throws DefinitionException {
        return switch (kind) {
            case DETERMINISTIC -> buildDeterministic(records, alphabet, states);
            case NONDETERMINISTIC -> buildNondeterministic(records, alphabet, states);
        };
    }

    private static Map<TransitionKey, Target> buildDeterministic(List<String> records, Set<String> alphabet,
                                                                 Set<String> states)
            throws DefinitionException {
        var table = new LinkedHashMap<TransitionKey, Target>();
        for (String record : records) {
            List<String> fields = split(record);
            if (fields.size() != 3) {
                throw new DefinitionException(Code.MALFORMED_RECORD,
                    "Invalid deterministic transition '%s'. Expected 'state,symbol,next_state'"
                        .formatted(record));
            }
            String context = "Transition '%s'".formatted(record);
            String state = fields.get(0);
            String symbol = fields.get(1);
            String next = fields.get(2);

            MembershipValidator.requireState(state, states, context);
            MembershipValidator.requireSymbol(symbol, alphabet, context);
            MembershipValidator.requireState(next, states, context);

            var key = new TransitionKey(state, symbol);
            if (table.containsKey(key)) {
                throw new DefinitionException(Code.DUPLICATE_TRANSITION,
                    "Duplicate deterministic transition for %s in '%s'. Deterministic transitions must be unique"
                        .formatted(key, record));
            }
            table.put(key, new Target.Single(next));
            logger.debug("{} -> {}", key, next);
        }
        logger.info("Built deterministic table with {} transitions from {} records", table.size(), records.size());
        return table;
    }

    private static Map<TransitionKey, Target> buildNondeterministic(List<String> records, Set<String> alphabet,
                                                                    Set<String> states)
            throws DefinitionException {
        var accumulated = new LinkedHashMap<TransitionKey, Set<String>>();
        for (String record : records) {
            List<String> fields = split(record);
            if (fields.size() < 3) {
                throw new DefinitionException(Code.MALFORMED_RECORD,
                    "Invalid nondeterministic transition '%s'. Expected 'state,symbol,next_state1,next_state2,...'"
                        .formatted(record));
            }
            String context = "Transition '%s'".formatted(record);
            String state = fields.get(0);
            String symbol = fields.get(1);
            List<String> targets = fields.subList(2, fields.size());

            MembershipValidator.requireState(state, states, context);
            if (!MembershipValidator.isEpsilon(symbol)) {
                MembershipValidator.requireSymbol(symbol, alphabet, context);
            }
            for (String next : targets) {
                MembershipValidator.requireState(next, states, context);
            }

            var key = new TransitionKey(state, symbol);
            accumulated.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(targets);
            logger.debug("{} -> {}", key, accumulated.get(key));
        }

        var relation = new LinkedHashMap<TransitionKey, Target>();
        accumulated.forEach((key, targets) -> relation.put(key, Target.Multiple.of(targets)));
        logger.info("Built nondeterministic relation with {} pairs from {} records", relation.size(), records.size());
        return relation;
    }

    private static List<String> split(String record) {
        var fields = new ArrayList<String>();
        for (String field : record.split(FIELD_SEPARATOR, -1)) {
            fields.add(field.trim());
        }
        return fields;
    }
}
