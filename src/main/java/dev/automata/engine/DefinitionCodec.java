package dev.automata.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Encodes definitions to the persisted JSON record and back.
 * <p>
 * Record shape:
 * <pre>
 * {
 *   "kind": "dfa" | "nfa",
 *   "alphabet": ["0", "1"],
 *   "states": ["q0", "q1"],
 *   "initial": "q0",
 *   "final": ["q1"],
 *   "transitions": { "q0,1": "q1" }          (dfa)
 *   "transitions": { "q0,1": ["q0", "q1"] }  (nfa)
 * }
 * </pre>
 * Older records name the kind field {@code type}; both are accepted on decode.
 */
public final class DefinitionCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final String KIND = "kind";
    private static final String LEGACY_KIND = "type";
    private static final String ALPHABET = "alphabet";
    private static final String STATES = "states";
    private static final String INITIAL = "initial";
    private static final String FINAL = "final";
    private static final String TRANSITIONS = "transitions";

    private DefinitionCodec() {}

    public static ObjectNode encode(AutomatonDefinition definition) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(KIND, definition.kind().code());
        definition.alphabet().forEach(root.putArray(ALPHABET)::add);
        definition.states().forEach(root.putArray(STATES)::add);
        root.put(INITIAL, definition.initial());
        definition.finals().forEach(root.putArray(FINAL)::add);

        ObjectNode transitions = root.putObject(TRANSITIONS);
        for (var entry : definition.transitions().entrySet()) {
            String key = entry.getKey().toCompositeKey();
            if (entry.getValue() instanceof Target.Single single) {
                transitions.put(key, single.state());
            } else {
                ArrayNode targets = transitions.putArray(key);
                entry.getValue().states().forEach(targets::add);
            }
        }
        return root;
    }

    public static AutomatonDefinition decode(JsonNode root) throws DefinitionException {
        if (root == null || !root.isObject()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Automaton record must be a JSON object");
        }
        Kind kind = parseKind(root);
        Set<String> alphabet = stringSet(root, ALPHABET);
        Set<String> states = stringSet(root, STATES);
        Set<String> finals = stringSet(root, FINAL);
        JsonNode initialNode = required(root, INITIAL);
        if (!initialNode.isTextual()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Field 'initial' must be a string");
        }

        JsonNode transitionsNode = required(root, TRANSITIONS);
        if (!transitionsNode.isObject()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Field 'transitions' must be an object");
        }
        Map<TransitionKey, Target> transitions = new LinkedHashMap<>();
        for (var entry : transitionsNode.properties()) {
            TransitionKey key = splitKey(entry.getKey());
            transitions.put(key, parseTarget(key, entry.getValue(), kind));
        }

        var raw = new RawDefinition(kind, alphabet, states, initialNode.asText(), finals, transitions);
        return DefinitionAssembler.assemble(raw);
    }

    /**
     * Split a composite key at its first separator.
     */
    public static TransitionKey splitKey(String compositeKey) throws DefinitionException {
        int separator = compositeKey.indexOf(TransitionKey.SEPARATOR);
        if (separator <= 0) {
            throw new DefinitionException(Code.MALFORMED_KEY,
                "Transition key '%s' is not of the form 'state,symbol'".formatted(compositeKey));
        }
        return new TransitionKey(
            compositeKey.substring(0, separator),
            compositeKey.substring(separator + TransitionKey.SEPARATOR.length())
        );
    }

    public static String toJson(AutomatonDefinition definition) {
        try {
            return MAPPER.writeValueAsString(encode(definition));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize automaton definition", e);
        }
    }

    public static void writeToFile(AutomatonDefinition definition, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), encode(definition));
    }

    public static AutomatonDefinition loadFromFile(Path path) throws IOException, DefinitionException {
        return decode(MAPPER.readTree(path.toFile()));
    }

    public static AutomatonDefinition loadFromString(String json) throws IOException, DefinitionException {
        return decode(MAPPER.readTree(json));
    }

    private static Kind parseKind(JsonNode root) throws DefinitionException {
        JsonNode node = root.has(KIND) ? root.get(KIND) : root.get(LEGACY_KIND);
        if (node == null || !node.isTextual()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Missing or non-string 'kind' field");
        }
        try {
            return Kind.fromCode(node.asText());
        } catch (IllegalArgumentException e) {
            throw new DefinitionException(Code.MALFORMED_RECORD, e.getMessage(), e);
        }
    }

    private static Target parseTarget(TransitionKey key, JsonNode value, Kind kind) throws DefinitionException {
        if (kind == Kind.DETERMINISTIC) {
            if (!value.isTextual()) {
                throw new DefinitionException(Code.MALFORMED_RECORD,
                    "Deterministic transition %s must map to a single state, got %s".formatted(key, value));
            }
            return new Target.Single(value.asText());
        }
        if (!value.isArray() || value.isEmpty()) {
            throw new DefinitionException(Code.MALFORMED_RECORD,
                "Nondeterministic transition %s must map to a non-empty list of states, got %s".formatted(key, value));
        }
        var targets = new LinkedHashSet<String>();
        for (JsonNode element : value) {
            targets.add(element.asText());
        }
        return Target.Multiple.of(targets);
    }

    private static Set<String> stringSet(JsonNode root, String field) throws DefinitionException {
        JsonNode node = required(root, field);
        if (!node.isArray()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Field '%s' must be a list".formatted(field));
        }
        var values = new LinkedHashSet<String>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static JsonNode required(JsonNode root, String field) throws DefinitionException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new DefinitionException(Code.MALFORMED_RECORD, "Missing '%s' field".formatted(field));
        }
        return node;
    }
}
