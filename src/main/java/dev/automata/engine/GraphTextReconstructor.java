package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.GraphTextSyntax;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reconstructs an automaton from directed-graph text.
 * <p>
 * Recognized lines, each found by an independent scan so their order in the text does not
 * matter:
 * <ul>
 *   <li>{@code node [shape = doublecircle] q1 q2;} declares final states</li>
 *   <li>{@code q1 [shape = doublecircle];} declares a single final state</li>
 *   <li>{@code null -> q0;} designates the initial state (the sentinel never becomes a state)</li>
 *   <li>{@code a -> b [label = "0,1"];} adds one transition per label symbol</li>
 *   <li>{@code a -> b;} adds an unlabeled (epsilon) transition</li>
 * </ul>
 * Every other line is ignored. The result is classified nondeterministic when some
 * (source, symbol) pair reaches more than one distinct target; otherwise it is deterministic.
 * Quoted identifiers and labels may escape {@code "} and {@code \} with a backslash.
 */
public final class GraphTextReconstructor {

    private static final Logger logger = LogManager.getLogger(GraphTextReconstructor.class.getSimpleName());

    private static final String QUOTED = "\"(?:[^\"\\\\]|\\\\.)*\"";
    private static final String ID = "(" + QUOTED + "|[^\\s\\[\\];\"]+)";
    private static final Pattern EDGE =
        Pattern.compile("^" + ID + "\\s*->\\s*" + ID + "\\s*(?:\\[([^\\]]*)\\])?\\s*;?\\s*$");
    private static final Pattern NODE_DEFAULTS = Pattern.compile("^node\\s*\\[([^\\]]*)\\](.*)$");
    private static final Pattern NODE_ATTRIBUTES = Pattern.compile("^" + ID + "\\s*\\[([^\\]]*)\\]\\s*;?\\s*$");
    private static final Pattern SHAPE = Pattern.compile("shape\\s*=\\s*\"?([A-Za-z]+)\"?");
    private static final Pattern LABEL = Pattern.compile("label\\s*=\\s*(?:(" + QUOTED + ")|([^,\\]\\s]+))");
    private static final Pattern NODE_NAME = Pattern.compile(QUOTED + "|[^\\s;,\"]+");
    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");
    private static final Set<String> RESERVED_STATEMENTS = Set.of("node", "edge", "graph");

    private final GraphTextSyntax syntax;

    public GraphTextReconstructor(GraphTextSyntax syntax) {
        this.syntax = syntax;
    }

    public GraphTextReconstructor() {
        this(GraphTextSyntax.defaults());
    }

    /**
     * Reconstruct the raw definition described by {@code text}. The caller hands the result
     * to the assembler for cross-validation.
     */
    public RawDefinition reconstruct(String text) throws DefinitionException {
        var scan = new Scan();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i].trim(), i + 1, scan);
        }

        if (scan.initial == null) {
            throw new DefinitionException(Code.MISSING_INITIAL_STATE,
                "No initial state designation ('%s -> state') found in graph text".formatted(syntax.sentinel()));
        }
        scan.states.add(scan.initial);

        Kind kind = scan.sawBranching ? Kind.NONDETERMINISTIC : Kind.DETERMINISTIC;
        Map<TransitionKey, Target> transitions = finalizeTransitions(scan.targets, kind);

        logger.info("Reconstructed {} automaton with {} states, {} symbols, {} transition pairs",
            kind.code(), scan.states.size(), scan.alphabet.size(), transitions.size());
        return new RawDefinition(kind, scan.alphabet, scan.states, scan.initial, scan.finals, transitions);
    }

    private void scanLine(String line, int lineNumber, Scan scan) throws DefinitionException {
        if (line.isEmpty()) {
            return;
        }

        Matcher edge = EDGE.matcher(line);
        if (edge.matches()) {
            String source = unquote(edge.group(1));
            String target = unquote(edge.group(2));
            if (source.equals(syntax.sentinel())) {
                designateInitial(target, lineNumber, scan);
            } else {
                addEdge(source, target, edge.group(3), scan);
            }
            return;
        }

        Matcher defaults = NODE_DEFAULTS.matcher(line);
        if (defaults.matches()) {
            if (declaresFinal(defaults.group(1))) {
                Matcher name = NODE_NAME.matcher(defaults.group(2));
                while (name.find()) {
                    addFinal(unquote(name.group()), scan);
                }
            }
            return;
        }

        Matcher node = NODE_ATTRIBUTES.matcher(line);
        if (node.matches() && !RESERVED_STATEMENTS.contains(node.group(1))) {
            String name = unquote(node.group(1));
            if (declaresFinal(node.group(2)) && !name.equals(syntax.sentinel())) {
                addFinal(name, scan);
            }
            return;
        }

        logger.debug("Ignoring line {}: {}", lineNumber, line);
    }

    private void designateInitial(String target, int lineNumber, Scan scan) throws DefinitionException {
        if (scan.initial != null && !scan.initial.equals(target)) {
            throw new DefinitionException(Code.MALFORMED_RECORD,
                "Line %d: initial state already designated as '%s', cannot also be '%s'"
                    .formatted(lineNumber, scan.initial, target));
        }
        scan.initial = target;
    }

    private void addEdge(String source, String target, String attributes, Scan scan) {
        scan.states.add(source);
        scan.states.add(target);

        for (String symbol : labelSymbols(attributes)) {
            if (!MembershipValidator.isEpsilon(symbol)) {
                scan.alphabet.add(symbol);
            }
            List<String> targets = scan.targets.computeIfAbsent(new TransitionKey(source, symbol), k -> new ArrayList<>());
            targets.add(target);
            if (new LinkedHashSet<>(targets).size() > 1) {
                scan.sawBranching = true;
            }
        }
    }

    private void addFinal(String name, Scan scan) {
        if (name.isEmpty()) {
            return;
        }
        scan.finals.add(name);
        scan.states.add(name);
    }

    private boolean declaresFinal(String attributes) {
        Matcher shape = SHAPE.matcher(attributes);
        return shape.find() && shape.group(1).equals(syntax.finalShape());
    }

    private static List<String> labelSymbols(String attributes) {
        if (attributes == null) {
            return List.of(MembershipValidator.EPSILON);
        }
        Matcher label = LABEL.matcher(attributes);
        if (!label.find()) {
            return List.of(MembershipValidator.EPSILON);
        }
        String content = label.group(1) != null ? unquote(label.group(1)) : label.group(2);
        var symbols = new ArrayList<String>();
        for (String piece : content.split(",")) {
            String symbol = piece.trim();
            if (!symbol.isEmpty()) {
                symbols.add(symbol);
            }
        }
        return symbols.isEmpty() ? List.of(MembershipValidator.EPSILON) : symbols;
    }

    private static Map<TransitionKey, Target> finalizeTransitions(Map<TransitionKey, List<String>> gathered, Kind kind)
            throws DefinitionException {
        var transitions = new LinkedHashMap<TransitionKey, Target>();
        for (var entry : gathered.entrySet()) {
            Set<String> distinct = new LinkedHashSet<>(entry.getValue());
            if (kind == Kind.NONDETERMINISTIC) {
                transitions.put(entry.getKey(), Target.Multiple.of(distinct));
            } else if (distinct.size() != 1) {
                throw new DefinitionException(Code.INCONSISTENT_DETERMINISM,
                    "Deterministic transition %s leads to multiple states: %s"
                        .formatted(entry.getKey(), distinct));
            } else {
                transitions.put(entry.getKey(), new Target.Single(distinct.iterator().next()));
            }
        }
        return transitions;
    }

    private static String unquote(String id) {
        String trimmed = id.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return ESCAPE.matcher(trimmed.substring(1, trimmed.length() - 1)).replaceAll("$1");
        }
        return trimmed;
    }

    /** Accumulator for a single reconstruction. */
    private static final class Scan {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> finals = new LinkedHashSet<>();
        private final Map<TransitionKey, List<String>> targets = new LinkedHashMap<>();
        private String initial;
        private boolean sawBranching;
    }
}
