package dev.automata.cli;

import dev.automata.engine.DefinitionCodec;
import dev.automata.engine.DefinitionException;
import dev.automata.engine.DefinitionPipeline;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.GraphTextSyntax;
import dev.automata.model.Kind;
import dev.automata.render.DotRenderer;
import dev.automata.runtime.Automaton;
import dev.automata.runtime.AutomatonFactory;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: build an automaton from one source, optionally transform, save and test it.
 */
@Command(
    name = "automata",
    mixinStandardHelpOptions = true,
    description = "Create, reconstruct, persist and test finite state automata."
)
public class AutomataCli implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(AutomataCli.class.getSimpleName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = "--type", description = "Automaton type for an inline definition: dfa or nfa")
    private String type;

    @Option(names = "--alphabet", description = "Comma-separated alphabet symbols, e.g. '0,1'")
    private String alphabet;

    @Option(names = "--states", description = "Comma-separated state names, e.g. 'q0,q1,q2'")
    private String states;

    @Option(names = "--initial", description = "Initial state")
    private String initial;

    @Option(names = "--final", description = "Comma-separated final states")
    private String finals;

    @Option(names = "--transitions", arity = "1..*",
        description = "Transitions 'state,symbol,next_state'; nfa transitions may list several next states")
    private List<String> transitions;

    @Option(names = "--load-from", description = "Load the automaton from a JSON file")
    private Path loadFrom;

    @Option(names = "--dot-file", description = "Reconstruct the automaton from a graph description file")
    private Path dotFile;

    @Option(names = "--sentinel",
        description = "Pseudostate that marks the initial state in graph text (default: "
            + GraphTextSyntax.DEFAULT_SENTINEL + ")")
    private String sentinel = GraphTextSyntax.DEFAULT_SENTINEL;

    @Option(names = "--to-dfa", description = "Convert to an equivalent deterministic automaton")
    private boolean toDfa;

    @Option(names = "--minimize", description = "Reduce to the canonical minimal deterministic automaton")
    private boolean minimize;

    @Option(names = "--save-to", description = "Save the automaton to a JSON file")
    private Path saveTo;

    @Option(names = "--dot-out", description = "Write the automaton as graph text")
    private Path dotOut;

    @Option(names = "--test", description = "Word to test (repeatable); comma-separated symbols or one symbol per character")
    private List<String> words;

    @Option(names = "--interactive", description = "Test words read line by line from standard input")
    private boolean interactive;

    @Option(names = "--verbose", description = "Log pipeline details")
    private boolean verbose;

    private final InputStream input;

    public AutomataCli(InputStream input) {
        this.input = input;
    }

    public AutomataCli() {
        this(System.in);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        GraphTextSyntax syntax = GraphTextSyntax.defaults().withSentinel(sentinel);
        AutomatonDefinition definition;
        try {
            definition = loadDefinition(out, err, syntax);
            if (definition == null) {
                return EXIT_USAGE;
            }

            Automaton automaton = AutomatonFactory.instantiate(definition);
            if (toDfa) {
                automaton = automaton.toDeterministic();
            }
            if (minimize) {
                automaton = automaton.canonicalize();
            }
            definition = automaton.definition();
            out.printf("%s with %d states over alphabet %s, initial %s, final %s%n",
                definition.kind().code().toUpperCase(), definition.states().size(),
                definition.alphabet(), definition.initial(), definition.finals());

            if (saveTo != null) {
                DefinitionCodec.writeToFile(definition, saveTo);
                out.println("Automaton saved to " + saveTo);
            }
            if (dotOut != null) {
                DotRenderer.writeToFile(definition, syntax, dotOut);
                out.println("Graph description saved to " + dotOut);
            }

            if (words != null) {
                for (String word : words) {
                    boolean accepted = automaton.accepts(InteractiveTester.parseWord(word));
                    out.printf("%s -> %s%n", word, accepted ? "Accepted" : "Rejected");
                }
            }
            if (interactive) {
                var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
                new InteractiveTester(automaton, reader, out, err).run();
            }
            out.flush();
            return EXIT_OK;
        } catch (DefinitionException e) {
            logger.debug("Definition rejected", e);
            err.printf("Error [%s]: %s%n", e.code(), e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    /**
     * @return the built definition, or null after reporting a usage error
     */
    private AutomatonDefinition loadDefinition(PrintWriter out, PrintWriter err, GraphTextSyntax syntax)
            throws IOException, DefinitionException {
        if (loadFrom != null && dotFile != null) {
            err.println("Error: --load-from and --dot-file cannot be combined.");
            return null;
        }
        if (loadFrom != null) {
            AutomatonDefinition definition = DefinitionCodec.loadFromFile(loadFrom);
            out.println("Automaton loaded successfully from " + loadFrom);
            return definition;
        }
        if (dotFile != null) {
            AutomatonDefinition definition = DefinitionPipeline.fromGraphFile(dotFile, syntax);
            out.println("Automaton loaded successfully from " + dotFile);
            return definition;
        }

        if (type == null || alphabet == null || states == null || initial == null || finals == null
                || transitions == null) {
            err.println("Error: when not loading from a file, --type, --alphabet, --states, --initial, "
                + "--final and --transitions are all required.");
            return null;
        }
        Kind kind = Kind.fromCode(type);
        AutomatonDefinition definition = DefinitionPipeline.fromRecords(
            kind, splitList(alphabet), splitList(states), initial.trim(), splitList(finals), transitions);
        out.println(kind.code().toUpperCase() + " created successfully!");
        return definition;
    }

    private static List<String> splitList(String value) {
        var values = new ArrayList<String>();
        Arrays.stream(value.split(",")).map(String::trim).forEach(values::add);
        return values;
    }
}
