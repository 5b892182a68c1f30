package dev.automata.cli;

import dev.automata.engine.DefinitionException;
import dev.automata.engine.DefinitionPipeline;
import dev.automata.model.Kind;
import dev.automata.runtime.Automaton;
import dev.automata.runtime.AutomatonFactory;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InteractiveTesterTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private void run(String input) throws IOException, DefinitionException {
        Automaton dfa = AutomatonFactory.instantiate(DefinitionPipeline.fromRecords(Kind.DETERMINISTIC,
            List.of("0", "1"), List.of("a", "b"), "a", List.of("a"),
            List.of("a,0,a", "a,1,b", "b,0,b", "b,1,a")));
        new InteractiveTester(dfa, new BufferedReader(new StringReader(input)),
            new PrintWriter(out), new PrintWriter(err)).run();
    }

    @Test
    void testsWordsUntilExit() throws Exception {
        run("0011\n1,0\n\nexit\n0\n");

        assertThat(out.toString()).contains("  -> Accepted");
        assertThat(out.toString()).contains("  -> Rejected");
        assertThat(out.toString()).endsWith("Goodbye!" + System.lineSeparator());
    }

    @Test
    void stepModeReportsEachState() throws Exception {
        run("step\n1\n1\ndone\nexit\n");

        assertThat(out.toString()).contains("Initial state: a");
        assertThat(out.toString()).contains("Processed '1'. Current state: b. Accepting: false");
        assertThat(out.toString()).contains("Processed '1'. Current state: a. Accepting: true");
        assertThat(out.toString()).contains("--- End Step-by-Step Execution ---");
    }

    @Test
    void reportsSymbolsOutsideAlphabet() throws Exception {
        run("012\nstep\n7\ndone\n");

        assertThat(err.toString()).contains("Symbol '2' not in alphabet");
        assertThat(err.toString()).contains("Symbol '7' not in alphabet");
    }

    @Test
    void endOfInputQuits() throws Exception {
        run("step\n1\n");

        assertThat(out.toString()).contains("Goodbye!");
    }

    @Test
    void parsesWordsByCommaOrCharacter() {
        assertThat(InteractiveTester.parseWord("ab,c")).containsExactly("ab", "c");
        assertThat(InteractiveTester.parseWord("abc")).containsExactly("a", "b", "c");
    }
}
