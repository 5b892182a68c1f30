package dev.automata.cli;

import dev.automata.runtime.Automaton;
import dev.automata.runtime.StepCursor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented tester: each line is a word to run, {@code step} enters symbol-by-symbol
 * mode (left with {@code done}), {@code exit} or end of input quits.
 */
public final class InteractiveTester {

    private final Automaton automaton;
    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;

    public InteractiveTester(Automaton automaton, BufferedReader in, PrintWriter out, PrintWriter err) {
        this.automaton = automaton;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public void run() throws IOException {
        out.println("--- Interactive Testing ---");
        out.printf("Enter strings over the alphabet %s (comma-separated for multi-character symbols, e.g. 'a,b,c').%n",
            automaton.definition().alphabet());
        out.println("Type 'exit' to quit.");
        out.println("Type 'step' to process input symbol by symbol.");

        while (true) {
            String line = prompt("> ");
            if (line == null) {
                break;
            }
            String input = line.trim();
            if (input.equalsIgnoreCase("exit")) {
                break;
            }
            if (input.isEmpty()) {
                continue;
            }
            if (input.equalsIgnoreCase("step")) {
                if (!stepMode()) {
                    break;
                }
                continue;
            }
            List<String> word = parseWord(input);
            try {
                out.println(automaton.accepts(word) ? "  -> Accepted" : "  -> Rejected");
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                err.flush();
            }
        }
        out.println("Goodbye!");
        out.flush();
    }

    /**
     * @return false when input ended inside step mode
     */
    private boolean stepMode() throws IOException {
        out.println("--- Step-by-Step Execution ---");
        StepCursor cursor = automaton.stepCursor();
        out.println("Initial state: " + describe(cursor));

        while (true) {
            String line = prompt("Enter symbol to process (or 'done'): ");
            if (line == null) {
                return false;
            }
            String symbol = line.trim();
            if (symbol.equalsIgnoreCase("done")) {
                out.println("--- End Step-by-Step Execution ---");
                return true;
            }
            try {
                cursor.push(symbol);
                out.printf("Processed '%s'. Current state: %s. Accepting: %s%n",
                    symbol, describe(cursor), cursor.isAccepting());
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                err.flush();
            }
        }
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        return in.readLine();
    }

    private static String describe(StepCursor cursor) {
        var states = cursor.current();
        if (states.size() == 1) {
            return states.iterator().next();
        }
        return states.toString();
    }

    /**
     * Split a typed word into symbols: on commas when present, otherwise one symbol per character.
     */
    public static List<String> parseWord(String input) {
        var symbols = new ArrayList<String>();
        if (input.contains(",")) {
            for (String symbol : input.split(",", -1)) {
                symbols.add(symbol.trim());
            }
        } else {
            input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        }
        return symbols;
    }
}
