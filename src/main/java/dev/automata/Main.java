package dev.automata;

import dev.automata.cli.AutomataCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AutomataCli()).execute(args);
        System.exit(exitCode);
    }
}
