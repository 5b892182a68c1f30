package dev.automata.model;

/**
 * Reserved tokens of the graph-text notation.
 */
public record GraphTextSyntax(
    String sentinel,
    String finalShape
) {
    public static final String DEFAULT_SENTINEL = "null";
    public static final String DEFAULT_FINAL_SHAPE = "doublecircle";

    public static GraphTextSyntax defaults() {
        return new GraphTextSyntax(DEFAULT_SENTINEL, DEFAULT_FINAL_SHAPE);
    }

    public GraphTextSyntax withSentinel(String sentinel) {
        return new GraphTextSyntax(sentinel, finalShape);
    }
}
