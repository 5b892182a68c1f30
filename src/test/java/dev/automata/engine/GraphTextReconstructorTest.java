package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.GraphTextSyntax;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class GraphTextReconstructorTest {

    private static final String ALTERNATING = """
        digraph finite_state_machine {
            rankdir=LR;
            size="8,5"
            node [shape = doublecircle]; q1;
            node [shape = circle];
            null -> q0;
            q0 -> q0 [label = "0"];
            q0 -> q1 [label = "1"];
            q1 -> q1 [label = "0"];
            q1 -> q0 [label = "1"];
        }
        """;

    private final GraphTextReconstructor reconstructor = new GraphTextReconstructor();

    @Test
    void reconstructsDeterministicAutomaton() throws DefinitionException {
        RawDefinition raw = reconstructor.reconstruct(ALTERNATING);

        assertThat(raw.kind()).isEqualTo(Kind.DETERMINISTIC);
        assertThat(raw.initial()).isEqualTo("q0");
        assertThat(raw.finals()).containsExactly("q1");
        assertThat(raw.states()).containsExactlyInAnyOrder("q0", "q1");
        assertThat(raw.alphabet()).containsExactlyInAnyOrder("0", "1");
        assertThat(raw.transitions()).hasSize(4)
            .containsEntry(new TransitionKey("q0", "0"), new Target.Single("q0"))
            .containsEntry(new TransitionKey("q0", "1"), new Target.Single("q1"))
            .containsEntry(new TransitionKey("q1", "0"), new Target.Single("q1"))
            .containsEntry(new TransitionKey("q1", "1"), new Target.Single("q0"));
    }

    @Test
    void secondTargetForSamePairMakesItNondeterministic() throws DefinitionException {
        String text = ALTERNATING.replace("}", "    q0 -> q2 [label = \"1\"];\n}");

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.kind()).isEqualTo(Kind.NONDETERMINISTIC);
        assertThat(raw.states()).containsExactlyInAnyOrder("q0", "q1", "q2");
        assertThat(raw.transitions().get(new TransitionKey("q0", "1")).states())
            .containsExactlyInAnyOrder("q1", "q2");
        assertThat(raw.transitions().get(new TransitionKey("q1", "0"))).isInstanceOf(Target.Multiple.class);
    }

    @Test
    void missingStartEdgeFails() {
        String text = ALTERNATING.replace("null -> q0;", "");

        Throwable thrown = catchThrowable(() -> reconstructor.reconstruct(text));

        assertThat(thrown).isInstanceOf(DefinitionException.class);
        assertThat(((DefinitionException) thrown).code()).isEqualTo(Code.MISSING_INITIAL_STATE);
    }

    @Test
    void lineOrderDoesNotMatter() throws DefinitionException {
        String shuffled = """
            q1 -> q0 [label = "1"];
            q1 -> q1 [label = "0"];
            node [shape = doublecircle]; q1;
            q0 -> q1 [label = "1"];
            null -> q0;
            q0 -> q0 [label = "0"];
            """;

        RawDefinition ordered = reconstructor.reconstruct(ALTERNATING);
        RawDefinition reordered = reconstructor.reconstruct(shuffled);

        assertThat(reordered.kind()).isEqualTo(ordered.kind());
        assertThat(reordered.initial()).isEqualTo(ordered.initial());
        assertThat(reordered.finals()).isEqualTo(ordered.finals());
        assertThat(reordered.states()).isEqualTo(ordered.states());
        assertThat(reordered.transitions()).isEqualTo(ordered.transitions());
    }

    @Test
    void labelWithSeveralSymbolsAddsOneTransitionEach() throws DefinitionException {
        String text = """
            null -> a;
            a -> b [label = "x, y"];
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.alphabet()).containsExactlyInAnyOrder("x", "y");
        assertThat(raw.transitions()).containsOnlyKeys(new TransitionKey("a", "x"), new TransitionKey("a", "y"));
        assertThat(raw.kind()).isEqualTo(Kind.DETERMINISTIC);
    }

    @Test
    void repeatedIdenticalEdgeStaysDeterministic() throws DefinitionException {
        String text = """
            null -> a;
            a -> b [label = "x"];
            a -> b [label = "x"];
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.kind()).isEqualTo(Kind.DETERMINISTIC);
        assertThat(raw.transitions().get(new TransitionKey("a", "x"))).isEqualTo(new Target.Single("b"));
    }

    @Test
    void unlabeledEdgeAloneDoesNotMakeResultNondeterministic() throws DefinitionException {
        String text = """
            null -> a;
            a -> b;
            b -> b [label = "x"];
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.kind()).isEqualTo(Kind.DETERMINISTIC);
        assertThat(raw.alphabet()).containsExactly("x");
        assertThat(raw.transitions().get(new TransitionKey("a", ""))).isEqualTo(new Target.Single("b"));
    }

    @Test
    void unlabeledEdgesBranchingFromOneStateAreNondeterministic() throws DefinitionException {
        String text = """
            null -> a;
            a -> b;
            a -> c;
            b -> c [label = "x"];
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.kind()).isEqualTo(Kind.NONDETERMINISTIC);
        assertThat(raw.transitions().get(new TransitionKey("a", "")).states()).containsExactly("b", "c");
    }

    @Test
    void quotedNamesAndLabelsMayEscapeQuotes() throws DefinitionException {
        String text = """
            node [shape = doublecircle]; "the \\"end\\"";
            null -> "a b";
            "a b" -> "the \\"end\\"" [label = "\\""];
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.initial()).isEqualTo("a b");
        assertThat(raw.finals()).containsExactly("the \"end\"");
        assertThat(raw.alphabet()).containsExactly("\"");
        assertThat(raw.transitions().get(new TransitionKey("a b", "\""))).isEqualTo(new Target.Single("the \"end\""));
    }

    @Test
    void acceptsRendererStyleAttributes() throws DefinitionException {
        String text = """
            digraph {
                rankdir=LR
                node [shape=circle]
                start [shape=none height=0 width=0]
                start -> q0
                q1 [shape=doublecircle]
                q0 -> q1 [label=1]
                "q1" -> "q0" [label="0" color=red]
            }
            """;

        RawDefinition raw = new GraphTextReconstructor(GraphTextSyntax.defaults().withSentinel("start"))
            .reconstruct(text);

        assertThat(raw.initial()).isEqualTo("q0");
        assertThat(raw.states()).containsExactlyInAnyOrder("q0", "q1");
        assertThat(raw.finals()).containsExactly("q1");
        assertThat(raw.transitions())
            .containsEntry(new TransitionKey("q0", "1"), new Target.Single("q1"))
            .containsEntry(new TransitionKey("q1", "0"), new Target.Single("q0"));
    }

    @Test
    void sentinelNeverBecomesAState() throws DefinitionException {
        RawDefinition raw = reconstructor.reconstruct(ALTERNATING);

        assertThat(raw.states()).doesNotContain("null");
    }

    @Test
    void finalMarkerAcceptsSeveralNames() throws DefinitionException {
        String text = """
            node [shape = doublecircle]; q1 q2; "q 3";
            null -> q0;
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.finals()).containsExactlyInAnyOrder("q1", "q2", "q 3");
        assertThat(raw.states()).containsExactlyInAnyOrder("q0", "q1", "q2", "q 3");
    }

    @Test
    void conflictingStartEdgesFail() {
        String text = """
            null -> q0;
            null -> q1;
            """;

        Throwable thrown = catchThrowable(() -> reconstructor.reconstruct(text));

        assertThat(thrown).isInstanceOf(DefinitionException.class).hasMessageContaining("Line 2");
        assertThat(((DefinitionException) thrown).code()).isEqualTo(Code.MALFORMED_RECORD);
    }

    @Test
    void ignoresUnrecognizedLines() throws DefinitionException {
        String text = """
            // a comment
            graph [fontsize = 10];
            edge [color = blue];
            subgraph cluster_0 { }
            null -> q0;
            """;

        RawDefinition raw = reconstructor.reconstruct(text);

        assertThat(raw.states()).containsExactly("q0");
        assertThat(raw.transitions()).isEmpty();
    }
}
