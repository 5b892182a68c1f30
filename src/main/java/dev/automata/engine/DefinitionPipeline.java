package dev.automata.engine;

import dev.automata.model.AutomatonDefinition;
import dev.automata.model.GraphTextSyntax;
import dev.automata.model.Kind;
import dev.automata.model.RawDefinition;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry points that run a whole build, from one source to a finished definition.
 */
public final class DefinitionPipeline {

    private DefinitionPipeline() {}

    /**
     * Build from declared sets and flat {@code state,symbol,target...} records.
     */
    public static AutomatonDefinition fromRecords(Kind kind, List<String> alphabet, List<String> states,
                                                  String initial, List<String> finals, List<String> records)
            throws DefinitionException {
        Set<String> declaredAlphabet = new LinkedHashSet<>(alphabet);
        Set<String> declaredStates = new LinkedHashSet<>(states);

        if (initial != null) {
            MembershipValidator.requireState(initial, declaredStates, "Initial state");
        }
        for (String state : finals) {
            MembershipValidator.requireState(state, declaredStates, "Final state");
        }

        Map<TransitionKey, Target> transitions =
            FlatTransitionBuilder.build(records, declaredAlphabet, declaredStates, kind);
        var raw = new RawDefinition(kind, Set.of(), Set.of(), initial, new LinkedHashSet<>(finals), transitions);
        return DefinitionAssembler.assemble(raw, declaredAlphabet, declaredStates);
    }

    public static AutomatonDefinition fromGraphText(String text, GraphTextSyntax syntax) throws DefinitionException {
        RawDefinition raw = new GraphTextReconstructor(syntax).reconstruct(text);
        return DefinitionAssembler.assemble(raw);
    }

    public static AutomatonDefinition fromGraphText(String text) throws DefinitionException {
        return fromGraphText(text, GraphTextSyntax.defaults());
    }

    public static AutomatonDefinition fromGraphFile(Path path, GraphTextSyntax syntax)
            throws IOException, DefinitionException {
        return fromGraphText(Files.readString(path), syntax);
    }
}
