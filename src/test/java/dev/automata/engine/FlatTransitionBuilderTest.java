package dev.automata.engine;

import dev.automata.engine.DefinitionException.Code;
import dev.automata.model.Kind;
import dev.automata.model.Target;
import dev.automata.model.TransitionKey;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class FlatTransitionBuilderTest {

    private static final Set<String> ALPHABET = Set.of("0", "1");
    private static final Set<String> STATES = Set.of("q0", "q1");

    @Test
    void buildsDeterministicTableWithOneTargetPerPair() throws DefinitionException {
        Map<TransitionKey, Target> table = FlatTransitionBuilder.build(
            List.of("q0,0,q0", "q0,1,q1", " q1 , 0 , q1 ", "q1,1,q0"), ALPHABET, STATES, Kind.DETERMINISTIC);

        assertThat(table).hasSize(4);
        assertThat(table.get(new TransitionKey("q0", "1"))).isEqualTo(new Target.Single("q1"));
        assertThat(table.get(new TransitionKey("q1", "0"))).isEqualTo(new Target.Single("q1"));
        assertThat(table.values()).allMatch(t -> t instanceof Target.Single);
    }

    @Test
    void rejectsDuplicateDeterministicPair() {
        DefinitionException e = failure(() -> FlatTransitionBuilder.build(
            List.of("q0,0,q0", "q0,0,q1"), ALPHABET, STATES, Kind.DETERMINISTIC));

        assertThat(e.code()).isEqualTo(Code.DUPLICATE_TRANSITION);
        assertThat(e.getMessage()).contains("(q0, 0)");
    }

    @Test
    void rejectsDuplicateEvenWhenTargetsAgree() {
        DefinitionException e = failure(() -> FlatTransitionBuilder.build(
            List.of("q0,0,q1", "q0,0,q1"), ALPHABET, STATES, Kind.DETERMINISTIC));

        assertThat(e.code()).isEqualTo(Code.DUPLICATE_TRANSITION);
    }

    @Test
    void deterministicRecordNeedsExactlyThreeFields() {
        assertThat(failure(() -> FlatTransitionBuilder.build(
            List.of("q0,0,q0,q1"), ALPHABET, STATES, Kind.DETERMINISTIC)).code())
            .isEqualTo(Code.MALFORMED_RECORD);
        assertThat(failure(() -> FlatTransitionBuilder.build(
            List.of("q0,0"), ALPHABET, STATES, Kind.DETERMINISTIC)).code())
            .isEqualTo(Code.MALFORMED_RECORD);
    }

    @Test
    void nondeterministicRecordNeedsAtLeastThreeFields() {
        DefinitionException e = failure(() -> FlatTransitionBuilder.build(
            List.of("q0,1"), ALPHABET, STATES, Kind.NONDETERMINISTIC));

        assertThat(e.code()).isEqualTo(Code.MALFORMED_RECORD);
        assertThat(e.getMessage()).contains("'q0,1'");
    }

    @Test
    void unknownTargetStateIsNamed() {
        DefinitionException e = failure(() -> FlatTransitionBuilder.build(
            List.of("q0,0,q2"), ALPHABET, STATES, Kind.DETERMINISTIC));

        assertThat(e.code()).isEqualTo(Code.UNKNOWN_STATE);
        assertThat(e.getMessage()).contains("'q2'");
    }

    @Test
    void unknownSourceStateAndSymbol() {
        assertThat(failure(() -> FlatTransitionBuilder.build(
            List.of("q5,0,q0"), ALPHABET, STATES, Kind.NONDETERMINISTIC)).code())
            .isEqualTo(Code.UNKNOWN_STATE);
        assertThat(failure(() -> FlatTransitionBuilder.build(
            List.of("q0,a,q0"), ALPHABET, STATES, Kind.DETERMINISTIC)).code())
            .isEqualTo(Code.UNKNOWN_SYMBOL);
    }

    @Test
    void repeatedNondeterministicPairIsMergedByUnion() throws DefinitionException {
        Map<TransitionKey, Target> relation = FlatTransitionBuilder.build(
            List.of("q0,1,q1", "q0,0,q0", "q0,1,q0,q1"), ALPHABET, STATES, Kind.NONDETERMINISTIC);

        assertThat(relation).hasSize(2);
        assertThat(relation.get(new TransitionKey("q0", "1")).states()).containsExactlyInAnyOrder("q0", "q1");
        assertThat(relation.get(new TransitionKey("q0", "0")).states()).containsExactly("q0");
    }

    @Test
    void unionDoesNotDependOnRecordOrder() throws DefinitionException {
        var forward = FlatTransitionBuilder.build(
            List.of("q0,1,q1", "q0,1,q0"), ALPHABET, STATES, Kind.NONDETERMINISTIC);
        var backward = FlatTransitionBuilder.build(
            List.of("q0,1,q0", "q0,1,q1"), ALPHABET, STATES, Kind.NONDETERMINISTIC);

        assertThat(forward).isEqualTo(backward);
    }

    @Test
    void nondeterministicRecordsMayUseEpsilon() throws DefinitionException {
        var relation = FlatTransitionBuilder.build(
            List.of("q0,,q1"), ALPHABET, STATES, Kind.NONDETERMINISTIC);

        assertThat(relation).containsKey(new TransitionKey("q0", ""));
    }

    @Test
    void deterministicRecordsMayNotUseEpsilon() {
        assertThat(failure(() -> FlatTransitionBuilder.build(
            List.of("q0,,q1"), ALPHABET, STATES, Kind.DETERMINISTIC)).code())
            .isEqualTo(Code.UNKNOWN_SYMBOL);
    }

    private static DefinitionException failure(ThrowingCallable call) {
        Throwable thrown = catchThrowable(call);
        assertThat(thrown).isInstanceOf(DefinitionException.class);
        return (DefinitionException) thrown;
    }
}
