package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.trace.TraceRecorder;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static nl.nfi.cnfnorm.Utils.grammar;
import static nl.nfi.cnfnorm.Utils.nt;
import static nl.nfi.cnfnorm.Utils.t;
import static nl.nfi.cnfnorm.trace.Stage.EPSILON;
import static org.assertj.core.api.Assertions.assertThat;

class EpsilonEliminatorTest {

    @Test
    void nullableThroughChains() {
        final Grammar grammar = grammar("S -> AB | a", "A -> eps | a", "B -> A", "C -> Cc");

        assertThat(EpsilonEliminator.nullableVariables(grammar)).containsExactlyInAnyOrder(nt("A"), nt("B"), nt("S"));
    }

    @Test
    void variantsFollowDeletionMask() {
        final Production production = Production.of(nt("A"), nt("S"), nt("A"));

        assertThat(EpsilonEliminator.variants(production, Set.of(nt("A")))).containsExactly(
                Production.of(nt("S"), nt("A")),
                Production.of(nt("A"), nt("S")),
                Production.of(nt("S"))
        );
    }

    @Test
    void variantsExcludeEmptyBody() {
        final Production production = Production.of(nt("A"), nt("A"));

        assertThat(EpsilonEliminator.variants(production, Set.of(nt("A")))).containsExactly(Production.of(nt("A")));
        assertThat(EpsilonEliminator.variants(Production.epsilon(), Set.of(nt("A")))).isEmpty();
    }

    @Test
    void nullableStartKeepsEpsilonOnNewStart() {
        final TraceRecorder trace = new TraceRecorder();

        final Grammar result = new EpsilonEliminator(nt("S0"), trace).apply(grammar("S -> aSb | eps"));

        assertThat(result).hasToString("S0 -> S | ε\nS -> aSb | ab");
        assertThat(trace.actionsOf(EPSILON)).containsExactly("nullable", "new-start", "expand", "remove-epsilon");
    }

    @Test
    void startNullableWithoutDirectEpsilon() {
        final Grammar result = new EpsilonEliminator(nt("S0"), new TraceRecorder()).apply(grammar("S -> AA", "A -> a | eps"));

        assertThat(result.productions(nt("S0"))).containsExactly(Production.of(nt("S")), Production.epsilon());
        assertThat(result.productions(nt("S"))).containsExactlyInAnyOrder(Production.of(nt("A"), nt("A")), Production.of(nt("A")));
        assertThat(result.productions(nt("A"))).containsExactly(Production.of(t('a')));
    }

    @Test
    void nonNullableStartHasNoEpsilon() {
        final Grammar result = new EpsilonEliminator(nt("S0"), new TraceRecorder()).apply(grammar("S -> aA", "A -> b | eps"));

        assertThat(result.startSymbol()).isEqualTo(nt("S0"));
        assertThat(result.productions(nt("S0"))).containsExactly(Production.of(nt("S")));
        assertThat(result.productions(nt("S"))).containsExactly(Production.of(t('a'), nt("A")), Production.of(t('a')));
        assertThat(result.rules()).noneMatch(rule -> rule.body().isEpsilon());
    }

    @Test
    void variablesOnlyDerivingEpsilonDisappear() {
        final TraceRecorder trace = new TraceRecorder();

        final Grammar result = new EpsilonEliminator(nt("S0"), trace).apply(grammar("S -> aA", "A -> eps"));

        assertThat(result).hasToString("S0 -> S\nS -> a");
        // every intermediate grammar stays free of dangling references
        trace.events().forEach(event -> event.snapshot().validate());
    }

    @Test
    void takenStartNameFallsBackToNumbered() {
        final Grammar result = new EpsilonEliminator(nt("S0"), new TraceRecorder()).apply(grammar("S -> S0 | S1", "S0 -> a", "S1 -> b"));

        assertThat(result.startSymbol()).isEqualTo(nt("S2"));
        assertThat(result.productions(nt("S2"))).containsExactly(Production.of(nt("S")));
    }
}
