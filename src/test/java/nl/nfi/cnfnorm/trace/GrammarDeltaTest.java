package nl.nfi.cnfnorm.trace;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static nl.nfi.cnfnorm.Utils.grammar;
import static nl.nfi.cnfnorm.Utils.nt;
import static nl.nfi.cnfnorm.Utils.t;
import static org.assertj.core.api.Assertions.assertThat;

class GrammarDeltaTest {

    @Test
    void appliesRemovalsThenAdditionsThenStart() {
        final Grammar grammar = grammar("S -> aA", "A -> a");
        final GrammarDelta delta = new GrammarDelta(
                Optional.of(nt("S0")),
                List.of(Rule.of(nt("S"), Production.of(t('a'), nt("A")))),
                List.of(Rule.of(nt("S"), Production.of(t('a'))), Rule.of(nt("S0"), Production.of(nt("S"))))
        );

        final Grammar result = delta.applyTo(grammar);

        assertThat(result).hasToString("S0 -> S\nA -> a\nS -> a");
        assertThat(grammar).hasToString("S -> aA\nA -> a");
    }

    @Test
    void noneLeavesGrammarAlone() {
        final Grammar grammar = grammar("S -> a");

        assertThat(GrammarDelta.none().isEmpty()).isTrue();
        assertThat(GrammarDelta.none().applyTo(grammar)).isSameAs(grammar);
    }

    @Test
    void sinksChain() {
        final TraceRecorder first = new TraceRecorder();
        final TraceRecorder second = new TraceRecorder();
        final TransformationEvent event = new TransformationEvent(Stage.UNIT, "closure", List.of(), GrammarDelta.none(), grammar("S -> a"), "");

        first.andThen(second).andThen(TraceSink.noop()).accept(event);

        assertThat(first.events()).containsExactly(event);
        assertThat(second.events()).containsExactly(event);
        assertThat(first.actionsOf(Stage.UNIT)).containsExactly("closure");
        assertThat(first.eventsOf(Stage.BINARY)).isEmpty();
    }

    @Test
    void stageKeys() {
        assertThat(Stage.forKey("terminal")).isEqualTo(Stage.TERMINAL);
        assertThat(Stage.FINITENESS.key()).isEqualTo("finiteness");
    }
}
