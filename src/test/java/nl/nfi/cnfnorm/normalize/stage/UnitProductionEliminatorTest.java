package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.normalize.NormalizationDefectException;
import nl.nfi.cnfnorm.trace.TraceRecorder;
import nl.nfi.cnfnorm.trace.TransformationEvent;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static nl.nfi.cnfnorm.Utils.grammar;
import static nl.nfi.cnfnorm.Utils.nt;
import static nl.nfi.cnfnorm.normalize.NormalizationDefectException.Defect.START_SYMBOL_INEXPANSIBLE;
import static nl.nfi.cnfnorm.trace.Stage.UNIT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnitProductionEliminatorTest {

    @Test
    void closureIsReflexiveAndTransitive() {
        final Grammar grammar = grammar("S0 -> S", "S -> A", "A -> B", "B -> Cdb", "C -> A | bb");

        assertThat(UnitProductionEliminator.unitClosure(grammar))
                .containsEntry(nt("S0"), Set.of(nt("S0"), nt("S"), nt("A"), nt("B")))
                .containsEntry(nt("C"), Set.of(nt("C"), nt("A"), nt("B")))
                .containsEntry(nt("B"), Set.of(nt("B")));
    }

    @Test
    void copiesProductionsAndPrunesUnreachable() {
        final TraceRecorder trace = new TraceRecorder();

        final Grammar result = new UnitProductionEliminator(trace)
                .apply(grammar("S0 -> S", "S -> A", "A -> B", "B -> Cdb", "C -> A | bb"));

        assertThat(result.startSymbol()).isEqualTo(nt("S0"));
        assertThat(result.sortedVariables()).containsExactly(nt("C"), nt("S0"));
        assertThat(result.productions(nt("S0"))).extracting(Object::toString).containsExactly("Cdb");
        assertThat(result.productions(nt("C"))).extracting(Object::toString).containsExactly("bb", "Cdb");
        assertThat(result.rules()).noneMatch(rule -> rule.body().isUnit());
        assertThat(trace.actionsOf(UNIT)).startsWith("closure", "copy").endsWith("prune");
    }

    @Test
    void unitCycles() {
        final Grammar result = new UnitProductionEliminator(new TraceRecorder())
                .apply(grammar("S0 -> A", "A -> B | a", "B -> A | b"));

        assertThat(result).isEqualTo(grammar("S0 -> a | b"));
    }

    @Test
    void substitutesStartSymbolOnRightHandSides() {
        final TraceRecorder trace = new TraceRecorder();

        final Grammar result = new UnitProductionEliminator(trace).apply(grammar("S -> A | a", "A -> bS"));

        assertThat(result.productions(nt("S"))).extracting(Object::toString).containsExactly("a", "bS");
        assertThat(result.hasVariable(nt("A"))).isFalse();
        assertThat(trace.actionsOf(UNIT)).contains("protect-start", "prune");
    }

    @Test
    void startSubstitutionDeltasReplayToTheirSnapshots() {
        final Grammar input = grammar("S -> A | a", "A -> bS | cS", "B -> b");
        final TraceRecorder trace = new TraceRecorder();

        new UnitProductionEliminator(trace).apply(input);

        Grammar replayed = input;
        for (final TransformationEvent event : trace.eventsOf(UNIT)) {
            replayed = event.delta().applyTo(replayed);
            assertThat(replayed).as(event.action()).isEqualTo(event.snapshot());
        }
        final TransformationEvent protect = trace.eventsOf(UNIT).stream()
                .filter(event -> event.action().equals("protect-start"))
                .findFirst().orElseThrow();
        assertThat(protect.snapshot().variables()).containsExactly(nt("S"), nt("B"), nt("A"));
        assertThat(protect.snapshot().productions(nt("A"))).extracting(Object::toString).containsExactly("ba", "ca");
    }

    @Test
    void startSymbolWithoutSubstituteIsADefect() {
        assertThatThrownBy(() -> new UnitProductionEliminator(new TraceRecorder()).apply(grammar("S -> A", "A -> aS")))
                .isInstanceOfSatisfying(NormalizationDefectException.class,
                        e -> assertThat(e.defect()).isEqualTo(START_SYMBOL_INEXPANSIBLE));
    }
}
