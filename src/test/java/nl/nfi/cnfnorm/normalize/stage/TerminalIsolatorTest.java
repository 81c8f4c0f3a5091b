package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.trace.TraceRecorder;
import org.junit.jupiter.api.Test;

import static nl.nfi.cnfnorm.Utils.grammar;
import static nl.nfi.cnfnorm.Utils.nt;
import static nl.nfi.cnfnorm.Utils.t;
import static nl.nfi.cnfnorm.trace.Stage.TERMINAL;
import static org.assertj.core.api.Assertions.assertThat;

class TerminalIsolatorTest {

    @Test
    void reusesOnlyVariablesDerivingJustThatTerminal() {
        final Grammar grammar = grammar("S0 -> AB | a", "A -> a", "B -> b | c");

        assertThat(TerminalIsolator.existingTerminalVariables(grammar))
                .containsOnlyKeys(t('a'))
                .containsEntry(t('a'), nt("A"));
    }

    @Test
    void replacesTerminalsInLongProductions() {
        final TraceRecorder trace = new TraceRecorder();
        final VariableAllocator allocator = VariableAllocator.withDefaults();

        final Grammar result = new TerminalIsolator(allocator, trace).apply(grammar("S0 -> aA | AB", "A -> a", "B -> bB | b"));

        assertThat(result).hasToString("""
                S0 -> AB | AA
                A -> a
                B -> b | ZB
                Z -> b""");
        assertThat(trace.actionsOf(TERMINAL))
                .containsExactly("init", "create-terminal-variable", "replace-terminals", "replace-terminals");
    }

    @Test
    void helpersComeFromTheSharedAllocator() {
        final VariableAllocator allocator = VariableAllocator.withDefaults();
        allocator.reserve(nt("Z"));

        final Grammar result = new TerminalIsolator(allocator, new TraceRecorder()).apply(grammar("S0 -> ab"));

        assertThat(result).hasToString("""
                S0 -> YX
                X -> b
                Y -> a""");
        assertThat(allocator.isUsed(nt("S0"))).isTrue();
    }

    @Test
    void sameTerminalTwiceUsesOneHelper() {
        final Grammar result = new TerminalIsolator(VariableAllocator.withDefaults(), new TraceRecorder()).apply(grammar("S0 -> aSa", "S -> a"));

        assertThat(result).hasToString("""
                S0 -> SSS
                S -> a""");
    }

    @Test
    void singleTerminalProductionsStay() {
        final Grammar grammar = grammar("S0 -> a | AB", "A -> a", "B -> b");

        final Grammar result = new TerminalIsolator(VariableAllocator.withDefaults(), new TraceRecorder()).apply(grammar);

        assertThat(result).isEqualTo(grammar);
    }
}
