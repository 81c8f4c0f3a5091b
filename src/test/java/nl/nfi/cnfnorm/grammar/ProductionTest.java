package nl.nfi.cnfnorm.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.BitSet;
import java.util.List;

import static nl.nfi.cnfnorm.Utils.nt;
import static nl.nfi.cnfnorm.Utils.t;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductionTest {

    @Test
    void rejectsEmptyBody() {
        assertThatThrownBy(() -> Production.of(List.of()))
                .isInstanceOf(MalformedGrammarException.class);
    }

    @Test
    void rejectsEpsilonMixedWithSymbols() {
        assertThatThrownBy(() -> Production.of(t('a'), Epsilon.INSTANCE))
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("Epsilon");
    }

    @Test
    void classifiesShapes() {
        assertThat(Production.epsilon().isEpsilon()).isTrue();
        assertThat(Production.epsilon().isTerminalOnly()).isTrue();
        assertThat(Production.of(nt("A")).isUnit()).isTrue();
        assertThat(Production.of(t('a')).isSingleTerminal()).isTrue();
        assertThat(Production.of(t('a'), t('b')).isTerminalOnly()).isTrue();
        assertThat(Production.of(t('a'), nt("B")).isTerminalOnly()).isFalse();
        assertThat(Production.of(t('a'), nt("B")).hasTerminal()).isTrue();
        assertThat(Production.of(nt("A"), nt("B")).hasTerminal()).isFalse();
    }

    @Test
    void nonTerminalsInOrderOfFirstOccurrence() {
        final Production production = Production.of(nt("B"), t('a'), nt("A"), nt("B"));

        assertThat(production.nonTerminals()).containsExactly(nt("B"), nt("A"));
    }

    @Test
    void withoutPositions() {
        final Production production = Production.of(nt("A"), t('b'), nt("A"));
        final BitSet first = new BitSet();
        first.set(0);
        final BitSet all = new BitSet();
        all.set(0, 3);

        assertThat(production.withoutPositions(first)).isEqualTo(Production.of(t('b'), nt("A")));
        assertThat(production.withoutPositions(all)).isNull();
    }

    @Test
    void withSubstituted() {
        final Production production = Production.of(t('a'), nt("S"), t('b'));

        assertThat(production.withSubstituted(1, Production.of(nt("X"), nt("Y"))))
                .isEqualTo(Production.of(t('a'), nt("X"), nt("Y"), t('b')));
    }

    @Test
    void printsConcatenatedSymbols() {
        assertThat(Production.of(nt("X"), nt("D12"), t('c'))).hasToString("XD12c");
        assertThat(Production.epsilon()).hasToString("ε");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a", "AB", "0", "S-1", "s0"})
    void rejectsInvalidNonTerminalNames(final String name) {
        assertThat(NonTerminal.isValidName(name)).isFalse();
        assertThatThrownBy(() -> NonTerminal.of(name)).isInstanceOf(MalformedGrammarException.class);
    }

    @ParameterizedTest
    @ValueSource(chars = {'A', '0', '_', 'é'})
    void rejectsInvalidTerminals(final char value) {
        assertThatThrownBy(() -> Terminal.of(value)).isInstanceOf(MalformedGrammarException.class);
    }
}
