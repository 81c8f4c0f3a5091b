package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.normalize.NormalizationDefectException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static nl.nfi.cnfnorm.Utils.nt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariableAllocatorTest {

    @Test
    void lettersFromZDownSkippingReserved() {
        final VariableAllocator allocator = VariableAllocator.withDefaults();
        allocator.reserveAll(List.of(nt("S"), nt("Y"), nt("S0")));

        assertThat(List.of(allocator.allocate(), allocator.allocate(), allocator.allocate()))
                .containsExactly(nt("Z"), nt("X"), nt("W"));
        assertThat(allocator.isUsed(nt("X"))).isTrue();
        assertThat(allocator.isUsed(nt("V"))).isFalse();
    }

    @Test
    void numberedNamesOnceLettersRunOut() {
        final VariableAllocator allocator = VariableAllocator.withDefaults();
        allocator.reserve(nt("D1"));

        final List<NonTerminal> allocated = new ArrayList<>();
        for (int i = 0; i < 29; i++) {
            allocated.add(allocator.allocate());
        }

        assertThat(allocated.subList(0, 26)).doesNotHaveDuplicates().allMatch(variable -> variable.name().length() == 1);
        assertThat(allocated.subList(26, 29)).containsExactly(nt("D0"), nt("D2"), nt("D3"));
    }

    @Test
    void customPool() {
        final VariableAllocator allocator = VariableAllocator.create("HQ", "X");
        allocator.reserve(nt("Q"));

        assertThat(List.of(allocator.allocate(), allocator.allocate(), allocator.allocate()))
                .containsExactly(nt("H"), nt("X0"), nt("X1"));
    }

    @Test
    void neverHandsOutReservedLater() {
        final VariableAllocator allocator = VariableAllocator.withDefaults();
        assertThat(allocator.allocate()).isEqualTo(nt("Z"));

        allocator.reserve(nt("Y"));

        assertThat(allocator.allocate()).isEqualTo(nt("X"));
    }

    @ParameterizedTest
    @CsvSource({
            "ab, D",
            "A1, D",
            "AB, DD",
            "AB, d",
    })
    void rejectsInvalidPool(final String letters, final String prefix) {
        assertThatThrownBy(() -> VariableAllocator.create(letters, prefix)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exhaustionDefectCarriesItsKind() {
        final NormalizationDefectException defect = new NormalizationDefectException(
                NormalizationDefectException.Defect.ALLOCATOR_EXHAUSTED, "test");

        assertThat(defect).isInstanceOf(IllegalStateException.class).hasMessage("ALLOCATOR_EXHAUSTED: test");
        assertThat(defect.defect()).isEqualTo(NormalizationDefectException.Defect.ALLOCATOR_EXHAUSTED);
    }
}
