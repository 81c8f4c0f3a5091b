package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.normalize.NormalizationDefectException;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import static nl.nfi.cnfnorm.normalize.NormalizationDefectException.Defect.ALLOCATOR_EXHAUSTED;

// fresh helper names: the letters of the pool (Z down to A by default), then D0, D1, D2, ...
// one instance per run, shared by terminal isolation and binary cascading
public final class VariableAllocator {

    public static final String DEFAULT_LETTERS = "ZYXWVUTSRQPONMLKJIHGFEDCBA";
    public static final String DEFAULT_FALLBACK_PREFIX = "D";

    private final String letters;
    private final String fallbackPrefix;
    private final Set<String> used;

    // names are only ever added, so skipped candidates never become free again
    private int letterCursor;
    private int counter;

    private VariableAllocator(final String letters, final String fallbackPrefix) {
        this.letters = letters;
        this.fallbackPrefix = fallbackPrefix;
        this.used = new HashSet<>();
    }

    public static VariableAllocator withDefaults() {
        return create(DEFAULT_LETTERS, DEFAULT_FALLBACK_PREFIX);
    }

    public static VariableAllocator create(final String letters, final String fallbackPrefix) {
        for (final char letter : letters.toCharArray()) {
            if (letter < 'A' || letter > 'Z') {
                throw new IllegalArgumentException("Helper letters must be uppercase letters: %s".formatted(letters));
            }
        }
        if (!fallbackPrefix.matches("[A-Z]")) {
            throw new IllegalArgumentException("Helper fallback prefix must be a single uppercase letter: %s".formatted(fallbackPrefix));
        }
        return new VariableAllocator(letters, fallbackPrefix);
    }

    public void reserve(final NonTerminal variable) {
        used.add(variable.name());
    }

    public void reserveAll(final Collection<NonTerminal> variables) {
        variables.forEach(this::reserve);
    }

    public boolean isUsed(final NonTerminal variable) {
        return used.contains(variable.name());
    }

    public NonTerminal allocate() {
        while (letterCursor < letters.length()) {
            final String candidate = String.valueOf(letters.charAt(letterCursor++));
            if (used.add(candidate)) {
                return NonTerminal.of(candidate);
            }
        }
        while (counter >= 0) {
            final String candidate = fallbackPrefix + counter++;
            if (used.add(candidate)) {
                return NonTerminal.of(candidate);
            }
        }
        throw new NormalizationDefectException(ALLOCATOR_EXHAUSTED, "No unused name left with prefix " + fallbackPrefix);
    }
}
