package nl.nfi.cnfnorm.grammar;

import java.util.regex.Pattern;

// an uppercase letter, optionally followed by digits, e.g. S, S0, X1, D12
public record NonTerminal(String name) implements Symbol, Comparable<NonTerminal> {

    private static final Pattern NAME = Pattern.compile("[A-Z][0-9]*");

    public NonTerminal {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new MalformedGrammarException("Invalid nonterminal name: '%s'".formatted(name));
        }
    }

    public static NonTerminal of(final String name) {
        return new NonTerminal(name);
    }

    public static boolean isValidName(final String name) {
        return name != null && NAME.matcher(name).matches();
    }

    @Override
    public int compareTo(final NonTerminal other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
