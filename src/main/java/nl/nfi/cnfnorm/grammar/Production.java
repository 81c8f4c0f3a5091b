package nl.nfi.cnfnorm.grammar;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.joining;

// right-hand side of a rule, an ordered non-empty sequence of symbols, e.g.:
//      aSb     = [Terminal(a), NonTerminal(S), Terminal(b)]
//      XD0     = [NonTerminal(X), NonTerminal(D0)]
//      ε       = [Epsilon]
public record Production(List<Symbol> symbols) {

    private static final Production EPSILON = new Production(List.of(Epsilon.INSTANCE));

    public Production {
        if (symbols == null || symbols.isEmpty()) {
            throw new MalformedGrammarException("Production must contain at least one symbol");
        }
        symbols = List.copyOf(symbols);
        if (symbols.size() > 1 && symbols.contains(Epsilon.INSTANCE)) {
            throw new MalformedGrammarException("Epsilon cannot be combined with other symbols: %s".formatted(symbols));
        }
    }

    public static Production of(final Symbol... symbols) {
        return new Production(List.of(symbols));
    }

    public static Production of(final List<? extends Symbol> symbols) {
        return new Production(List.copyOf(symbols));
    }

    public static Production epsilon() {
        return EPSILON;
    }

    public int length() {
        return symbols.size();
    }

    public Symbol symbolAt(final int position) {
        return symbols.get(position);
    }

    public boolean isEpsilon() {
        return symbols.get(0).isEpsilon();
    }

    // A -> B
    public boolean isUnit() {
        return symbols.size() == 1 && symbols.get(0).isNonTerminal();
    }

    // A -> a
    public boolean isSingleTerminal() {
        return symbols.size() == 1 && symbols.get(0).isTerminal();
    }

    // only terminals, or exactly epsilon
    public boolean isTerminalOnly() {
        return isEpsilon() || symbols.stream().allMatch(Symbol::isTerminal);
    }

    public boolean hasTerminal() {
        return symbols.stream().anyMatch(Symbol::isTerminal);
    }

    public boolean contains(final Symbol symbol) {
        return symbols.contains(symbol);
    }

    // distinct nonterminals in order of first occurrence
    public Set<NonTerminal> nonTerminals() {
        final Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
        for (final Symbol symbol : symbols) {
            if (symbol instanceof NonTerminal nonTerminal) {
                nonTerminals.add(nonTerminal);
            }
        }
        return nonTerminals;
    }

    public Production withSymbolAt(final int position, final Symbol symbol) {
        final List<Symbol> replaced = new ArrayList<>(symbols);
        replaced.set(position, symbol);
        return new Production(replaced);
    }

    // returns null when every symbol is removed
    public Production withoutPositions(final BitSet positions) {
        final List<Symbol> kept = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            if (!positions.get(i)) {
                kept.add(symbols.get(i));
            }
        }
        return kept.isEmpty() ? null : new Production(kept);
    }

    // splices the replacement body in place of the symbol at the given position
    public Production withSubstituted(final int position, final Production replacement) {
        final List<Symbol> substituted = new ArrayList<>(symbols.size() + replacement.length());
        substituted.addAll(symbols.subList(0, position));
        substituted.addAll(replacement.symbols());
        substituted.addAll(symbols.subList(position + 1, symbols.size()));
        return new Production(substituted);
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::toString).collect(joining());
    }
}
