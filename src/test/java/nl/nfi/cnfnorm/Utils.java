package nl.nfi.cnfnorm;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Symbol;
import nl.nfi.cnfnorm.grammar.Terminal;
import nl.nfi.cnfnorm.serialize.GrammarParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

public final class Utils {

    public static Grammar grammar(final String... lines) {
        return GrammarParser.parse(List.of(lines));
    }

    public static NonTerminal nt(final String name) {
        return NonTerminal.of(name);
    }

    public static Terminal t(final char value) {
        return Terminal.of(value);
    }

    // every terminal string of at most maxLength symbols derivable from the start symbol, by brute-force fixpoint
    public static Set<String> sample(final Grammar grammar, final int maxLength) {
        final Map<NonTerminal, Set<String>> derivable = new HashMap<>();
        for (final NonTerminal variable : grammar.variables()) {
            derivable.put(variable, new TreeSet<>());
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final NonTerminal variable : grammar.variables()) {
                for (final Production production : grammar.productions(variable)) {
                    for (final String word : words(production, derivable, maxLength)) {
                        changed |= derivable.get(variable).add(word);
                    }
                }
            }
        }
        return derivable.getOrDefault(grammar.startSymbol(), new TreeSet<>());
    }

    private static Set<String> words(final Production production, final Map<NonTerminal, Set<String>> derivable, final int maxLength) {
        Set<String> prefixes = new TreeSet<>(List.of(""));
        if (production.isEpsilon()) {
            return prefixes;
        }
        for (final Symbol symbol : production.symbols()) {
            final Set<String> parts = symbol instanceof NonTerminal nonTerminal
                    ? derivable.getOrDefault(nonTerminal, Set.of())
                    : Set.of(symbol.toString());
            final Set<String> next = new TreeSet<>();
            for (final String prefix : prefixes) {
                for (final String part : parts) {
                    if (prefix.length() + part.length() <= maxLength) {
                        next.add(prefix + part);
                    }
                }
            }
            prefixes = next;
            if (prefixes.isEmpty()) {
                break;
            }
        }
        return prefixes;
    }

    // random grammar over variables A..(A + variableCount - 1) and terminals a, b; bodies of length 0 are epsilon
    public static Grammar randomGrammar(final Random random, final int variableCount, final int maxBodyLength) {
        final List<NonTerminal> variables = new ArrayList<>();
        for (int i = 0; i < variableCount; i++) {
            variables.add(NonTerminal.of(String.valueOf((char) ('A' + i))));
        }

        final Map<NonTerminal, List<Production>> rules = new LinkedHashMap<>();
        for (final NonTerminal variable : variables) {
            final List<Production> productions = new ArrayList<>();
            final int productionCount = 1 + random.nextInt(3);
            for (int p = 0; p < productionCount; p++) {
                final int length = random.nextInt(maxBodyLength + 1);
                if (length == 0) {
                    productions.add(Production.epsilon());
                    continue;
                }
                final List<Symbol> symbols = new ArrayList<>();
                for (int s = 0; s < length; s++) {
                    symbols.add(random.nextBoolean()
                            ? Terminal.of(random.nextBoolean() ? 'a' : 'b')
                            : variables.get(random.nextInt(variables.size())));
                }
                productions.add(Production.of(symbols));
            }
            rules.put(variable, productions);
        }
        return Grammar.of(variables.get(0), rules);
    }
}
