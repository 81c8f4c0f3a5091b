package nl.nfi.cnfnorm.trace;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Rule;

import java.util.List;
import java.util.Optional;

// difference between two consecutive snapshots, applied as:
//      remove every rule of removed, append every rule of added, then switch start symbol
public record GrammarDelta(Optional<NonTerminal> startSymbol, List<Rule> removed, List<Rule> added) {

    private static final GrammarDelta NONE = new GrammarDelta(Optional.empty(), List.of(), List.of());

    public GrammarDelta {
        removed = List.copyOf(removed);
        added = List.copyOf(added);
    }

    public static GrammarDelta none() {
        return NONE;
    }

    public boolean isEmpty() {
        return startSymbol.isEmpty() && removed.isEmpty() && added.isEmpty();
    }

    public Grammar applyTo(final Grammar grammar) {
        Grammar result = grammar;
        for (final Rule rule : removed) {
            result = result.withoutProduction(rule.lhs(), rule.body());
        }
        for (final Rule rule : added) {
            result = result.withProduction(rule.lhs(), rule.body());
        }
        if (startSymbol.isPresent()) {
            result = result.withStartSymbol(startSymbol.get());
        }
        return result;
    }
}
