package nl.nfi.cnfnorm.serialize;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

// start symbol first, then the other variables alphabetically:
//      S0 -> ε | ZY
//      Y -> b
//      Z -> a
public final class GrammarFormatter {

    public static String format(final Grammar grammar) {
        return String.join("\n", formatLines(grammar));
    }

    public static List<String> formatLines(final Grammar grammar) {
        final List<String> lines = new ArrayList<>();
        for (final NonTerminal variable : displayOrder(grammar)) {
            lines.add(variable + " -> " + grammar.productions(variable).stream()
                    .map(Production::toString)
                    .collect(joining(" | ")));
        }
        return lines;
    }

    public static String formatRule(final Rule rule) {
        return rule.lhs() + " -> " + rule.body();
    }

    static List<NonTerminal> displayOrder(final Grammar grammar) {
        final List<NonTerminal> order = new ArrayList<>();
        if (grammar.hasVariable(grammar.startSymbol())) {
            order.add(grammar.startSymbol());
        }
        for (final NonTerminal variable : grammar.sortedVariables()) {
            if (!variable.equals(grammar.startSymbol())) {
                order.add(variable);
            }
        }
        return order;
    }
}
