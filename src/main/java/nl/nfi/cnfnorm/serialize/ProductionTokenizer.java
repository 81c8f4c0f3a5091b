package nl.nfi.cnfnorm.serialize;

import nl.nfi.cnfnorm.grammar.Epsilon;
import nl.nfi.cnfnorm.grammar.MalformedGrammarException;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Symbol;
import nl.nfi.cnfnorm.grammar.Terminal;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// splits a single alternative into symbols, whitespace is insignificant:
//      "aS0b"  -> [a, S0, b]
//      "X D12" -> [X, D12]
//      "eps"   -> [ε]
public final class ProductionTokenizer {

    private static final Set<String> EPSILON_SPELLINGS = Set.of(Epsilon.DISPLAY, "eps", "_");

    public static Production tokenize(final String alternative) {
        final String trimmed = alternative.trim();
        if (trimmed.isEmpty()) {
            throw new MalformedGrammarException("Empty alternative, use 'eps' for the empty word");
        }
        if (EPSILON_SPELLINGS.contains(trimmed)) {
            return Production.epsilon();
        }

        final List<Symbol> symbols = new ArrayList<>();
        int position = 0;
        while (position < trimmed.length()) {
            final char current = trimmed.charAt(position);
            if (Character.isWhitespace(current)) {
                position++;
            } else if (current >= 'A' && current <= 'Z') {
                int end = position + 1;
                while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
                    end++;
                }
                symbols.add(NonTerminal.of(trimmed.substring(position, end)));
                position = end;
            } else if (current >= 'a' && current <= 'z') {
                symbols.add(Terminal.of(current));
                position++;
            } else if (current == '_' || Epsilon.DISPLAY.charAt(0) == current) {
                throw new MalformedGrammarException("Epsilon cannot be combined with other symbols: '%s'".formatted(trimmed));
            } else {
                throw new MalformedGrammarException("Unexpected character '%s' in '%s'".formatted(current, trimmed));
            }
        }
        return Production.of(symbols);
    }
}
