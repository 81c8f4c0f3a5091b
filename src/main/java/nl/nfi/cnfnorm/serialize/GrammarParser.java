package nl.nfi.cnfnorm.serialize;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.MalformedGrammarException;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.nio.file.Files.exists;
import static java.nio.file.Files.readAllLines;

// reads grammars written one rule per line, e.g.:
//      # comment
//      S -> aSb | eps
//      S -> A
//      A -> a
// lines with the same left-hand side are merged
public final class GrammarParser {

    public static Grammar loadFrom(final Path path) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Grammar file does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path));
    }

    public static Grammar parse(final String text) {
        return parse(text.lines().toList());
    }

    public static Grammar parse(final List<String> lines) {
        return parse(lines, null);
    }

    // startSymbol null means the left-hand side of the first rule
    public static Grammar parse(final List<String> lines, final NonTerminal startSymbol) {
        final Map<NonTerminal, Set<Production>> rules = new LinkedHashMap<>();

        for (int index = 0; index < lines.size(); index++) {
            final String line = stripComment(lines.get(index)).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                final int arrow = arrowIndex(line);
                final NonTerminal lhs = NonTerminal.of(line.substring(0, arrow).trim());
                final String rhs = line.substring(arrow + arrowLength(line, arrow));

                final Set<Production> productions = rules.computeIfAbsent(lhs, key -> new LinkedHashSet<>());
                for (final String alternative : rhs.split("\\|", -1)) {
                    productions.add(ProductionTokenizer.tokenize(alternative));
                }
            } catch (final MalformedGrammarException e) {
                throw new MalformedGrammarException("Line %d: %s".formatted(index + 1, e.getMessage()), e);
            }
        }

        if (rules.isEmpty()) {
            throw new MalformedGrammarException("Grammar contains no rules");
        }
        final NonTerminal start = startSymbol != null ? startSymbol : rules.keySet().iterator().next();
        return Grammar.of(start, rules);
    }

    // a single "LHS -> body" line as written by GrammarFormatter.formatRule
    public static Rule parseRule(final String line) {
        final int arrow = arrowIndex(line);
        final NonTerminal lhs = NonTerminal.of(line.substring(0, arrow).trim());
        return Rule.of(lhs, ProductionTokenizer.tokenize(line.substring(arrow + arrowLength(line, arrow))));
    }

    private static String stripComment(final String line) {
        final int comment = line.indexOf('#');
        return comment < 0 ? line : line.substring(0, comment);
    }

    private static int arrowIndex(final String line) {
        final int ascii = line.indexOf("->");
        final int unicode = line.indexOf('→');
        if (ascii < 0 && unicode < 0) {
            throw new MalformedGrammarException("Missing '->' in '%s'".formatted(line));
        }
        if (ascii < 0) {
            return unicode;
        }
        return unicode < 0 ? ascii : Math.min(ascii, unicode);
    }

    private static int arrowLength(final String line, final int arrow) {
        return line.charAt(arrow) == '→' ? 1 : 2;
    }
}
