package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Symbol;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.joining;
import static nl.nfi.cnfnorm.trace.Stage.PRODUCTIVITY;

public final class ProductivityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ProductivityAnalyzer.class);

    private final TraceSink trace;

    public ProductivityAnalyzer(final TraceSink trace) {
        this.trace = trace;
    }

    public Result analyze(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(PRODUCTIVITY, grammar, trace);
        editor.emit("init", List.of(), "Searching for variables that derive terminal strings");

        final Set<NonTerminal> productive = productiveVariables(grammar, (variable, witnesses, pass) ->
                editor.emit("productive", List.of(variable), "%s is productive (pass %d) through: %s".formatted(
                        variable, pass, witnesses.stream().map(body -> variable + " -> " + body).collect(joining(", ")))));
        editor.emit("fixpoint", productive, "Fixpoint reached, productive variables: %s".formatted(productive));

        removeUnproductive(editor, productive);
        final Set<NonTerminal> reachable = reachableVariables(editor.grammar());
        removeUnreachable(editor, reachable);

        final NonTerminal start = grammar.startSymbol();
        final boolean empty = !editor.grammar().hasVariable(start);
        if (empty) {
            // nothing derivable from the start symbol, drop what is left
            for (final NonTerminal variable : editor.grammar().sortedVariables()) {
                editor.removeVariable(variable);
            }
        }
        editor.emit("trim", editor.grammar().sortedVariables(), "Retained productive and reachable variables: %s"
                .formatted(editor.grammar().sortedVariables()));

        LOG.debug("Productive: {}, reachable: {}, empty: {}", productive, reachable, empty);
        editor.emit("result", empty ? List.of() : List.of(start), empty
                ? "Language is empty: start symbol %s is not productive".formatted(start)
                : "Language is not empty: start symbol %s is productive".formatted(start));

        return new Result(editor.grammar(), productive, reachable, empty);
    }

    // removes, without emitting, every production that cannot take part in a terminal derivation from the start symbol
    static void trim(final GrammarEditor editor) {
        removeUnproductive(editor, productiveVariables(editor.grammar(), ProductiveListener.NONE));
        removeUnreachable(editor, reachableVariables(editor.grammar()));
    }

    static Set<NonTerminal> productiveVariables(final Grammar grammar, final ProductiveListener listener) {
        final List<NonTerminal> variables = grammar.sortedVariables();

        Set<NonTerminal> productive = new LinkedHashSet<>();
        for (final NonTerminal variable : variables) {
            final List<Production> witnesses = grammar.productions(variable).stream()
                    .filter(Production::isTerminalOnly)
                    .toList();
            if (!witnesses.isEmpty()) {
                productive.add(variable);
                listener.productive(variable, witnesses, 0);
            }
        }

        final Fixpoint fixpoint = Fixpoint.bounded("productive", variables.size());
        boolean changed = true;
        while (changed) {
            final int pass = fixpoint.nextPass();
            changed = false;
            // read the previous pass only
            final Set<NonTerminal> next = new LinkedHashSet<>(productive);
            for (final NonTerminal variable : variables) {
                if (productive.contains(variable)) {
                    continue;
                }
                final Set<NonTerminal> previous = productive;
                final List<Production> witnesses = grammar.productions(variable).stream()
                        .filter(production -> isProductive(production, previous))
                        .toList();
                if (!witnesses.isEmpty()) {
                    next.add(variable);
                    listener.productive(variable, witnesses, pass);
                    changed = true;
                }
            }
            productive = next;
        }
        return Collections.unmodifiableSet(productive);
    }

    // breadth-first over the nonterminal references, starting at the start symbol
    static Set<NonTerminal> reachableVariables(final Grammar grammar) {
        final Set<NonTerminal> reachable = new LinkedHashSet<>();
        final NonTerminal start = grammar.startSymbol();
        if (!grammar.hasVariable(start)) {
            return reachable;
        }

        final Deque<NonTerminal> queue = new ArrayDeque<>();
        reachable.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            final NonTerminal variable = queue.poll();
            for (final Production production : grammar.productions(variable)) {
                for (final NonTerminal referenced : production.nonTerminals()) {
                    if (grammar.hasVariable(referenced) && reachable.add(referenced)) {
                        queue.add(referenced);
                    }
                }
            }
        }
        return reachable;
    }

    private static boolean isProductive(final Production production, final Set<NonTerminal> productive) {
        if (production.isEpsilon()) {
            return true;
        }
        for (final Symbol symbol : production.symbols()) {
            if (symbol instanceof NonTerminal nonTerminal && !productive.contains(nonTerminal)) {
                return false;
            }
        }
        return true;
    }

    private static void removeUnproductive(final GrammarEditor editor, final Set<NonTerminal> productive) {
        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            for (final Production production : new ArrayList<>(editor.grammar().productions(variable))) {
                if (!productive.contains(variable) || !isProductive(production, productive)) {
                    editor.remove(variable, production);
                }
            }
        }
    }

    private static void removeUnreachable(final GrammarEditor editor, final Set<NonTerminal> reachable) {
        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            if (!reachable.contains(variable)) {
                editor.removeVariable(variable);
            }
        }
    }

    @FunctionalInterface
    interface ProductiveListener {

        ProductiveListener NONE = (variable, witnesses, pass) -> {
        };

        void productive(final NonTerminal variable, final List<Production> witnesses, final int pass);
    }

    public record Result(Grammar grammar, Set<NonTerminal> productive, Set<NonTerminal> reachable, boolean languageEmpty) {

        public Set<NonTerminal> retained() {
            return grammar.variables();
        }
    }
}
