package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Terminal;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static nl.nfi.cnfnorm.trace.Stage.TERMINAL;

// replaces every terminal inside a production of length >= 2 by a variable producing just that terminal
public final class TerminalIsolator {

    private static final Logger LOG = LoggerFactory.getLogger(TerminalIsolator.class);

    private final VariableAllocator allocator;
    private final TraceSink trace;

    public TerminalIsolator(final VariableAllocator allocator, final TraceSink trace) {
        this.allocator = allocator;
        this.trace = trace;
    }

    public Grammar apply(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(TERMINAL, grammar, trace);
        allocator.reserveAll(grammar.variables());

        final Map<Terminal, NonTerminal> helpers = existingTerminalVariables(grammar);
        editor.emit("init", helpers.values(), "Reusable terminal variables: %s".formatted(helpers));

        for (final NonTerminal variable : grammar.sortedVariables()) {
            for (final Production production : new ArrayList<>(grammar.productions(variable))) {
                if (production.length() < 2 || !production.hasTerminal()) {
                    continue;
                }

                Production isolated = production;
                for (int position = 0; position < production.length(); position++) {
                    if (production.symbolAt(position) instanceof Terminal terminal) {
                        isolated = isolated.withSymbolAt(position, helperFor(terminal, helpers, editor));
                    }
                }

                editor.remove(variable, production);
                editor.add(variable, isolated);
                editor.emit("replace-terminals", List.of(variable), "Replaced %s -> %s by %s -> %s"
                        .formatted(variable, production, variable, isolated));
            }
        }

        LOG.debug("Terminal variables: {}", helpers);
        return editor.grammar();
    }

    // variables other than the start symbol whose only production is a single terminal
    static Map<Terminal, NonTerminal> existingTerminalVariables(final Grammar grammar) {
        final Map<Terminal, NonTerminal> helpers = new LinkedHashMap<>();
        for (final NonTerminal variable : grammar.sortedVariables()) {
            if (variable.equals(grammar.startSymbol())) {
                continue;
            }
            final List<Production> productions = grammar.productions(variable);
            if (productions.size() == 1 && productions.get(0).isSingleTerminal()) {
                helpers.putIfAbsent((Terminal) productions.get(0).symbolAt(0), variable);
            }
        }
        return helpers;
    }

    private NonTerminal helperFor(final Terminal terminal, final Map<Terminal, NonTerminal> helpers, final GrammarEditor editor) {
        final NonTerminal existing = helpers.get(terminal);
        if (existing != null) {
            return existing;
        }
        final NonTerminal helper = allocator.allocate();
        helpers.put(terminal, helper);
        editor.add(helper, Production.of(terminal));
        editor.emit("create-terminal-variable", List.of(helper), "Introduced %s -> %s".formatted(helper, terminal));
        return helper;
    }
}
