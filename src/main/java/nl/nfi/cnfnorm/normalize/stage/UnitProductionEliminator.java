package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;
import nl.nfi.cnfnorm.normalize.NormalizationDefectException;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static nl.nfi.cnfnorm.normalize.NormalizationDefectException.Defect.START_SYMBOL_INEXPANSIBLE;
import static nl.nfi.cnfnorm.trace.Stage.UNIT;

// replaces unit productions A -> B by the non-unit productions reachable through them
public final class UnitProductionEliminator {

    private static final Logger LOG = LoggerFactory.getLogger(UnitProductionEliminator.class);

    private final TraceSink trace;

    public UnitProductionEliminator(final TraceSink trace) {
        this.trace = trace;
    }

    public Grammar apply(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(UNIT, grammar, trace);
        final NonTerminal start = grammar.startSymbol();

        final Map<NonTerminal, Set<NonTerminal>> closure = unitClosure(grammar);
        editor.emit("closure", List.of(), "Unit closure: %s".formatted(closure));

        for (final NonTerminal variable : grammar.sortedVariables()) {
            for (final NonTerminal target : closure.get(variable)) {
                if (target.equals(variable) || !editor.grammar().hasVariable(target)) {
                    continue;
                }
                for (final Production production : new ArrayList<>(editor.grammar().productions(target))) {
                    if (production.isUnit()) {
                        continue;
                    }
                    // the start symbol must stay off every right-hand side
                    if (!variable.equals(start) && production.contains(start)) {
                        continue;
                    }
                    editor.add(variable, production);
                }
            }
            if (editor.hasPendingChanges()) {
                editor.emit("copy", List.of(variable), "Copied non-unit productions into %s: %s"
                        .formatted(variable, editor.pendingAdded()));
            }
        }

        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            for (final Production production : new ArrayList<>(editor.grammar().productions(variable))) {
                if (production.isUnit()) {
                    editor.remove(variable, production);
                }
            }
            if (editor.hasPendingChanges()) {
                editor.emit("remove-unit", List.of(variable), "Removed unit productions of %s: %s"
                        .formatted(variable, editor.pendingRemoved()));
            }
        }

        protectStartSymbol(editor);

        final Set<NonTerminal> reachable = ProductivityAnalyzer.reachableVariables(editor.grammar());
        final List<NonTerminal> unreachable = new ArrayList<>();
        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            if (!reachable.contains(variable)) {
                editor.removeVariable(variable);
                unreachable.add(variable);
            }
        }
        if (!unreachable.isEmpty()) {
            editor.emit("prune", unreachable, "Removed variables unreachable from %s: %s".formatted(start, unreachable));
        }

        LOG.debug("Unit closure: {}, unreachable after elimination: {}", closure, unreachable);
        return editor.grammar();
    }

    // reflexive-transitive closure of the unit relation, targets in alphabetical order
    static Map<NonTerminal, Set<NonTerminal>> unitClosure(final Grammar grammar) {
        final List<NonTerminal> variables = grammar.sortedVariables();

        Map<NonTerminal, Set<NonTerminal>> closure = new LinkedHashMap<>();
        for (final NonTerminal variable : variables) {
            final Set<NonTerminal> reflexive = new TreeSet<>();
            reflexive.add(variable);
            closure.put(variable, reflexive);
        }

        final Fixpoint fixpoint = Fixpoint.bounded("unit closure", variables.size());
        boolean changed = true;
        while (changed) {
            fixpoint.nextPass();
            changed = false;
            final Map<NonTerminal, Set<NonTerminal>> next = new LinkedHashMap<>();
            for (final NonTerminal variable : variables) {
                final Set<NonTerminal> targets = new TreeSet<>(closure.get(variable));
                for (final NonTerminal via : closure.get(variable)) {
                    for (final Production production : grammar.productions(via)) {
                        if (production.isUnit() && targets.add((NonTerminal) production.symbolAt(0))) {
                            changed = true;
                        }
                    }
                }
                next.put(variable, targets);
            }
            closure = next;
        }

        final Map<NonTerminal, Set<NonTerminal>> result = new LinkedHashMap<>();
        closure.forEach((variable, targets) -> result.put(variable, Collections.unmodifiableSet(targets)));
        return Collections.unmodifiableMap(result);
    }

    // substitutes every remaining occurrence of the start symbol outside its own rule
    private static void protectStartSymbol(final GrammarEditor editor) {
        final NonTerminal start = editor.grammar().startSymbol();

        final List<NonTerminal> offending = new ArrayList<>();
        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            if (variable.equals(start)) {
                continue;
            }
            if (editor.grammar().productions(variable).stream().anyMatch(production -> production.contains(start))) {
                offending.add(variable);
            }
        }
        if (offending.isEmpty()) {
            return;
        }

        final List<Production> substitutes = editor.grammar().hasVariable(start)
                ? editor.grammar().productions(start).stream()
                .filter(production -> !production.isEpsilon() && !production.contains(start))
                .toList()
                : List.of();
        if (substitutes.isEmpty()) {
            throw new NormalizationDefectException(START_SYMBOL_INEXPANSIBLE,
                    "%s occurs in the productions of %s but has no production to substitute".formatted(start, offending));
        }

        // all removals before all additions, the order in which the delta is replayed
        final List<Rule> rewritten = new ArrayList<>();
        for (final NonTerminal variable : offending) {
            for (final Production production : new ArrayList<>(editor.grammar().productions(variable))) {
                if (production.contains(start)) {
                    editor.remove(variable, production);
                    rewritten.add(Rule.of(variable, production));
                }
            }
        }
        for (final Rule rule : rewritten) {
            for (final Production expanded : expand(rule.body(), start, substitutes)) {
                editor.add(rule.lhs(), expanded);
            }
        }
        editor.emit("protect-start", offending, "Substituted %s in the productions of %s".formatted(start, offending));
    }

    // every combination of substitutes for the occurrences of the start symbol
    private static List<Production> expand(final Production production, final NonTerminal start, final List<Production> substitutes) {
        List<Production> expanded = List.of(production);
        while (expanded.get(0).contains(start)) {
            final List<Production> next = new ArrayList<>();
            for (final Production partial : expanded) {
                final int position = partial.symbols().indexOf(start);
                for (final Production substitute : substitutes) {
                    next.add(partial.withSubstituted(position, substitute));
                }
            }
            expanded = next;
        }
        return expanded;
    }
}
