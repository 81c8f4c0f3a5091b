package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.MalformedGrammarException;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;
import nl.nfi.cnfnorm.grammar.Symbol;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static nl.nfi.cnfnorm.trace.Stage.EPSILON;

// removes every epsilon production; the fresh start symbol keeps S0 -> ε if the old one is nullable
public final class EpsilonEliminator {

    private static final Logger LOG = LoggerFactory.getLogger(EpsilonEliminator.class);

    // 2^20 variants of a single production is already far beyond anything sensible
    private static final int MAX_NULLABLE_OCCURRENCES = 20;

    private final NonTerminal preferredStartSymbol;
    private final TraceSink trace;

    public EpsilonEliminator(final NonTerminal preferredStartSymbol, final TraceSink trace) {
        this.preferredStartSymbol = preferredStartSymbol;
        this.trace = trace;
    }

    public Grammar apply(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(EPSILON, grammar, trace);

        final Set<NonTerminal> nullable = nullableVariables(grammar);
        editor.emit("nullable", nullable, "Nullable variables: %s".formatted(nullable));

        final NonTerminal oldStart = grammar.startSymbol();
        final NonTerminal newStart = freshStartSymbol(grammar);
        editor.add(newStart, Production.of(oldStart));
        if (nullable.contains(oldStart)) {
            editor.add(newStart, Production.epsilon());
        }
        editor.startSymbol(newStart);
        editor.emit("new-start", List.of(newStart, oldStart), "Introduced start symbol %s -> %s".formatted(newStart, oldStart));

        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            for (final Production production : new ArrayList<>(editor.grammar().productions(variable))) {
                for (final Production variant : variants(production, nullable)) {
                    editor.add(variable, variant);
                }
            }
            if (editor.hasPendingChanges()) {
                editor.emit("expand", List.of(variable), "Added variants of %s without nullable symbols: %s"
                        .formatted(variable, editor.pendingAdded()));
            }
        }

        final List<NonTerminal> cleared = new ArrayList<>();
        for (final NonTerminal variable : editor.grammar().sortedVariables()) {
            if (!variable.equals(newStart) && editor.remove(variable, Production.epsilon())) {
                cleared.add(variable);
            }
        }
        final int removedEpsilons = editor.pendingRemoved().size();

        // variables whose only production was epsilon are gone now, and so must be every reference to them
        ProductivityAnalyzer.trim(editor);
        final List<Rule> pruned = editor.pendingRemoved().subList(removedEpsilons, editor.pendingRemoved().size());
        editor.emit("remove-epsilon", cleared, pruned.isEmpty()
                ? "Removed epsilon productions of %s".formatted(cleared)
                : "Removed epsilon productions of %s and the productions left without derivation: %s".formatted(cleared, pruned));

        LOG.debug("Nullable: {}, start symbol {} -> {}", nullable, oldStart, newStart);
        return editor.grammar();
    }

    static Set<NonTerminal> nullableVariables(final Grammar grammar) {
        final List<NonTerminal> variables = grammar.sortedVariables();

        Set<NonTerminal> nullable = new LinkedHashSet<>();
        for (final NonTerminal variable : variables) {
            if (grammar.hasProduction(variable, Production.epsilon())) {
                nullable.add(variable);
            }
        }

        final Fixpoint fixpoint = Fixpoint.bounded("nullable", variables.size());
        boolean changed = true;
        while (changed) {
            fixpoint.nextPass();
            changed = false;
            final Set<NonTerminal> next = new LinkedHashSet<>(nullable);
            for (final NonTerminal variable : variables) {
                if (nullable.contains(variable)) {
                    continue;
                }
                for (final Production production : grammar.productions(variable)) {
                    if (isNullable(production, nullable)) {
                        next.add(variable);
                        changed = true;
                        break;
                    }
                }
            }
            nullable = next;
        }
        return Collections.unmodifiableSet(nullable);
    }

    // every variant of the production with a non-empty subset of its nullable occurrences deleted,
    // in order of the deletion bit mask, empty variants excluded
    static List<Production> variants(final Production production, final Set<NonTerminal> nullable) {
        if (production.isEpsilon()) {
            return List.of();
        }

        final List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < production.length(); i++) {
            if (production.symbolAt(i) instanceof NonTerminal nonTerminal && nullable.contains(nonTerminal)) {
                positions.add(i);
            }
        }
        if (positions.size() > MAX_NULLABLE_OCCURRENCES) {
            throw new MalformedGrammarException("Production %s has more than %d nullable occurrences"
                    .formatted(production, MAX_NULLABLE_OCCURRENCES));
        }

        final Set<Production> variants = new LinkedHashSet<>();
        for (int mask = 1; mask < (1 << positions.size()); mask++) {
            final BitSet deleted = new BitSet(production.length());
            for (int bit = 0; bit < positions.size(); bit++) {
                if ((mask & (1 << bit)) != 0) {
                    deleted.set(positions.get(bit));
                }
            }
            final Production variant = production.withoutPositions(deleted);
            if (variant != null) {
                variants.add(variant);
            }
        }
        return new ArrayList<>(variants);
    }

    private NonTerminal freshStartSymbol(final Grammar grammar) {
        if (!isTaken(grammar, preferredStartSymbol)) {
            return preferredStartSymbol;
        }
        final String prefix = preferredStartSymbol.name().substring(0, 1);
        for (int index = 0; index >= 0; index++) {
            final NonTerminal candidate = NonTerminal.of(prefix + index);
            if (!isTaken(grammar, candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free start symbol with prefix " + prefix);
    }

    private static boolean isTaken(final Grammar grammar, final NonTerminal candidate) {
        return grammar.hasVariable(candidate) || grammar.startSymbol().equals(candidate);
    }

    private static boolean isNullable(final Production production, final Set<NonTerminal> nullable) {
        if (production.isEpsilon()) {
            return true;
        }
        for (final Symbol symbol : production.symbols()) {
            if (!(symbol instanceof NonTerminal nonTerminal) || !nullable.contains(nonTerminal)) {
                return false;
            }
        }
        return true;
    }
}
