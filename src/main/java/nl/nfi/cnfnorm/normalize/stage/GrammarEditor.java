package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;
import nl.nfi.cnfnorm.trace.GrammarDelta;
import nl.nfi.cnfnorm.trace.Stage;
import nl.nfi.cnfnorm.trace.TraceSink;
import nl.nfi.cnfnorm.trace.TransformationEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

// working grammar of a single stage; collects edits until they are emitted as one event
final class GrammarEditor {

    private final Stage stage;
    private final TraceSink trace;

    private Grammar grammar;
    private NonTerminal pendingStartSymbol;
    private final List<Rule> pendingRemoved = new ArrayList<>();
    private final List<Rule> pendingAdded = new ArrayList<>();

    GrammarEditor(final Stage stage, final Grammar grammar, final TraceSink trace) {
        this.stage = stage;
        this.grammar = grammar;
        this.trace = trace;
    }

    Grammar grammar() {
        return grammar;
    }

    boolean add(final NonTerminal variable, final Production production) {
        final Grammar updated = grammar.withProduction(variable, production);
        if (updated == grammar) {
            return false;
        }
        grammar = updated;
        pendingAdded.add(Rule.of(variable, production));
        return true;
    }

    boolean remove(final NonTerminal variable, final Production production) {
        final Grammar updated = grammar.withoutProduction(variable, production);
        if (updated == grammar) {
            return false;
        }
        grammar = updated;
        final Rule rule = Rule.of(variable, production);
        // added and removed again within the same event, nothing to replay
        if (!pendingAdded.remove(rule)) {
            pendingRemoved.add(rule);
        }
        return true;
    }

    void removeVariable(final NonTerminal variable) {
        if (!grammar.hasVariable(variable)) {
            return;
        }
        for (final Production production : List.copyOf(grammar.productions(variable))) {
            remove(variable, production);
        }
    }

    void startSymbol(final NonTerminal startSymbol) {
        grammar = grammar.withStartSymbol(startSymbol);
        pendingStartSymbol = startSymbol;
    }

    boolean hasPendingChanges() {
        return pendingStartSymbol != null || !pendingRemoved.isEmpty() || !pendingAdded.isEmpty();
    }

    List<Rule> pendingAdded() {
        return List.copyOf(pendingAdded);
    }

    List<Rule> pendingRemoved() {
        return List.copyOf(pendingRemoved);
    }

    TransformationEvent emit(final String action, final Collection<NonTerminal> affectedVariables, final String description) {
        final GrammarDelta delta = hasPendingChanges()
                ? new GrammarDelta(Optional.ofNullable(pendingStartSymbol), pendingRemoved, pendingAdded)
                : GrammarDelta.none();
        final TransformationEvent event = new TransformationEvent(stage, action, List.copyOf(affectedVariables), delta, grammar, description);

        pendingStartSymbol = null;
        pendingRemoved.clear();
        pendingAdded.clear();

        trace.accept(event);
        return event;
    }
}
