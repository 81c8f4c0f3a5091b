package nl.nfi.cnfnorm.normalize;

import nl.nfi.cnfnorm.grammar.Grammar;

// outcome of a run: the CNF grammar (no rules when the language is empty) and the decided properties;
// the empty language counts as finite
public record NormalizationResult(Grammar grammar, boolean empty, boolean infinite) {

    static NormalizationResult emptyLanguage(final Grammar grammar) {
        return new NormalizationResult(grammar, true, false);
    }

    public boolean finite() {
        return !infinite;
    }
}
