package nl.nfi.cnfnorm.trace;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;

import java.util.List;

// one discrete, externally visible change (or observation) of a stage, e.g.:
//      stage = EPSILON, action = "expand", affected = [S], delta = {+S -> ab}
// snapshot is the grammar after the delta has been applied
public record TransformationEvent(Stage stage,
                                  String action,
                                  List<NonTerminal> affectedVariables,
                                  GrammarDelta delta,
                                  Grammar snapshot,
                                  String description) {

    public TransformationEvent {
        affectedVariables = List.copyOf(affectedVariables);
    }
}
