package nl.nfi.cnfnorm.grammar;

// a single symbol of a production body, one of:
//      Terminal('a'), NonTerminal("S0"), Epsilon
public sealed interface Symbol permits Terminal, NonTerminal, Epsilon {

    default boolean isTerminal() {
        return this instanceof Terminal;
    }

    default boolean isNonTerminal() {
        return this instanceof NonTerminal;
    }

    default boolean isEpsilon() {
        return this == Epsilon.INSTANCE;
    }
}
