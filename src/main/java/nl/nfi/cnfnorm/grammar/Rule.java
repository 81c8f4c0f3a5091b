package nl.nfi.cnfnorm.grammar;

// a single production together with its left-hand side, e.g. S -> aSb
public record Rule(NonTerminal lhs, Production body) {

    public static Rule of(final NonTerminal lhs, final Production body) {
        return new Rule(lhs, body);
    }

    @Override
    public String toString() {
        return lhs + " -> " + body;
    }
}
