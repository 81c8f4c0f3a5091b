package nl.nfi.cnfnorm.grammar;

public record Terminal(char value) implements Symbol {

    public Terminal {
        if (value < 'a' || value > 'z') {
            throw new MalformedGrammarException("Terminal must be a single lowercase letter: '%s'".formatted(value));
        }
    }

    public static Terminal of(final char value) {
        return new Terminal(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
