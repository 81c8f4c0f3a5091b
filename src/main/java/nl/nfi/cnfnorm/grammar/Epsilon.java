package nl.nfi.cnfnorm.grammar;

public enum Epsilon implements Symbol {

    INSTANCE;

    public static final String DISPLAY = "ε";

    @Override
    public String toString() {
        return DISPLAY;
    }
}
