package nl.nfi.cnfnorm.trace;

// pipeline stages in execution order
public enum Stage {

    PRODUCTIVITY("productivity"),
    EPSILON("epsilon"),
    UNIT("unit"),
    TERMINAL("terminal"),
    BINARY("binary"),
    FINITENESS("finiteness");

    private final String key;

    Stage(final String key) {
        this.key = key;
    }

    // name used in serialized traces
    public String key() {
        return key;
    }

    public static Stage forKey(final String key) {
        for (final Stage stage : values()) {
            if (stage.key.equals(key)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: %s".formatted(key));
    }
}
