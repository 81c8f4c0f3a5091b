package nl.nfi.cnfnorm.trace;

public interface TraceSink {

    void accept(final TransformationEvent event);

    default TraceSink andThen(final TraceSink next) {
        return event -> {
            accept(event);
            next.accept(event);
        };
    }

    static TraceSink noop() {
        return event -> {
        };
    }
}
