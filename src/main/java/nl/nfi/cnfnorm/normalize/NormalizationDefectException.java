package nl.nfi.cnfnorm.normalize;

// internal defect of the pipeline, never retried
public class NormalizationDefectException extends IllegalStateException {

    public enum Defect {
        ALLOCATOR_EXHAUSTED,
        FIXPOINT_DIVERGED,
        START_SYMBOL_INEXPANSIBLE,
        CNF_VIOLATED
    }

    private final Defect defect;

    public NormalizationDefectException(final Defect defect, final String message) {
        super("%s: %s".formatted(defect, message));
        this.defect = defect;
    }

    public Defect defect() {
        return defect;
    }
}
