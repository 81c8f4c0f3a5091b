package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.normalize.NormalizationDefectException;

import static nl.nfi.cnfnorm.normalize.NormalizationDefectException.Defect.FIXPOINT_DIVERGED;

// pass counter for monotone set growth over N variables: at most N growing passes plus the final one
final class Fixpoint {

    private final String name;
    private final int maxPasses;
    private int passes;

    private Fixpoint(final String name, final int maxPasses) {
        this.name = name;
        this.maxPasses = maxPasses;
    }

    static Fixpoint bounded(final String name, final int variableCount) {
        return new Fixpoint(name, variableCount + 1);
    }

    int nextPass() {
        passes++;
        if (passes > maxPasses) {
            throw new NormalizationDefectException(FIXPOINT_DIVERGED,
                    "'%s' did not converge within %d passes".formatted(name, maxPasses));
        }
        return passes;
    }

    int passes() {
        return passes;
    }
}
