package nl.nfi.cnfnorm.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingTraceSink implements TraceSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingTraceSink.class);

    @Override
    public void accept(final TransformationEvent event) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        final GrammarDelta delta = event.delta();
        LOG.debug("[{}] {} {}: -{} +{} {}", event.stage().key(), event.action(), event.affectedVariables(),
                delta.removed(), delta.added(), event.description());
    }
}
