package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.model.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when persistence is switched off; results are only logged.
 */
public class NoopInterpretationResultSink implements InterpretationResultSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(NoopInterpretationResultSink.class);

    @Override
    public void save(PipelineResult result) {
        LOGGER.info("Persistence disabled; not storing report {}", result.reportId());
    }
}
