package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.model.PipelineResult;

/**
 * Destination for accepted interpretation results.
 */
public interface InterpretationResultSink {

    /**
     * @throws InterpretationPersistenceException when the result could not be stored
     */
    void save(PipelineResult result);
}
