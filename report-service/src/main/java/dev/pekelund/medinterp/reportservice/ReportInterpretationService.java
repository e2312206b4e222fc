package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.model.PipelineResult;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.pipeline.PipelineMdc;
import dev.pekelund.medinterp.pipeline.ReportInterpretationPipeline;
import dev.pekelund.medinterp.pipeline.ReportSubmission;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs submissions through the pipeline and stores the accepted ones.
 */
public class ReportInterpretationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportInterpretationService.class);

    private final ReportInterpretationPipeline pipeline;
    private final InterpretationResultSink resultSink;

    public ReportInterpretationService(ReportInterpretationPipeline pipeline, InterpretationResultSink resultSink) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink");
    }

    public PipelineResult interpret(ReportSubmission submission) {
        String pseudoId = submission != null ? submission.pseudoId() : null;
        try (PipelineMdc.Context ignored = PipelineMdc.forPatient(pseudoId)) {
            PipelineResult result = pipeline.interpret(submission);
            LOGGER.info("Report {} finished as {} ({})", result.reportId(), result.status().value(),
                result.reportType());
            if (result.isAccepted()) {
                store(result);
            }
            return result;
        }
    }

    public Set<ReportType> supportedTypes() {
        return pipeline.supportedTypes();
    }

    private void store(PipelineResult result) {
        try {
            resultSink.save(result);
        } catch (InterpretationPersistenceException ex) {
            LOGGER.error("Failed to store accepted report {}; returning the result unsaved", result.reportId(), ex);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unexpected error while storing accepted report {}; returning the result unsaved",
                result.reportId(), ex);
        }
    }
}
