package dev.pekelund.medinterp.reportservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.medinterp.model.PipelineResult;
import dev.pekelund.medinterp.model.ReportText;
import dev.pekelund.medinterp.pipeline.PipelineMdc;
import dev.pekelund.medinterp.pipeline.ReportInterpretationPipeline;
import dev.pekelund.medinterp.pipeline.ReportSubmission;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class ReportInterpretationServiceTest {

    private static final ReportSubmission SUBMISSION =
        ReportSubmission.of(new ReportText("LDL 160 mg/dL", 0.9), "p-1");

    @Mock
    private ReportInterpretationPipeline pipeline;

    @Mock
    private InterpretationResultSink resultSink;

    private ReportInterpretationService service;

    @BeforeEach
    void setUp() {
        service = new ReportInterpretationService(pipeline, resultSink);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void storesAcceptedResults() {
        PipelineResult accepted = ReportResults.accepted("report_1_abc", "p-1");
        when(pipeline.interpret(SUBMISSION)).thenReturn(accepted);

        assertThat(service.interpret(SUBMISSION)).isSameAs(accepted);
        verify(resultSink).save(accepted);
    }

    @Test
    void neverStoresDiscardedResults() {
        PipelineResult discarded = ReportResults.discarded("report_2_def", "p-1", "Please try again.");
        when(pipeline.interpret(SUBMISSION)).thenReturn(discarded);

        assertThat(service.interpret(SUBMISSION)).isSameAs(discarded);
        verify(resultSink, never()).save(any());
    }

    @Test
    void persistenceFailureStillReturnsTheResult() {
        PipelineResult accepted = ReportResults.accepted("report_1_abc", "p-1");
        when(pipeline.interpret(SUBMISSION)).thenReturn(accepted);
        doThrow(new InterpretationPersistenceException("Firestore unavailable")).when(resultSink).save(accepted);

        assertThat(service.interpret(SUBMISSION)).isSameAs(accepted);
    }

    @Test
    void unexpectedSinkErrorStillReturnsTheAcceptedResult() {
        PipelineResult accepted = ReportResults.accepted("report_1_abc", "p-1");
        when(pipeline.interpret(SUBMISSION)).thenReturn(accepted);
        doThrow(new IllegalStateException("Firestore client has already been closed")).when(resultSink).save(accepted);

        PipelineResult result = service.interpret(SUBMISSION);

        assertThat(result).isSameAs(accepted);
        verify(resultSink).save(accepted);
        assertThat(MDC.get(PipelineMdc.KEY_PSEUDO_ID)).isNull();
    }

    @Test
    void keepsOuterLoggingContext() {
        MDC.put(PipelineMdc.KEY_REQUEST_ID, "req-7");
        when(pipeline.interpret(SUBMISSION)).thenReturn(ReportResults.discarded("report_2_def", "p-1", "Retry."));

        service.interpret(SUBMISSION);

        assertThat(MDC.get(PipelineMdc.KEY_REQUEST_ID)).isEqualTo("req-7");
        assertThat(MDC.get(PipelineMdc.KEY_PSEUDO_ID)).isNull();
    }

    @Test
    void tagsLogsWithPseudoIdDuringTheRun() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(pipeline.interpret(SUBMISSION)).thenAnswer(invocation -> {
            seen.set(MDC.get(PipelineMdc.KEY_PSEUDO_ID));
            return ReportResults.discarded("report_2_def", "p-1", "Please try again.");
        });

        service.interpret(SUBMISSION);

        assertThat(seen.get()).isEqualTo("p-1");
        assertThat(MDC.get(PipelineMdc.KEY_PSEUDO_ID)).isNull();
    }
}
