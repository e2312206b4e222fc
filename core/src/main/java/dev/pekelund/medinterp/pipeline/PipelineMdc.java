package dev.pekelund.medinterp.pipeline;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so every log line of a pipeline run carries the report id and stage. The
 * HTTP request id and the submitting patient's pseudonym share the same keys and scoping.
 */
public final class PipelineMdc {

    public static final String KEY_REPORT_ID = "report.id";
    public static final String KEY_STAGE = "report.stage";
    public static final String KEY_PSEUDO_ID = "report.pseudoId";
    public static final String KEY_REQUEST_ID = "request.id";

    private PipelineMdc() {
        // Utility class
    }

    public static Context open(String reportId) {
        return new Context(KEY_REPORT_ID, reportId);
    }

    public static Context forPatient(String pseudoId) {
        return new Context(KEY_PSEUDO_ID, pseudoId);
    }

    public static Context forRequest(String requestId) {
        return new Context(KEY_REQUEST_ID, requestId);
    }

    static void setStage(PipelineStage stage) {
        if (stage == null) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage.mdcValue());
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String key, String value) {
            this.previous = MDC.getCopyOfContextMap();
            if (StringUtils.hasText(value)) {
                MDC.put(key, value);
            }
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
