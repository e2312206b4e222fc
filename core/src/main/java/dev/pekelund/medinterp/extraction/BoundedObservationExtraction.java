package dev.pekelund.medinterp.extraction;

import dev.pekelund.medinterp.model.ObservationSet;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs an extractor on the supplied executor and waits at most {@code timeout} for its answer.
 * Collaborator failures, timeouts and unparseable responses all come back as a zero-confidence
 * outcome; nothing is thrown.
 */
public class BoundedObservationExtraction {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedObservationExtraction.class);

    private final Executor executor;
    private final Duration timeout;
    private final ExtractionResponseParser parser;

    public BoundedObservationExtraction(Executor executor, Duration timeout, ExtractionResponseParser parser) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Extraction timeout must be positive but was " + timeout);
        }
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public ExtractionOutcome extract(ObservationExtractor extractor, ExtractionRequest request) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        FutureTask<String> task = new FutureTask<>(() -> invoke(extractor, request, callerContext));

        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Extraction task for {} was rejected by the executor", request.reportType(), ex);
            return ExtractionOutcome.failed("extraction rejected: " + ex.getMessage());
        }

        String response;
        try {
            response = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancel(true);
            LOGGER.warn("Extraction for {} did not finish within {} ms; cancelled", request.reportType(), timeout.toMillis());
            return ExtractionOutcome.failed("extraction timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOGGER.warn("Extractor for {} failed: {}", request.reportType(), cause.getMessage(), cause);
            return ExtractionOutcome.failed("extractor failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for extraction of {}", request.reportType());
            return ExtractionOutcome.failed("extraction interrupted");
        }

        Optional<ObservationSet> parsed = parser.parse(response);
        if (parsed.isEmpty()) {
            return ExtractionOutcome.failed("extractor response did not match the observation schema");
        }
        ObservationSet observations = parsed.get();
        double confidence = ExtractionConfidenceScorer.score(observations);
        LOGGER.info("Extracted {} observations (panel '{}') with confidence {}", observations.size(),
            observations.panelName(), confidence);
        return new ExtractionOutcome(observations, confidence, null);
    }

    private static String invoke(ObservationExtractor extractor, ExtractionRequest request,
        Map<String, String> callerContext) {

        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        try {
            return extractor.extract(request);
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
