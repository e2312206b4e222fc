package dev.pekelund.medinterp.extraction;

/**
 * External collaborator that turns report text into a structured JSON document of the shape
 * {@code {"panelName": ..., "observations": [...]}}. Implementations may throw any unchecked
 * exception; the pipeline treats a failure as an empty extraction.
 */
@FunctionalInterface
public interface ObservationExtractor {

    String extract(ExtractionRequest request);
}
