package dev.pekelund.medinterp.reportservice;

/**
 * Signals that the language model could not produce observations for a report.
 */
public class ObservationExtractionException extends RuntimeException {

    public ObservationExtractionException(String message) {
        super(message);
    }

    public ObservationExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
