package dev.pekelund.medinterp.reportservice;

/**
 * Signals that an uploaded report could not be turned into text.
 */
public class ReportReadException extends RuntimeException {

    public ReportReadException(String message) {
        super(message);
    }

    public ReportReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
