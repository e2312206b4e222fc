package dev.pekelund.medinterp.reportservice;

/**
 * Signals a failure while storing an interpretation result.
 */
public class InterpretationPersistenceException extends RuntimeException {

    public InterpretationPersistenceException(String message) {
        super(message);
    }

    public InterpretationPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
