package dev.pekelund.medinterp.model;

/**
 * Result of a single validation check.
 *
 * @param outcome  pass, warn or fail
 * @param message  human readable description
 * @param field    observation code the finding refers to, or {@code null} for set-level findings
 */
public record ValidationFinding(ValidationOutcome outcome, String message, String field) {

    public static ValidationFinding pass(String message) {
        return new ValidationFinding(ValidationOutcome.PASS, message, null);
    }

    public static ValidationFinding warn(String message, String field) {
        return new ValidationFinding(ValidationOutcome.WARN, message, field);
    }

    public static ValidationFinding fail(String message, String field) {
        return new ValidationFinding(ValidationOutcome.FAIL, message, field);
    }

    public boolean isFailure() {
        return outcome == ValidationOutcome.FAIL;
    }
}
