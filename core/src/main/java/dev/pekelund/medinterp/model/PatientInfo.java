package dev.pekelund.medinterp.model;

/**
 * Patient block of a result. Only the opaque pseudonymous identifier is carried; date of birth and
 * sex at birth are never resolved here.
 */
public record PatientInfo(String pseudoId, String dob, String sexAtBirth) {

    public static PatientInfo pseudonymous(String pseudoId) {
        return new PatientInfo(pseudoId, null, null);
    }
}
