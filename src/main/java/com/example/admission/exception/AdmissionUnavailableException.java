package com.example.admission.exception;

/**
 * Raised only in fail-closed mode, when the counter store cannot be reached and limits
 * cannot be enforced.
 */
public class AdmissionUnavailableException extends RuntimeException {

    public AdmissionUnavailableException(String message) {
        super(message);
    }
}
