package com.shlawgathon.drawcheck.backend.orchestration;

/**
 * Raised inside the pipeline once a request has been cancelled.
 */
public class ValidationCancelledException extends RuntimeException {

    public ValidationCancelledException(String requestId) {
        super("Validation cancelled: " + requestId);
    }
}
