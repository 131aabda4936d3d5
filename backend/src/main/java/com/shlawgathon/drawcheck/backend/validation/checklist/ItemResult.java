package com.shlawgathon.drawcheck.backend.validation.checklist;

/**
 * Outcome of one checklist item before it is turned into issues and counts.
 */
public record ItemResult(Status status, String message) {

    public enum Status {
        PASS, FAIL, WARN, MISSING_REQUIRED, NOT_APPLICABLE
    }

    public static ItemResult pass(String message) {
        return new ItemResult(Status.PASS, message);
    }

    public static ItemResult fail(String message) {
        return new ItemResult(Status.FAIL, message);
    }

    public static ItemResult warn(String message) {
        return new ItemResult(Status.WARN, message);
    }

    public static ItemResult missingRequired(String input) {
        return new ItemResult(Status.MISSING_REQUIRED, input + " not stated");
    }

    public static ItemResult notApplicable(String reason) {
        return new ItemResult(Status.NOT_APPLICABLE, reason);
    }
}
