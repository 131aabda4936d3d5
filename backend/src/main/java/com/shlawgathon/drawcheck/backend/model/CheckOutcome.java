package com.shlawgathon.drawcheck.backend.model;

/**
 * Result of a single check. NOT_APPLICABLE checks are not counted.
 */
public enum CheckOutcome {
    PASSED,
    FAILED,
    WARNING,
    NOT_APPLICABLE
}
