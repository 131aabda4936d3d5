package com.shlawgathon.drawcheck.backend.model;

/**
 * Lifecycle of a validation report. Declaration order is the progress order.
 */
public enum ReportStatus {
    QUEUED(0),
    EXTRACTING(10),
    VALIDATING(30),
    AGGREGATING(85),
    COMPLETE(100),
    FAILED(100);

    private final int basePercent;

    ReportStatus(int basePercent) {
        this.basePercent = basePercent;
    }

    /**
     * Progress percent at which the phase starts.
     */
    public int basePercent() {
        return basePercent;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
