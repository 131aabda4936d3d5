package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-phase totals of the equipment checklist.
 */
@Value
@Builder
@Jacksonized
public class PhaseSummary {
    String phase;
    int total;
    int passed;
    int failed;
    int warnings;
    int notApplicable;
    double passRate;
}
