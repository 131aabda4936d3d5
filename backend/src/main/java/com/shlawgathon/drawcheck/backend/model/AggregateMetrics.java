package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Totals summed over every domain that ran.
 */
@Value
@Builder
@Jacksonized
public class AggregateMetrics {
    int totalChecks;
    int passed;
    int failed;
    int warnings;
    int criticalFailures;
    double passRate;

    public static AggregateMetrics empty() {
        return new AggregateMetrics(0, 0, 0, 0, 0, 0.0);
    }
}
