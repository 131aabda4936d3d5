package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Progress event emitted while a request moves through the pipeline.
 */
@Value
@Builder
@Jacksonized
public class ValidationProgress {
    String requestId;
    ReportStatus phase;
    int percent;
    String message;
    Instant timestamp;
}
