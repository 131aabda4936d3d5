package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of one validation domain.
 */
@Value
@Builder
@Jacksonized
public class ValidationResult {
    String domain;
    int totalChecks;
    int passed;
    int failed;
    int warnings;

    @Singular
    List<ValidationIssue> issues;

    @Singular
    List<PhaseSummary> phases;

    public long countIssues(Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }
}
