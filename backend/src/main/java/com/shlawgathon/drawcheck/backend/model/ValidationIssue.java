package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Finding produced by a validator.
 */
@Value
@Builder
@Jacksonized
public class ValidationIssue {
    Severity severity;
    String checkType;
    String message;
    IssueLocation location;
    String suggestion;
    String standardReference;
}
