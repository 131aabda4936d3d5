package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Validation report for one request. Instances are immutable; in-flight
 * reports are snapshots of the orchestrator's assembler.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Document(collection = "validation_reports")
public class ValidationReport {

    @Id
    String requestId;

    String documentName;

    @Indexed
    ReportStatus status;

    @Singular
    List<String> requestedChecks;

    @Singular("domainResult")
    Map<String, ValidationResult> perDomain;

    AggregateMetrics aggregate;

    @Singular
    List<String> notes;

    boolean extractionIncomplete;

    String errorMessage;

    @Indexed
    Instant startedAt;

    Instant completedAt;

    Long durationMs;

    AnnotatedDocumentRef annotatedDocument;

    public List<ValidationIssue> allIssues() {
        return perDomain.values().stream()
                .flatMap(r -> r.getIssues().stream())
                .toList();
    }
}
