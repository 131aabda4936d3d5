package com.shlawgathon.drawcheck.backend.orchestration;

import com.shlawgathon.drawcheck.backend.model.AggregateMetrics;
import com.shlawgathon.drawcheck.backend.model.AnnotatedDocumentRef;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the pieces of one report while the pipeline runs. Everything is
 * append-only; once {@link #complete} or {@link #fail} has been called the
 * assembler rejects further changes.
 */
class ReportAssembler {

    private final String requestId;
    private final String documentName;
    private final List<String> requestedChecks;
    private final Clock clock;
    private final Instant startedAt;

    private final Map<ValidationDomain, ValidationResult> results = new EnumMap<>(ValidationDomain.class);
    private final List<String> notes = new ArrayList<>();
    private ReportStatus status = ReportStatus.QUEUED;
    private boolean extractionIncomplete;
    private AnnotatedDocumentRef annotatedDocument;
    private String errorMessage;
    private Instant completedAt;

    ReportAssembler(String requestId, String documentName, List<String> requestedChecks, Clock clock) {
        this.requestId = requestId;
        this.documentName = documentName;
        this.requestedChecks = List.copyOf(requestedChecks);
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    synchronized void status(ReportStatus next) {
        ensureOpen();
        if (next.ordinal() < status.ordinal()) {
            throw new IllegalStateException("Report " + requestId + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    synchronized ReportStatus status() {
        return status;
    }

    synchronized void note(String note) {
        ensureOpen();
        notes.add(note);
    }

    synchronized void result(ValidationDomain domain, ValidationResult result) {
        ensureOpen();
        if (results.putIfAbsent(domain, result) != null) {
            throw new IllegalStateException("Result for " + domain.key() + " already recorded");
        }
    }

    synchronized void extractionIncomplete(boolean incomplete) {
        ensureOpen();
        extractionIncomplete = extractionIncomplete || incomplete;
    }

    synchronized void annotatedDocument(AnnotatedDocumentRef ref) {
        ensureOpen();
        annotatedDocument = ref;
    }

    synchronized ValidationReport complete() {
        ensureOpen();
        status = ReportStatus.COMPLETE;
        completedAt = clock.instant();
        return snapshot();
    }

    synchronized ValidationReport fail(String message) {
        ensureOpen();
        status = ReportStatus.FAILED;
        errorMessage = message;
        results.clear();
        completedAt = clock.instant();
        return snapshot();
    }

    synchronized boolean isFinal() {
        return completedAt != null;
    }

    /**
     * Immutable view of the report as it stands. Domains appear in domain
     * order regardless of the order their validators finished in.
     */
    synchronized ValidationReport snapshot() {
        ValidationReport.ValidationReportBuilder builder = ValidationReport.builder()
                .requestId(requestId)
                .documentName(documentName)
                .status(status)
                .requestedChecks(requestedChecks)
                .notes(notes)
                .extractionIncomplete(extractionIncomplete)
                .errorMessage(errorMessage)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(completedAt == null ? null : Duration.between(startedAt, completedAt).toMillis())
                .annotatedDocument(annotatedDocument);
        results.forEach((domain, result) -> builder.domainResult(domain.key(), result));
        builder.aggregate(results.isEmpty() ? AggregateMetrics.empty() : ReportAggregator.aggregate(results.values()));
        return builder.build();
    }

    private void ensureOpen() {
        if (completedAt != null) {
            throw new IllegalStateException("Report " + requestId + " is already finalized");
        }
    }
}
