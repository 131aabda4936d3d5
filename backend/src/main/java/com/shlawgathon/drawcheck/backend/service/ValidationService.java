package com.shlawgathon.drawcheck.backend.service;

import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocument;
import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocumentStore;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.orchestration.ValidationOrchestrator;
import com.shlawgathon.drawcheck.backend.orchestration.ValidationRequest;
import com.shlawgathon.drawcheck.backend.pubsub.ValidationEventPublisher;
import com.shlawgathon.drawcheck.backend.repository.ValidationReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Submits drawings to the orchestrator and keeps the stored report in step
 * with the pipeline: a QUEUED report on submit, status updates on phase
 * changes and the final report once the pipeline finishes.
 */
@Service
public class ValidationService {

    private static final Logger log = LoggerFactory.getLogger(ValidationService.class);

    static final String INTERRUPTED_MESSAGE = "Interrupted by service restart";

    private static final int MAX_RECENT = 100;

    private final ValidationOrchestrator orchestrator;
    private final ValidationReportRepository reportRepository;
    private final AnnotatedDocumentStore documentStore;
    private final ValidationEventPublisher eventPublisher;
    private final Clock clock;

    public ValidationService(ValidationOrchestrator orchestrator,
            ValidationReportRepository reportRepository,
            AnnotatedDocumentStore documentStore,
            ValidationEventPublisher eventPublisher,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.reportRepository = reportRepository;
        this.documentStore = documentStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Start a validation run and return the stored QUEUED report.
     */
    public ValidationReport submit(String documentName, byte[] document, List<String> checks,
            Map<String, Map<String, Object>> params, boolean annotate) {
        if (document == null || document.length == 0) {
            throw new IllegalArgumentException("Document is empty");
        }
        String requestId = UUID.randomUUID().toString();
        ValidationRequest request = ValidationRequest.builder()
                .requestId(requestId)
                .documentName(documentName != null ? documentName : "drawing.pdf")
                .document(document)
                .checks(checks != null ? checks : List.of())
                .params(params != null ? params : Map.of())
                .annotate(annotate)
                .build();

        ValidationReport queued = reportRepository.save(ValidationReport.builder()
                .requestId(requestId)
                .documentName(request.getDocumentName())
                .status(ReportStatus.QUEUED)
                .requestedChecks(request.getChecks())
                .startedAt(clock.instant())
                .build());
        log.info("[VALIDATION] Submitted {} ({} bytes) as {}", request.getDocumentName(), document.length,
                requestId);

        orchestrator.validate(request, this::onProgress)
                .whenComplete((report, error) -> {
                    if (error != null) {
                        log.error("[VALIDATION] {} pipeline did not produce a report", requestId, error);
                        return;
                    }
                    reportRepository.save(report);
                    log.info("[VALIDATION] {} stored with status {}", requestId, report.getStatus());
                });
        return queued;
    }

    public Optional<ValidationReport> find(String requestId) {
        return reportRepository.findById(requestId);
    }

    public List<ValidationReport> recent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        return reportRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, size)).getContent();
    }

    /**
     * Request cancellation of a running validation. The report itself turns
     * FAILED once the pipeline observes the request.
     */
    public ValidationReport cancel(String requestId) {
        ValidationReport report = reportRepository.findById(requestId)
                .orElseThrow(() -> new ReportNotFoundException(requestId));
        if (!orchestrator.cancel(requestId)) {
            throw new IllegalStateException("Cannot cancel validation in status: " + report.getStatus());
        }
        return report;
    }

    public Optional<AnnotatedDocument> annotatedDocument(String requestId) {
        ValidationReport report = reportRepository.findById(requestId)
                .orElseThrow(() -> new ReportNotFoundException(requestId));
        if (report.getAnnotatedDocument() == null) {
            return Optional.empty();
        }
        return documentStore.load(report.getAnnotatedDocument().getDocumentId());
    }

    /**
     * Reports left in flight by a previous process can never finish.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedReports() {
        List<ReportStatus> inFlight = List.of(ReportStatus.QUEUED, ReportStatus.EXTRACTING,
                ReportStatus.VALIDATING, ReportStatus.AGGREGATING);
        for (ValidationReport report : reportRepository.findByStatusIn(inFlight)) {
            if (orchestrator.isRunning(report.getRequestId())) {
                continue;
            }
            reportRepository.save(report.toBuilder()
                    .status(ReportStatus.FAILED)
                    .errorMessage(INTERRUPTED_MESSAGE)
                    .completedAt(clock.instant())
                    .build());
            log.warn("[VALIDATION] {} was in flight at startup, marked FAILED", report.getRequestId());
        }
    }

    private void onProgress(ValidationProgress progress) {
        eventPublisher.publishProgress(progress);
        if (progress.getPhase().isTerminal()) {
            return;
        }
        reportRepository.findById(progress.getRequestId())
                .filter(report -> report.getStatus().ordinal() < progress.getPhase().ordinal())
                .ifPresent(report -> reportRepository.save(report.toBuilder().status(progress.getPhase()).build()));
    }
}
