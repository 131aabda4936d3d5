package com.shlawgathon.drawcheck.backend.orchestration;

import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocument;
import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocumentStore;
import com.shlawgathon.drawcheck.backend.annotation.AnnotationException;
import com.shlawgathon.drawcheck.backend.annotation.DocumentAnnotator;
import com.shlawgathon.drawcheck.backend.extraction.DrawingExtractor;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionCancelledException;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionControl;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionException;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;
import com.shlawgathon.drawcheck.backend.validation.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one request through extraction, the requested validators, aggregation
 * and optional annotation. Only a failed extraction or a cancellation ends a
 * request in {@link ReportStatus#FAILED}; everything else is recorded on the
 * report as a note.
 */
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    public static final String CANCELLED_MESSAGE = "Validation cancelled";

    private static final long CANCEL_POLL_MS = 200;

    private final DrawingExtractor extractor;
    private final StandardsStore standards;
    private final ValidatorRegistry registry;
    private final DocumentAnnotator annotator;
    private final AnnotatedDocumentStore documentStore;
    private final Executor pipelineExecutor;
    private final Executor validatorExecutor;
    private final Duration documentTimeout;
    private final Clock clock;

    private final Map<String, ExtractionControl> running = new ConcurrentHashMap<>();

    /**
     * @param annotator     null when annotation is unavailable
     * @param documentStore null when annotated copies cannot be stored
     */
    public ValidationOrchestrator(DrawingExtractor extractor, StandardsStore standards, ValidatorRegistry registry,
            DocumentAnnotator annotator, AnnotatedDocumentStore documentStore, Executor pipelineExecutor,
            Executor validatorExecutor, Duration documentTimeout, Clock clock) {
        this.extractor = extractor;
        this.standards = standards;
        this.registry = registry;
        this.annotator = annotator;
        this.documentStore = documentStore;
        this.pipelineExecutor = pipelineExecutor;
        this.validatorExecutor = validatorExecutor;
        this.documentTimeout = documentTimeout;
        this.clock = clock;
    }

    public CompletableFuture<ValidationReport> validate(ValidationRequest request, ProgressListener listener) {
        String requestId = request.getRequestId();
        ExtractionControl control = ExtractionControl.withTimeout(documentTimeout);
        if (running.putIfAbsent(requestId, control) != null) {
            throw new IllegalStateException("Request already running: " + requestId);
        }
        ReportAssembler assembler = new ReportAssembler(requestId, request.getDocumentName(), request.getChecks(),
                clock);
        ProgressEmitter progress = new ProgressEmitter(requestId, listener == null ? ProgressListener.NONE : listener);
        progress.emit(ReportStatus.QUEUED, 0, "Queued");

        try {
            return CompletableFuture.supplyAsync(() -> run(request, control, assembler, progress), pipelineExecutor)
                    .whenComplete((report, error) -> running.remove(requestId));
        } catch (RuntimeException e) {
            running.remove(requestId);
            throw e;
        }
    }

    /**
     * Request cancellation. Returns false when the request is not running.
     */
    public boolean cancel(String requestId) {
        ExtractionControl control = running.get(requestId);
        if (control == null) {
            return false;
        }
        control.cancel();
        log.info("[VALIDATION] Cancellation requested for {}", requestId);
        return true;
    }

    public boolean isRunning(String requestId) {
        return running.containsKey(requestId);
    }

    private ValidationReport run(ValidationRequest request, ExtractionControl control, ReportAssembler assembler,
            ProgressEmitter progress) {
        String requestId = request.getRequestId();
        try {
            checkCancelled(control, requestId);
            assembler.status(ReportStatus.EXTRACTING);
            progress.emit(ReportStatus.EXTRACTING, 10, "Extracting drawing data");
            log.info("[VALIDATION] {} extracting {}", requestId, request.getDocumentName());

            ExtractedDrawingData data;
            try {
                data = extractor.extract(request.getDocument(), control);
            } catch (ExtractionException e) {
                log.error("[VALIDATION] {} extraction failed: {}", requestId, e.getMessage());
                ValidationReport failed = assembler.fail("Extraction failed: " + e.getMessage());
                progress.emit(ReportStatus.FAILED, 100, failed.getErrorMessage());
                return failed;
            } catch (ExtractionCancelledException e) {
                throw new ValidationCancelledException(requestId);
            }
            if (data.isIncomplete()) {
                assembler.extractionIncomplete(true);
                assembler.note("extraction incomplete: pages " + data.getMissingPages()
                        + " could not be read; affected checks report insufficient data");
                log.warn("[VALIDATION] {} continuing with partial extraction, missing pages {}", requestId,
                        data.getMissingPages());
            }
            checkCancelled(control, requestId);

            ValidatorRegistry.Resolution resolution = registry.resolve(request.getChecks());
            for (ValidationDomain domain : resolution.unavailable()) {
                log.warn("[VALIDATION] {} requested {} but it is unavailable", requestId, domain.key());
                assembler.note(domain.key() + " validator unavailable");
            }
            for (String unknown : resolution.unknown()) {
                assembler.note("unknown check " + unknown + " ignored");
            }

            assembler.status(ReportStatus.VALIDATING);
            progress.emit(ReportStatus.VALIDATING, 30, "Running " + resolution.validators().size() + " validators");
            runValidators(request, data, resolution.validators(), control, assembler, progress);
            checkCancelled(control, requestId);

            assembler.status(ReportStatus.AGGREGATING);
            progress.emit(ReportStatus.AGGREGATING, 85, "Aggregating results");
            if (request.isAnnotate()) {
                annotate(request, assembler, progress);
            }
            checkCancelled(control, requestId);

            ValidationReport report = assembler.complete();
            log.info("[VALIDATION] {} complete: {} checks, {} passed, {} failed, {} warnings, {} critical",
                    requestId, report.getAggregate().getTotalChecks(), report.getAggregate().getPassed(),
                    report.getAggregate().getFailed(), report.getAggregate().getWarnings(),
                    report.getAggregate().getCriticalFailures());
            progress.emit(ReportStatus.COMPLETE, 100, String.format(Locale.ROOT, "Complete: %.1f%% passed",
                    report.getAggregate().getPassRate()));
            return report;
        } catch (ValidationCancelledException e) {
            log.info("[VALIDATION] {} cancelled", requestId);
            assembler.note("cancelled");
            ValidationReport cancelled = assembler.fail(CANCELLED_MESSAGE);
            progress.emit(ReportStatus.FAILED, 100, CANCELLED_MESSAGE);
            return cancelled;
        } catch (RuntimeException e) {
            log.error("[VALIDATION] {} failed unexpectedly", requestId, e);
            ValidationReport failed = assembler.fail("Internal error: " + e.getMessage());
            progress.emit(ReportStatus.FAILED, 100, failed.getErrorMessage());
            return failed;
        }
    }

    private void runValidators(ValidationRequest request, ExtractedDrawingData data, List<DrawingValidator> validators,
            ExtractionControl control, ReportAssembler assembler, ProgressEmitter progress) {
        Map<ValidationDomain, Throwable> failures = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        int count = validators.size();

        for (DrawingValidator validator : validators) {
            ValidationDomain domain = validator.domain();
            ValidationParams params = ValidationParams.of(request.paramsFor(domain.key()));
            futures.add(CompletableFuture
                    .supplyAsync(() -> validator.validate(data, standards, params), validatorExecutor)
                    .handle((result, error) -> {
                        if (error != null) {
                            failures.put(domain, unwrap(error));
                        } else if (!control.isCancelled()) {
                            assembler.result(domain, result);
                        }
                        progress.validatorFinished(domain.key(), count);
                        return null;
                    }));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        while (true) {
            try {
                all.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
                break;
            } catch (TimeoutException e) {
                if (control.isCancelled()) {
                    futures.forEach(f -> f.cancel(true));
                    throw new ValidationCancelledException(request.getRequestId());
                }
            } catch (ExecutionException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ValidationCancelledException(request.getRequestId());
            }
        }

        Map<ValidationDomain, Throwable> ordered = new EnumMap<>(ValidationDomain.class);
        ordered.putAll(failures);
        ordered.forEach((domain, error) -> {
            log.warn("[VALIDATION] {} {} validator failed", request.getRequestId(), domain.key(), error);
            assembler.note(domain.key() + " validator failed: " + error.getMessage());
        });
    }

    private void annotate(ValidationRequest request, ReportAssembler assembler, ProgressEmitter progress) {
        if (annotator == null || documentStore == null) {
            log.warn("[VALIDATION] {} annotation requested but no annotator is available", request.getRequestId());
            assembler.note("annotation unavailable");
            return;
        }
        progress.emit(ReportStatus.AGGREGATING, 90, "Annotating drawing");
        try {
            AnnotatedDocument document = annotator.annotate(request.getDocument(), request.getDocumentName(),
                    assembler.snapshot().allIssues());
            assembler.annotatedDocument(documentStore.save(request.getRequestId(), document));
        } catch (AnnotationException e) {
            log.warn("[VALIDATION] {} annotation failed: {}", request.getRequestId(), e.getMessage());
            assembler.note("annotation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[VALIDATION] {} storing annotated document failed", request.getRequestId(), e);
            assembler.note("annotation failed: " + e.getMessage());
        }
    }

    private static void checkCancelled(ExtractionControl control, String requestId) {
        if (control.isCancelled()) {
            throw new ValidationCancelledException(requestId);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Serializes progress events so percentages never go backwards and
     * nothing follows a terminal event.
     */
    private final class ProgressEmitter {

        private final String requestId;
        private final ProgressListener listener;
        private int lastPercent;
        private int validatorsFinished;
        private boolean terminal;

        ProgressEmitter(String requestId, ProgressListener listener) {
            this.requestId = requestId;
            this.listener = listener;
        }

        synchronized void emit(ReportStatus phase, int percent, String message) {
            if (terminal) {
                return;
            }
            lastPercent = Math.max(lastPercent, percent);
            terminal = phase.isTerminal();
            ValidationProgress event = ValidationProgress.builder()
                    .requestId(requestId)
                    .phase(phase)
                    .percent(lastPercent)
                    .message(message)
                    .timestamp(clock.instant())
                    .build();
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("[VALIDATION] {} progress listener failed: {}", requestId, e.getMessage());
            }
        }

        synchronized void validatorFinished(String domainKey, int total) {
            validatorsFinished++;
            emit(ReportStatus.VALIDATING, 30 + 50 * validatorsFinished / Math.max(1, total),
                    domainKey + " validator finished (" + validatorsFinished + "/" + total + ")");
        }
    }
}
