package com.shlawgathon.drawcheck.backend.orchestration;

import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocument;
import com.shlawgathon.drawcheck.backend.annotation.AnnotationException;
import com.shlawgathon.drawcheck.backend.annotation.DocumentAnnotator;
import com.shlawgathon.drawcheck.backend.extraction.DrawingExtractor;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionException;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldCallout;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldType;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.standards.TestStandards;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;
import com.shlawgathon.drawcheck.backend.validation.ValidatorRegistry;
import com.shlawgathon.drawcheck.backend.validation.gdt.GdtValidator;
import com.shlawgathon.drawcheck.backend.validation.welding.WeldingValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.shlawgathon.drawcheck.backend.validation.DrawingFixtures.drawing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
    private static final Executor DIRECT = Runnable::run;
    private static final byte[] DOCUMENT = "%PDF-1.7 stub".getBytes(StandardCharsets.US_ASCII);

    private final List<ValidationProgress> events = Collections.synchronizedList(new ArrayList<>());
    private ExecutorService pool;

    @AfterEach
    void shutdown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static WeldCallout quarterInchFillet() {
        return WeldCallout.builder()
                .raw("1/4 FILLET")
                .type(WeldType.FILLET)
                .size(0.25)
                .baseMetalThickness(0.375)
                .build();
    }

    private static ExtractedDrawingData weldedDrawing() {
        return drawing("ALL WELDING PER WPS-101").weld(quarterInchFillet()).build();
    }

    private static ValidationOrchestrator orchestrator(DrawingExtractor extractor, List<DrawingValidator> validators,
            DocumentAnnotator annotator, InMemoryAnnotatedDocumentStore store, Executor executor) {
        return new ValidationOrchestrator(extractor, TestStandards.store(), new ValidatorRegistry(validators),
                annotator, store, executor, executor, Duration.ofSeconds(30), CLOCK);
    }

    private static ValidationOrchestrator orchestrator(DrawingExtractor extractor, DrawingValidator... validators) {
        return orchestrator(extractor, List.of(validators), null, null, DIRECT);
    }

    private static ValidationRequest.ValidationRequestBuilder request(String id) {
        return ValidationRequest.builder().requestId(id).documentName("drawing.pdf").document(DOCUMENT);
    }

    private ValidationReport run(ValidationOrchestrator orchestrator, ValidationRequest request) throws Exception {
        return orchestrator.validate(request, events::add).get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("check-set resolution")
    class Resolution {

        @Test
        void unavailableValidatorIsSkippedWithANote() throws Exception {
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    new WeldingValidator());

            ValidationReport report = run(orchestrator,
                    request("r-1").check("welding").check("equipmentChecklist").build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(report.getPerDomain()).containsOnlyKeys("welding");
            assertThat(report.getNotes()).contains("equipmentChecklist validator unavailable");
            assertThat(report.getAggregate().getTotalChecks()).isEqualTo(2);
            assertThat(report.getAggregate().getPassRate()).isEqualTo(100.0);
            assertThat(report.getRequestedChecks()).containsExactly("welding", "equipmentChecklist");
        }

        @Test
        void unknownCheckIsIgnoredWithANote() throws Exception {
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    new WeldingValidator());

            ValidationReport report = run(orchestrator, request("r-2").check("welding").check("paint").build());

            assertThat(report.getNotes()).contains("unknown check paint ignored");
            assertThat(report.getPerDomain()).containsOnlyKeys("welding");
        }

        @Test
        void domainParametersReachTheirValidator() throws Exception {
            ExtractedDrawingData data = drawing("WPS-101")
                    .weld(WeldCallout.builder().raw("1/16 FILLET").type(WeldType.FILLET).size(0.0625).build())
                    .build();
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> data, new WeldingValidator());

            ValidationReport report = run(orchestrator, request("r-3")
                    .domainParams("welding", Map.of(WeldingValidator.PARAM_BASE_METAL_THICKNESS, 0.5))
                    .build());

            assertThat(report.getAggregate().getCriticalFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("repeatability")
    class Repeatability {

        @Test
        void sameInputAndChecksGiveTheSameResultsOnAParallelPool() throws Exception {
            ExtractedDrawingData data = drawing("ALL WELDING PER WPS-101", "PERPENDICULARITY 0.010 C",
                    "POSITION DIA 0.014 M A")
                    .datum("A")
                    .weld(quarterInchFillet())
                    .weld(WeldCallout.builder().raw("1/16 FILLET").type(WeldType.FILLET).size(0.0625)
                            .baseMetalThickness(0.5).build())
                    .build();
            pool = Executors.newFixedThreadPool(4);
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> data,
                    List.of(new GdtValidator(), new WeldingValidator()), null, null, pool);

            ValidationReport first = run(orchestrator, request("r-20").check("gdt").check("welding").build());
            ValidationReport second = run(orchestrator, request("r-21").check("gdt").check("welding").build());

            assertThat(first.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(second.getPerDomain()).isEqualTo(first.getPerDomain());
            assertThat(second.getPerDomain().keySet()).containsExactlyInAnyOrder("gdt", "welding");
            assertThat(second.getAggregate()).isEqualTo(first.getAggregate());
            assertThat(messages(second)).isEqualTo(messages(first)).isNotEmpty();
        }

        private List<String> messages(ValidationReport report) {
            return report.allIssues().stream().map(issue -> issue.getMessage()).toList();
        }
    }

    @Test
    void progressIsMonotonicAndEndsTerminal() throws Exception {
        ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                new WeldingValidator(), new GdtValidator());

        ValidationReport report = run(orchestrator, request("r-4").build());

        assertThat(report.getPerDomain().keySet()).containsExactly("gdt", "welding");
        assertThat(events).extracting(ValidationProgress::getPercent).containsExactly(0, 10, 30, 55, 80, 85, 100);
        assertThat(events).extracting(ValidationProgress::getPhase).containsExactly(
                ReportStatus.QUEUED, ReportStatus.EXTRACTING, ReportStatus.VALIDATING, ReportStatus.VALIDATING,
                ReportStatus.VALIDATING, ReportStatus.AGGREGATING, ReportStatus.COMPLETE);
        assertThat(events).allSatisfy(e -> assertThat(e.getRequestId()).isEqualTo("r-4"));
        assertThat(report.getDurationMs()).isZero();
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void failedExtractionFailsTheRequest() throws Exception {
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> {
                throw new ExtractionException("no readable text on any page");
            }, new WeldingValidator());

            ValidationReport report = run(orchestrator, request("r-5").build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.FAILED);
            assertThat(report.getErrorMessage()).isEqualTo("Extraction failed: no readable text on any page");
            assertThat(report.getPerDomain()).isEmpty();
            assertThat(report.getAggregate().getTotalChecks()).isZero();
            assertThat(events.get(events.size() - 1).getPhase()).isEqualTo(ReportStatus.FAILED);
            assertThat(orchestrator.isRunning("r-5")).isFalse();
        }

        @Test
        void failingValidatorDoesNotSinkTheOthers() throws Exception {
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    new WeldingValidator(), new ExplodingValidator(ValidationDomain.MATERIAL));

            ValidationReport report = run(orchestrator, request("r-6").build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(report.getPerDomain()).containsOnlyKeys("welding");
            assertThat(report.getNotes()).contains("material validator failed: boom");
        }

        @Test
        void incompleteExtractionIsCarriedThrough() throws Exception {
            ExtractedDrawingData partial = drawing("WPS-101").weld(quarterInchFillet())
                    .missingPage(2).incomplete(true).build();
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> partial, new WeldingValidator());

            ValidationReport report = run(orchestrator, request("r-7").build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(report.isExtractionIncomplete()).isTrue();
            assertThat(report.getNotes()).anySatisfy(n -> assertThat(n).startsWith("extraction incomplete: pages [2]"));
            assertThat(report.allIssues()).anySatisfy(i -> assertThat(i.getCheckType()).isEqualTo("extraction.incomplete"));
        }
    }

    @Nested
    @DisplayName("annotation")
    class Annotation {

        private final DocumentAnnotator annotator = (document, name, issues) ->
                new AnnotatedDocument("annotated-" + name, document, issues.size(), 0);

        @Test
        void storesTheAnnotatedCopy() throws Exception {
            InMemoryAnnotatedDocumentStore store = new InMemoryAnnotatedDocumentStore();
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    List.of(new WeldingValidator()), annotator, store, DIRECT);

            ValidationReport report = run(orchestrator, request("r-8").annotate(true).build());

            assertThat(report.getAnnotatedDocument()).isNotNull();
            assertThat(report.getAnnotatedDocument().getFilename()).isEqualTo("annotated-drawing.pdf");
            assertThat(store.load(report.getAnnotatedDocument().getDocumentId())).isPresent();
            assertThat(events).extracting(ValidationProgress::getPercent).contains(90);
        }

        @Test
        void missingAnnotatorIsNoted() throws Exception {
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    new WeldingValidator());

            ValidationReport report = run(orchestrator, request("r-9").annotate(true).build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(report.getAnnotatedDocument()).isNull();
            assertThat(report.getNotes()).contains("annotation unavailable");
        }

        @Test
        void annotationFailureIsNoted() throws Exception {
            InMemoryAnnotatedDocumentStore store = new InMemoryAnnotatedDocumentStore();
            DocumentAnnotator broken = (document, name, issues) -> {
                throw new AnnotationException("not a PDF");
            };
            ValidationOrchestrator orchestrator = orchestrator((doc, control) -> weldedDrawing(),
                    List.of(new WeldingValidator()), broken, store, DIRECT);

            ValidationReport report = run(orchestrator, request("r-10").annotate(true).build());

            assertThat(report.getStatus()).isEqualTo(ReportStatus.COMPLETE);
            assertThat(report.getNotes()).contains("annotation failed: not a PDF");
            assertThat(store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        private ValidationOrchestrator blockingOrchestrator() {
            pool = Executors.newCachedThreadPool();
            DrawingExtractor blocking = (doc, control) -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExtractionException("interrupted");
                }
                return weldedDrawing();
            };
            return orchestrator(blocking, List.of(new WeldingValidator()), null, null, pool);
        }

        @Test
        void cancelledRequestEndsFailed() throws Exception {
            ValidationOrchestrator orchestrator = blockingOrchestrator();
            CompletableFuture<ValidationReport> future = orchestrator.validate(request("r-11").build(), events::add);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(orchestrator.isRunning("r-11")).isTrue();
            assertThat(orchestrator.cancel("r-11")).isTrue();
            release.countDown();
            ValidationReport report = future.get(5, TimeUnit.SECONDS);

            assertThat(report.getStatus()).isEqualTo(ReportStatus.FAILED);
            assertThat(report.getErrorMessage()).isEqualTo(ValidationOrchestrator.CANCELLED_MESSAGE);
            assertThat(report.getNotes()).contains("cancelled");
            assertThat(report.getPerDomain()).isEmpty();
            assertThat(events.get(events.size() - 1).getPhase()).isEqualTo(ReportStatus.FAILED);
            assertThat(orchestrator.isRunning("r-11")).isFalse();
        }

        @Test
        void duplicateRequestIdIsRejectedWhileRunning() throws Exception {
            ValidationOrchestrator orchestrator = blockingOrchestrator();
            CompletableFuture<ValidationReport> first = orchestrator.validate(request("r-12").build(), events::add);

            assertThatThrownBy(() -> orchestrator.validate(request("r-12").build(), events::add))
                    .isInstanceOf(IllegalStateException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(ReportStatus.COMPLETE);
        }

        @Test
        void cancellingAnUnknownRequestReturnsFalse() {
            assertThat(orchestrator((doc, control) -> weldedDrawing()).cancel("nope")).isFalse();
        }
    }

    private static final class ExplodingValidator implements DrawingValidator {

        private final ValidationDomain domain;

        ExplodingValidator(ValidationDomain domain) {
            this.domain = domain;
        }

        @Override
        public ValidationDomain domain() {
            return domain;
        }

        @Override
        public ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
            throw new IllegalStateException("boom");
        }
    }
}
