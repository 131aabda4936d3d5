package com.shlawgathon.drawcheck.backend.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocument;
import com.shlawgathon.drawcheck.backend.dto.SubmitValidationRequest;
import com.shlawgathon.drawcheck.backend.dto.ValidationSummaryResponse;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.service.ReportNotFoundException;
import com.shlawgathon.drawcheck.backend.service.ValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/validations")
@Tag(name = "Validations", description = "Drawing validation runs")
public class ValidationController {

    private static final TypeReference<Map<String, Map<String, Object>>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final ValidationService validationService;
    private final ObjectMapper objectMapper;

    public ValidationController(ValidationService validationService, ObjectMapper objectMapper) {
        this.validationService = validationService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Validate drawing", description = "Upload a PDF or image drawing and start validation")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Validation queued"),
            @ApiResponse(responseCode = "400", description = "Empty file or malformed parameters")
    })
    public ResponseEntity<ValidationReport> submit(
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Domains to run, default all") @RequestParam(required = false) List<String> checks,
            @RequestParam(defaultValue = "false") boolean annotate,
            @Parameter(description = "Per-domain parameters as JSON")
            @RequestParam(required = false) String parameters) throws IOException {

        Map<String, Map<String, Object>> params;
        try {
            params = parameters == null || parameters.isBlank() ? Map.of()
                    : objectMapper.readValue(parameters, PARAMS_TYPE);
        } catch (JsonProcessingException e) {
            return ResponseEntity.badRequest().build();
        }
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        ValidationReport report = validationService.submit(file.getOriginalFilename(), file.getBytes(), checks,
                params, annotate);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(report);
    }

    @PostMapping(value = "/base64", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Validate base64 drawing", description = "Start validation of a base64-encoded drawing")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Validation queued"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ValidationReport> submitBase64(@Valid @RequestBody SubmitValidationRequest request) {
        byte[] content;
        try {
            content = Base64.getDecoder().decode(request.getContentBase64());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        if (content.length == 0) {
            return ResponseEntity.badRequest().build();
        }
        ValidationReport report = validationService.submit(request.getDocumentName(), content,
                request.getChecks(), request.getParameters(), request.isAnnotate());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(report);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get report", description = "Get the current state of a validation report")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report found"),
            @ApiResponse(responseCode = "404", description = "Report not found")
    })
    public ResponseEntity<ValidationReport> getReport(
            @Parameter(description = "Request ID") @PathVariable String id) {

        return validationService.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "List recent reports", description = "Most recent validation runs first")
    public ResponseEntity<List<ValidationSummaryResponse>> listRecent(
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(validationService.recent(limit).stream()
                .map(this::toSummary)
                .toList());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Cancel validation", description = "Cancel a running validation")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @ApiResponse(responseCode = "400", description = "Validation already finished"),
            @ApiResponse(responseCode = "404", description = "Report not found")
    })
    public ResponseEntity<ValidationSummaryResponse> cancel(
            @Parameter(description = "Request ID") @PathVariable String id) {

        try {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(validationService.cancel(id)));
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        } catch (ReportNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/{id}/annotated")
    @Operation(summary = "Download annotated drawing", description = "Annotated PDF produced for the report")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Annotated PDF"),
            @ApiResponse(responseCode = "404", description = "Report or annotated drawing not found")
    })
    public ResponseEntity<byte[]> downloadAnnotated(
            @Parameter(description = "Request ID") @PathVariable String id) {

        try {
            return validationService.annotatedDocument(id)
                    .map(this::toDownload)
                    .orElse(ResponseEntity.notFound().build());
        } catch (ReportNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    private ResponseEntity<byte[]> toDownload(AnnotatedDocument document) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(AnnotatedDocument.CONTENT_TYPE));
        headers.setContentDisposition(ContentDisposition.attachment().filename(document.filename()).build());
        return new ResponseEntity<>(document.content(), headers, HttpStatus.OK);
    }

    private ValidationSummaryResponse toSummary(ValidationReport report) {
        var aggregate = report.getAggregate();
        return ValidationSummaryResponse.builder()
                .requestId(report.getRequestId())
                .documentName(report.getDocumentName())
                .status(report.getStatus())
                .totalChecks(aggregate != null ? aggregate.getTotalChecks() : null)
                .passRate(aggregate != null ? aggregate.getPassRate() : null)
                .criticalFailures(aggregate != null ? aggregate.getCriticalFailures() : null)
                .startedAt(report.getStartedAt())
                .completedAt(report.getCompletedAt())
                .errorMessage(report.getErrorMessage())
                .build();
    }
}
