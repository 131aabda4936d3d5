package com.shlawgathon.drawcheck.backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private static ValidationReport report() {
        ValidationIssue issue = ValidationIssue.builder()
                .severity(Severity.CRITICAL)
                .checkType("welding.fillet-size")
                .message("Fillet weld 0.0625 is below minimum 0.1875 for 0.5 base metal")
                .location(IssueLocation.builder()
                        .page(1)
                        .region(Region.builder().x(50).y(76).width(140).height(11).build())
                        .build())
                .standardReference("AWS D1.1 Table 5.8")
                .build();
        ValidationResult welding = ValidationResult.builder()
                .domain("welding")
                .totalChecks(2)
                .passed(1)
                .failed(1)
                .issue(issue)
                .build();
        return ValidationReport.builder()
                .requestId("r-1")
                .documentName("frame.pdf")
                .status(ReportStatus.COMPLETE)
                .requestedCheck("welding")
                .domainResult("welding", welding)
                .aggregate(AggregateMetrics.builder()
                        .totalChecks(2).passed(1).failed(1).criticalFailures(1).passRate(50.0)
                        .build())
                .note("unknown check paint ignored")
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .completedAt(Instant.parse("2024-05-01T10:00:02Z"))
                .durationMs(2000L)
                .build();
    }

    @Test
    void shouldWriteSeverityAsLowercaseKey() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report()));

        assertEquals("critical", json.at("/perDomain/welding/issues/0/severity").asText());
        assertEquals("COMPLETE", json.get("status").asText());
        assertEquals(1, json.at("/aggregate/criticalFailures").asInt());
    }

    @Test
    void shouldReadBackWhatItWrites() throws Exception {
        ValidationReport original = report();

        ValidationReport read = objectMapper.readValue(objectMapper.writeValueAsString(original),
                ValidationReport.class);

        assertEquals(original, read);
        assertEquals(1, read.allIssues().size());
    }

    @Test
    void shouldAcceptSeverityEnumNames() {
        assertEquals(Severity.WARNING, Severity.fromKey("WARNING"));
        assertEquals(Severity.ERROR, Severity.fromKey("error"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromKey("fatal"));
        assertTrue(Severity.CRITICAL.isAtLeast(Severity.ERROR));
        assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
    }
}
