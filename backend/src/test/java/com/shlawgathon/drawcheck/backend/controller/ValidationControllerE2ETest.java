package com.shlawgathon.drawcheck.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.BaseE2ETest;
import com.shlawgathon.drawcheck.backend.dto.SubmitValidationRequest;
import com.shlawgathon.drawcheck.backend.extraction.TestPdfs;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.repository.ValidationReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Base64;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ValidationControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ValidationReportRepository reportRepository;

    @BeforeEach
    void setUp() {
        reportRepository.deleteAll();
    }

    private static MockMultipartFile undersizedWeldDrawing() {
        byte[] pdf = TestPdfs.pdf(
                "DWG NO: D-2001",
                "ALL WELDING PER WPS-101",
                "1/16\" FILLET ON 1/2\" PL");
        return new MockMultipartFile("file", "frame.pdf", MediaType.APPLICATION_PDF_VALUE, pdf);
    }

    private String submit(MockMultipartFile file, String... params) throws Exception {
        var request = multipart("/api/validations").file(file);
        for (int i = 0; i + 1 < params.length; i += 2) {
            request.param(params[i], params[i + 1]);
        }
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("requestId").asText();
    }

    @Test
    void shouldValidateUploadedDrawing() throws Exception {
        // Given
        String requestId = submit(undersizedWeldDrawing(), "checks", "welding");

        // When
        ValidationReport report = awaitFinished(reportRepository, requestId);

        // Then
        assertEquals(ReportStatus.COMPLETE, report.getStatus());
        assertEquals(List.of("welding"), List.copyOf(report.getPerDomain().keySet()));
        assertEquals(1, report.getAggregate().getCriticalFailures());

        mockMvc.perform(get("/api/validations/" + requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETE"))
                .andExpect(jsonPath("$.perDomain.welding.failed").value(1))
                .andExpect(jsonPath("$.aggregate.criticalFailures").value(1));
    }

    @Test
    void shouldNoteUnknownCheck() throws Exception {
        // Given
        String requestId = submit(undersizedWeldDrawing(), "checks", "welding,paint");

        // When
        ValidationReport report = awaitFinished(reportRepository, requestId);

        // Then
        assertEquals(ReportStatus.COMPLETE, report.getStatus());
        assertTrue(report.getNotes().contains("unknown check paint ignored"));
    }

    @Test
    void shouldPassDomainParameters() throws Exception {
        // Given
        byte[] pdf = TestPdfs.pdf("ALL WELDING PER WPS-101", "1/16\" FILLET WELD");
        MockMultipartFile file = new MockMultipartFile("file", "bracket.pdf", MediaType.APPLICATION_PDF_VALUE, pdf);
        String requestId = submit(file, "checks", "welding",
                "parameters", "{\"welding\":{\"baseMetalThickness\":\"1/2\"}}");

        // When
        ValidationReport report = awaitFinished(reportRepository, requestId);

        // Then
        assertEquals(1, report.getAggregate().getCriticalFailures());
    }

    @Test
    void shouldProduceAnnotatedDrawing() throws Exception {
        // Given
        String requestId = submit(undersizedWeldDrawing(), "checks", "welding", "annotate", "true");

        // When
        ValidationReport report = awaitFinished(reportRepository, requestId);

        // Then
        assertNotNull(report.getAnnotatedDocument());
        mockMvc.perform(get("/api/validations/" + requestId + "/annotated"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition",
                        containsString("frame-annotated.pdf")));
    }

    @Test
    void shouldFailUnreadableDrawing() throws Exception {
        // Given
        byte[] blank = TestPdfs.pdf(List.of(List.of()));
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", MediaType.APPLICATION_PDF_VALUE, blank);
        String requestId = submit(file);

        // When
        ValidationReport report = awaitFinished(reportRepository, requestId);

        // Then
        assertEquals(ReportStatus.FAILED, report.getStatus());
        assertTrue(report.getErrorMessage().startsWith("Extraction failed"));
        assertTrue(report.getPerDomain() == null || report.getPerDomain().isEmpty());
    }

    @Test
    void shouldAcceptBase64Submission() throws Exception {
        SubmitValidationRequest request = SubmitValidationRequest.builder()
                .documentName("frame.pdf")
                .contentBase64(Base64.getEncoder().encodeToString(TestPdfs.pdf("1/4\" FILLET ON 3/8\" PL")))
                .checks(List.of("welding"))
                .build();

        mockMvc.perform(post("/api/validations/base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.documentName").value("frame.pdf"));
    }

    @Test
    void shouldRejectMalformedSubmissions() throws Exception {
        mockMvc.perform(multipart("/api/validations")
                        .file(new MockMultipartFile("file", "empty.pdf", MediaType.APPLICATION_PDF_VALUE, new byte[0])))
                .andExpect(status().isBadRequest());

        mockMvc.perform(multipart("/api/validations").file(undersizedWeldDrawing()).param("parameters", "{not json"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/validations/base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentName\":\"x.pdf\",\"contentBase64\":\"***\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/validations/base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentName\":\"x.pdf\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundForUnknownReport() throws Exception {
        mockMvc.perform(get("/api/validations/does-not-exist"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/validations/does-not-exist"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/validations/does-not-exist/annotated"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectCancellingFinishedValidation() throws Exception {
        // Given
        String requestId = submit(undersizedWeldDrawing(), "checks", "welding");
        awaitFinished(reportRepository, requestId);

        // When / Then
        mockMvc.perform(delete("/api/validations/" + requestId))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldListRecentReports() throws Exception {
        // Given
        String requestId = submit(undersizedWeldDrawing(), "checks", "welding");
        awaitFinished(reportRepository, requestId);

        // When / Then
        mockMvc.perform(get("/api/validations").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].requestId").value(requestId))
                .andExpect(jsonPath("$[0].status").value("COMPLETE"));
    }
}
