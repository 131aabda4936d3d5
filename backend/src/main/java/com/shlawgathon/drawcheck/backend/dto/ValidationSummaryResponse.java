package com.shlawgathon.drawcheck.backend.dto;

import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Short form of a report used in listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Validation report summary")
public class ValidationSummaryResponse {

    @Schema(description = "Request ID")
    private String requestId;

    @Schema(description = "Original filename")
    private String documentName;

    @Schema(description = "Current status")
    private ReportStatus status;

    @Schema(description = "Total counted checks")
    private Integer totalChecks;

    @Schema(description = "Pass rate in percent")
    private Double passRate;

    @Schema(description = "Critical failures")
    private Integer criticalFailures;

    @Schema(description = "Submission timestamp")
    private Instant startedAt;

    @Schema(description = "Completion timestamp")
    private Instant completedAt;

    @Schema(description = "Error message if failed")
    private String errorMessage;
}
