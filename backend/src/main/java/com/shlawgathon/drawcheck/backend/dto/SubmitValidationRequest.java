package com.shlawgathon.drawcheck.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Validation request carrying the drawing as base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to validate a base64-encoded drawing")
public class SubmitValidationRequest {

    @Schema(description = "Original filename", example = "bracket-rev-b.pdf")
    private String documentName;

    @NotBlank
    @Schema(description = "PDF or image content, base64 encoded")
    private String contentBase64;

    @Schema(description = "Domains to run; empty or [\"all\"] runs every available validator",
            example = "[\"gdt\", \"welding\"]")
    private List<String> checks;

    @Schema(description = "Per-domain parameters keyed by domain key",
            example = "{\"welding\": {\"baseMetalThickness\": 0.5}}")
    private Map<String, Map<String, Object>> parameters;

    @Schema(description = "Produce an annotated copy of the drawing")
    private boolean annotate;
}
