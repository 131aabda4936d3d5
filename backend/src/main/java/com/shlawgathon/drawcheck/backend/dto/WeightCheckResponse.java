package com.shlawgathon.drawcheck.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Expected versus actual member weight")
public class WeightCheckResponse {

    @Schema(description = "Beam designation", example = "W12X26")
    private String designation;

    @Schema(description = "Member length in feet")
    private double lengthFt;

    @Schema(description = "Expected weight in pounds")
    private double expectedLb;

    @Schema(description = "Allowed deviation in pounds")
    private double toleranceLb;

    @Schema(description = "Actual weight in pounds")
    private double actualLb;

    @Schema(description = "Actual minus expected, in pounds")
    private double differenceLb;

    @Schema(description = "Whether the difference is within tolerance")
    private boolean withinTolerance;
}
