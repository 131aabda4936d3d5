package com.shlawgathon.drawcheck.backend.controller;

import com.shlawgathon.drawcheck.backend.dto.WeightCheckResponse;
import com.shlawgathon.drawcheck.backend.standards.StandardsCategory;
import com.shlawgathon.drawcheck.backend.standards.StandardsRecord;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/standards")
@Tag(name = "Standards", description = "Engineering reference tables")
public class StandardsController {

    private final StandardsStore standardsStore;

    public StandardsController(StandardsStore standardsStore) {
        this.standardsStore = standardsStore;
    }

    @GetMapping("/{category}/{designation}")
    @Operation(summary = "Look up a reference record",
            description = "Category is one of beams, bolts, materials, pipes, code-limits")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Record found"),
            @ApiResponse(responseCode = "404", description = "Unknown category or designation")
    })
    public ResponseEntity<StandardsRecord> lookup(
            @PathVariable String category,
            @Parameter(description = "Designation, e.g. W12X26 or A516-70") @PathVariable String designation) {

        return category(category)
                .flatMap(c -> standardsStore.lookup(c, designation))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/beams/{designation}/weight")
    @Operation(summary = "Verify beam weight", description = "Compare an actual member weight to the tabulated one")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Verification computed"),
            @ApiResponse(responseCode = "400", description = "Non-positive length"),
            @ApiResponse(responseCode = "404", description = "Unknown beam")
    })
    public ResponseEntity<WeightCheckResponse> verifyWeight(
            @PathVariable String designation,
            @RequestParam double lengthFt,
            @RequestParam double actualLb,
            @RequestParam(defaultValue = "" + StandardsStore.DEFAULT_WEIGHT_TOLERANCE_PCT) double tolerancePct) {

        if (lengthFt <= 0 || tolerancePct < 0) {
            return ResponseEntity.badRequest().build();
        }
        return standardsStore.verifyWeight(designation, lengthFt, actualLb, tolerancePct)
                .map(v -> WeightCheckResponse.builder()
                        .designation(v.designation())
                        .lengthFt(v.lengthFt())
                        .expectedLb(v.expected())
                        .toleranceLb(v.tolerance())
                        .actualLb(v.actual())
                        .differenceLb(v.difference())
                        .withinTolerance(v.withinTolerance())
                        .build())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Accepts the table file name ({@code beams}, {@code code-limits}) or the
     * enum name.
     */
    static Optional<StandardsCategory> category(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        return Arrays.stream(StandardsCategory.values())
                .filter(c -> c.resource().equals(normalized + ".json")
                        || c.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst();
    }
}
