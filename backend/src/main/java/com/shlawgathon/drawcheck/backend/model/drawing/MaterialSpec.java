package com.shlawgathon.drawcheck.backend.model.drawing;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Material specification callout together with any mill test values printed
 * alongside it.
 */
@Value
@Builder
public class MaterialSpec {
    String raw;
    String designation;
    String grade;
    @Singular
    List<String> tableReferences;
    @Singular("chemistryValue")
    Map<String, Double> chemistry;
    @Singular("mechanicalValue")
    Map<String, Double> mechanical;
    String heatTreatment;
    String heatNumber;
    IssueLocation location;

    public boolean hasTestValues() {
        return !chemistry.isEmpty() || !mechanical.isEmpty();
    }
}
