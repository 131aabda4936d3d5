package com.shlawgathon.drawcheck.backend.validation.gdt;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One feature control frame as read from the drawing.
 */
@Value
@Builder
public class FeatureControlFrame {
    String raw;
    GeometricCharacteristic characteristic;
    double tolerance;
    boolean diametricZone;
    MaterialCondition modifier;
    @Singular
    List<DatumReference> datums;
    IssueLocation location;

    public boolean hasBonusModifier() {
        return modifier != null && modifier.allowsBonus();
    }
}
