package com.shlawgathon.drawcheck.backend.model.drawing;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import lombok.Builder;
import lombok.Value;

/**
 * Weld symbol or note found on the drawing. Sizes are in inches; a null size
 * or thickness means the callout did not state it.
 */
@Value
@Builder
public class WeldCallout {
    String raw;
    WeldType type;
    Double size;
    @Builder.Default
    WeldSide side = WeldSide.ARROW_SIDE;
    boolean allAround;
    boolean field;
    Double intermittentLength;
    Double intermittentPitch;
    Double baseMetalThickness;
    IssueLocation location;

    public boolean isIntermittent() {
        return intermittentLength != null && intermittentPitch != null;
    }
}
