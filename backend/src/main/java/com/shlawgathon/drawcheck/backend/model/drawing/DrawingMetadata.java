package com.shlawgathon.drawcheck.backend.model.drawing;

import lombok.Builder;
import lombok.Value;

/**
 * Title block fields.
 */
@Value
@Builder(toBuilder = true)
public class DrawingMetadata {
    String drawingNumber;
    String revision;
    String title;
    Integer sheetNumber;
    Integer sheetCount;

    public static DrawingMetadata empty() {
        return DrawingMetadata.builder().build();
    }
}
