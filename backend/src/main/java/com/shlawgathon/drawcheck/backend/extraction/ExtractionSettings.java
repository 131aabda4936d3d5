package com.shlawgathon.drawcheck.backend.extraction;

import java.time.Duration;

/**
 * Tuning for {@link PdfDrawingExtractor}.
 */
public record ExtractionSettings(int minCharsPerPage, float ocrDpi, Duration pageTimeout, Duration documentTimeout) {

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(100, 300f, Duration.ofSeconds(30), Duration.ofMinutes(2));
    }
}
