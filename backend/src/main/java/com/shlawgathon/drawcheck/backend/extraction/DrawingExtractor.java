package com.shlawgathon.drawcheck.backend.extraction;

import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;

/**
 * Turns raw document bytes into structured drawing data.
 */
public interface DrawingExtractor {

    /**
     * Extract with the given deadline and cancellation flag. Pages that time
     * out are reported as missing and the result is flagged incomplete.
     *
     * @throws ExtractionException when no page yields usable content
     */
    ExtractedDrawingData extract(byte[] document, ExtractionControl control) throws ExtractionException;

    default ExtractedDrawingData extract(byte[] document) throws ExtractionException {
        return extract(document, ExtractionControl.unbounded());
    }
}
