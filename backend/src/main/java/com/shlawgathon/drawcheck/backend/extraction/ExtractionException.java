package com.shlawgathon.drawcheck.backend.extraction;

/**
 * Neither the text layer nor OCR produced usable content.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
