package com.shlawgathon.drawcheck.backend.extraction;

/**
 * Raised when a request is cancelled while its document is being read.
 */
public class ExtractionCancelledException extends RuntimeException {

    public ExtractionCancelledException(String message) {
        super(message);
    }
}
