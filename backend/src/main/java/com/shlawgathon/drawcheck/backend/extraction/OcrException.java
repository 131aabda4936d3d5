package com.shlawgathon.drawcheck.backend.extraction;

public class OcrException extends Exception {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
