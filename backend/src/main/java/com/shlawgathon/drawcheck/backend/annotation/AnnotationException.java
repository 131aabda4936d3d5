package com.shlawgathon.drawcheck.backend.annotation;

public class AnnotationException extends Exception {

    public AnnotationException(String message) {
        super(message);
    }

    public AnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
