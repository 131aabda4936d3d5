package com.shlawgathon.drawcheck.backend.annotation;

/**
 * Annotated copy of a source document, always a PDF.
 */
public record AnnotatedDocument(String filename, byte[] content, int markerCount, int summaryIssueCount) {

    public static final String CONTENT_TYPE = "application/pdf";
}
