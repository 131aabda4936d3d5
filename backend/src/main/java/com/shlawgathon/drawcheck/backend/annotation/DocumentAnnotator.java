package com.shlawgathon.drawcheck.backend.annotation;

import com.shlawgathon.drawcheck.backend.model.ValidationIssue;

import java.util.List;

/**
 * Marks issues on a copy of the source document. Issues without a usable
 * location are listed on a summary page.
 */
public interface DocumentAnnotator {

    AnnotatedDocument annotate(byte[] document, String documentName, List<ValidationIssue> issues)
            throws AnnotationException;
}
