package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pointer to a stored annotated copy of the source document.
 */
@Value
@Builder
@Jacksonized
public class AnnotatedDocumentRef {
    String documentId;
    String filename;
    int markerCount;
    int summaryIssueCount;
}
