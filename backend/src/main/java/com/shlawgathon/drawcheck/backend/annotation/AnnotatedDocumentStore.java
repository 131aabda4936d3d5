package com.shlawgathon.drawcheck.backend.annotation;

import com.shlawgathon.drawcheck.backend.model.AnnotatedDocumentRef;

import java.util.Optional;

public interface AnnotatedDocumentStore {

    AnnotatedDocumentRef save(String requestId, AnnotatedDocument document);

    Optional<AnnotatedDocument> load(String documentId);

    void delete(String documentId);
}
