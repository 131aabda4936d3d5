package com.shlawgathon.drawcheck.backend.service;

import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.model.GridFSFile;
import com.mongodb.client.gridfs.model.GridFSUploadOptions;
import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocument;
import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocumentStore;
import com.shlawgathon.drawcheck.backend.model.AnnotatedDocumentRef;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Keeps annotated drawings in GridFS, tagged with the request they belong to.
 */
@Service
public class AnnotatedDocumentStorageService implements AnnotatedDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedDocumentStorageService.class);

    private final GridFsTemplate gridFsTemplate;
    private final GridFSBucket gridFSBucket;

    public AnnotatedDocumentStorageService(GridFsTemplate gridFsTemplate, GridFSBucket gridFSBucket) {
        this.gridFsTemplate = gridFsTemplate;
        this.gridFSBucket = gridFSBucket;
    }

    @Override
    public AnnotatedDocumentRef save(String requestId, AnnotatedDocument document) {
        Document metadata = new Document();
        metadata.put("contentType", AnnotatedDocument.CONTENT_TYPE);
        metadata.put("requestId", requestId);
        metadata.put("markerCount", document.markerCount());
        metadata.put("summaryIssueCount", document.summaryIssueCount());

        ObjectId fileId = gridFSBucket.uploadFromStream(
                document.filename(),
                new ByteArrayInputStream(document.content()),
                new GridFSUploadOptions().metadata(metadata));
        log.info("[ANNOTATE] Stored {} for request {} as {}", document.filename(), requestId, fileId);

        return AnnotatedDocumentRef.builder()
                .documentId(fileId.toString())
                .filename(document.filename())
                .markerCount(document.markerCount())
                .summaryIssueCount(document.summaryIssueCount())
                .build();
    }

    @Override
    public Optional<AnnotatedDocument> load(String documentId) {
        if (!ObjectId.isValid(documentId)) {
            return Optional.empty();
        }
        GridFSFile file = gridFsTemplate.findOne(new Query(Criteria.where("_id").is(new ObjectId(documentId))));
        if (file == null) {
            return Optional.empty();
        }
        try (InputStream in = gridFsTemplate.getResource(file).getInputStream()) {
            Document metadata = file.getMetadata() != null ? file.getMetadata() : new Document();
            return Optional.of(new AnnotatedDocument(
                    file.getFilename(),
                    in.readAllBytes(),
                    metadata.getInteger("markerCount", 0),
                    metadata.getInteger("summaryIssueCount", 0)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read annotated document " + documentId, e);
        }
    }

    @Override
    public void delete(String documentId) {
        if (ObjectId.isValid(documentId)) {
            gridFSBucket.delete(new ObjectId(documentId));
        }
    }

    public String getFileUrl(String requestId) {
        return "/api/validations/" + requestId + "/annotated";
    }
}
