package com.shlawgathon.drawcheck.backend.config;

import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.GridFSBuckets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;

/**
 * GridFS storage for annotated drawings. Reports themselves are regular
 * documents in {@code validation_reports}.
 */
@Configuration
public class MongoConfig {

    @Value("${drawcheck.annotation.bucket:annotated}")
    private String annotatedBucket;

    @Bean
    public GridFsTemplate annotatedDocumentsTemplate(MongoDatabaseFactory databaseFactory,
            MappingMongoConverter converter) {
        return new GridFsTemplate(databaseFactory, converter, annotatedBucket);
    }

    @Bean
    public GridFSBucket annotatedDocumentsBucket(MongoDatabaseFactory databaseFactory) {
        return GridFSBuckets.create(databaseFactory.getMongoDatabase(), annotatedBucket);
    }
}
