package com.shlawgathon.drawcheck.backend.standards;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the bundled reference tables from the classpath.
 */
public class StandardsLoader {

    private static final Logger log = LoggerFactory.getLogger(StandardsLoader.class);

    private final ObjectMapper objectMapper;
    private final String basePath;

    public StandardsLoader(ObjectMapper objectMapper, String basePath) {
        this.objectMapper = objectMapper;
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    }

    /**
     * Load every category. A missing or malformed file is fatal.
     */
    public Map<StandardsCategory, List<StandardsRecord>> loadAll() {
        Map<StandardsCategory, List<StandardsRecord>> tables = new EnumMap<>(StandardsCategory.class);
        for (StandardsCategory category : StandardsCategory.values()) {
            tables.put(category, load(category));
        }
        return tables;
    }

    public List<StandardsRecord> load(StandardsCategory category) {
        Resource resource = new ClassPathResource(basePath + category.resource());
        try (InputStream in = resource.getInputStream()) {
            StandardsDataset dataset = objectMapper.readValue(in, StandardsDataset.class);
            if (dataset.category() != category) {
                throw new IllegalStateException("Standards file " + resource.getFilename()
                        + " declares category " + dataset.category() + ", expected " + category);
            }
            List<StandardsRecord> records = new ArrayList<>();
            for (StandardsRecord record : dataset.records()) {
                if (record.getDesignation() == null || record.getDesignation().isBlank()) {
                    throw new IllegalStateException("Standards file " + resource.getFilename()
                            + " contains a record without designation");
                }
                records.add(record.toBuilder()
                        .category(category)
                        .citation(record.getCitation() != null ? record.getCitation() : dataset.citation())
                        .build());
            }
            log.info("[STANDARDS] Loaded {} {} records from {}", records.size(), category, resource.getFilename());
            return List.copyOf(records);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load standards table " + basePath + category.resource(), e);
        }
    }
}
