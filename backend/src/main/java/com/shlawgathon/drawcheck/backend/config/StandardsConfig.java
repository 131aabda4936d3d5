package com.shlawgathon.drawcheck.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.standards.StandardsLoader;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the reference tables once at startup. A broken table stops the
 * application from starting.
 */
@Configuration
public class StandardsConfig {

    private static final Logger log = LoggerFactory.getLogger(StandardsConfig.class);

    @Value("${drawcheck.standards.path:standards}")
    private String standardsPath;

    @Bean
    public StandardsStore standardsStore(ObjectMapper objectMapper) {
        StandardsStore store = new StandardsStore(new StandardsLoader(objectMapper, standardsPath).loadAll());
        log.info("[STANDARDS] Loaded {} reference records from {}", store.size(), standardsPath);
        return store;
    }
}
