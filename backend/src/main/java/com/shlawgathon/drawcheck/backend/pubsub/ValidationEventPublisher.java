package com.shlawgathon.drawcheck.backend.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.config.RedisMessageConfig;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes validation progress to Redis Pub/Sub so every backend instance
 * can forward it to its WebSocket clients.
 */
@Component
public class ValidationEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ValidationEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public ValidationEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish failures are logged and dropped; the stored report stays the
     * source of truth.
     */
    public void publishProgress(ValidationProgress progress) {
        try {
            redisTemplate.convertAndSend(RedisMessageConfig.VALIDATION_EVENTS_CHANNEL,
                    objectMapper.writeValueAsString(progress));
            log.debug("[PUB/SUB] Published {} {}% for request: {}", progress.getPhase(), progress.getPercent(),
                    progress.getRequestId());
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("[PUB/SUB] Failed to publish progress for request: {}", progress.getRequestId(), e);
        }
    }
}
