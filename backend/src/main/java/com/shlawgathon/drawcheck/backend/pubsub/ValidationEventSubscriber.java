package com.shlawgathon.drawcheck.backend.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import com.shlawgathon.drawcheck.backend.websocket.ValidationProgressWebSocketHandler;
import com.shlawgathon.drawcheck.backend.websocket.WebSocketMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Receives progress from Redis and hands it to the WebSocket sessions of
 * this instance.
 */
@Component
public class ValidationEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(ValidationEventSubscriber.class);

    private final ObjectMapper objectMapper;
    private final ValidationProgressWebSocketHandler webSocketHandler;

    public ValidationEventSubscriber(ObjectMapper objectMapper, ValidationProgressWebSocketHandler webSocketHandler) {
        this.objectMapper = objectMapper;
        this.webSocketHandler = webSocketHandler;
    }

    /**
     * Called by Spring's MessageListenerAdapter.
     */
    public void handleMessage(String message) {
        ValidationProgress progress;
        try {
            progress = objectMapper.readValue(message, ValidationProgress.class);
        } catch (JsonProcessingException e) {
            log.error("[PUB/SUB] Dropping unreadable progress message: {}", message, e);
            return;
        }
        if (progress.getRequestId() == null) {
            log.warn("[PUB/SUB] Dropping progress without request id: {}", message);
            return;
        }
        log.debug("[PUB/SUB] Received {} for request: {}", progress.getPhase(), progress.getRequestId());
        webSocketHandler.broadcast(progress.getRequestId(), WebSocketMessage.progress(progress));
    }
}
