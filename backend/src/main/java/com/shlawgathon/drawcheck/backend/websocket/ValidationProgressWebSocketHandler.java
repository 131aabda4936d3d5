package com.shlawgathon.drawcheck.backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.repository.ValidationReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams progress of one validation request to the clients subscribed at
 * {@code /ws/validations/{requestId}}. A new subscriber first receives the
 * stored state of the report, so joining late does not lose the phase.
 */
@Component
public class ValidationProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ValidationProgressWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ValidationReportRepository reportRepository;

    // requestId -> sessionId -> session
    private final Map<String, Map<String, WebSocketSession>> subscribers = new ConcurrentHashMap<>();

    public ValidationProgressWebSocketHandler(ObjectMapper objectMapper,
            ValidationReportRepository reportRepository) {
        this.objectMapper = objectMapper;
        this.reportRepository = reportRepository;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String requestId = extractRequestId(session);
        if (requestId == null) {
            close(session, CloseStatus.BAD_DATA);
            return;
        }
        Optional<ValidationReport> report = reportRepository.findById(requestId);
        if (report.isEmpty()) {
            send(session, WebSocketMessage.builder()
                    .type(WebSocketMessage.UNKNOWN_REQUEST)
                    .requestId(requestId)
                    .message("No validation request " + requestId)
                    .build());
            close(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        subscribers.computeIfAbsent(requestId, k -> new ConcurrentHashMap<>()).put(session.getId(), session);
        log.info("[WS] Subscribed session {} to request {}", session.getId(), requestId);
        send(session, snapshot(report.get()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String requestId = extractRequestId(session);
        if (requestId == null) {
            return;
        }
        subscribers.computeIfPresent(requestId, (id, sessions) -> {
            sessions.remove(session.getId());
            return sessions.isEmpty() ? null : sessions;
        });
        log.info("[WS] Session {} left request {} ({})", session.getId(), requestId, status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Subscribers only listen.
        log.debug("[WS] Ignoring client message on session {}", session.getId());
    }

    /**
     * Forward one frame to every local subscriber of the request.
     */
    public void broadcast(String requestId, WebSocketMessage message) {
        Map<String, WebSocketSession> sessions = subscribers.get(requestId);
        if (sessions == null || sessions.isEmpty()) {
            return;
        }
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("[WS] Could not serialize {} frame for request {}", message.getType(), requestId, e);
            return;
        }
        sessions.values().forEach(session -> sendFrame(session, frame));
    }

    public int sessionCount(String requestId) {
        Map<String, WebSocketSession> sessions = subscribers.get(requestId);
        return sessions == null ? 0 : sessions.size();
    }

    static WebSocketMessage snapshot(ValidationReport report) {
        return WebSocketMessage.builder()
                .type(WebSocketMessage.CONNECTED)
                .requestId(report.getRequestId())
                .phase(report.getStatus())
                .percent(report.getStatus().basePercent())
                .message(report.getStatus().isTerminal() && report.getErrorMessage() != null
                        ? report.getErrorMessage()
                        : "Subscribed to validation progress")
                .terminal(report.getStatus().isTerminal())
                .build();
    }

    private void send(WebSocketSession session, WebSocketMessage message) {
        try {
            sendFrame(session, new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.error("[WS] Could not serialize {} frame", message.getType(), e);
        }
    }

    private static void sendFrame(WebSocketSession session, TextMessage frame) {
        if (!session.isOpen()) {
            return;
        }
        try {
            // Sessions are not safe for concurrent sends.
            synchronized (session) {
                session.sendMessage(frame);
            }
        } catch (IOException e) {
            log.warn("[WS] Failed to send to session {}: {}", session.getId(), e.getMessage());
        }
    }

    static String extractRequestId(String path) {
        if (path == null) {
            return null;
        }
        // Path format: /ws/validations/{requestId}
        String[] parts = path.split("/");
        if (parts.length >= 4 && "validations".equals(parts[2]) && !parts[3].isBlank()) {
            return parts[3];
        }
        return null;
    }

    private static String extractRequestId(WebSocketSession session) {
        return session.getUri() == null ? null : extractRequestId(session.getUri().getPath());
    }

    private static void close(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[WS] Failed to close session {}: {}", session.getId(), e.getMessage());
        }
    }
}
