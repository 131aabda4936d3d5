package com.shlawgathon.drawcheck.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationProgress;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Frame sent to progress subscribers.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketMessage {

    public static final String CONNECTED = "CONNECTED";
    public static final String PROGRESS = "PROGRESS";
    public static final String UNKNOWN_REQUEST = "UNKNOWN_REQUEST";

    String type;
    String requestId;
    ReportStatus phase;
    Integer percent;
    String message;
    Instant timestamp;
    boolean terminal;

    public static WebSocketMessage progress(ValidationProgress progress) {
        return WebSocketMessage.builder()
                .type(PROGRESS)
                .requestId(progress.getRequestId())
                .phase(progress.getPhase())
                .percent(progress.getPercent())
                .message(progress.getMessage())
                .timestamp(progress.getTimestamp())
                .terminal(progress.getPhase() != null && progress.getPhase().isTerminal())
                .build();
    }
}
