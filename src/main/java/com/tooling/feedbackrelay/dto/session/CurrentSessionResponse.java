package com.tooling.feedbackrelay.dto.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code GET /api/current-session}, polled by tabs that lost their socket.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurrentSessionResponse {

    @JsonProperty("session_id")
    private String sessionId;
    private String status;
    private String summary;
    @JsonProperty("project_directory")
    private String projectDirectory;
    @JsonProperty("created_at")
    private long createdAt; // epoch millis

    public static CurrentSessionResponse from(SessionSnapshot session) {
        return new CurrentSessionResponse(
                session.getId(),
                session.getStatus().getWireValue(),
                session.getSummary(),
                session.getProjectDirectory(),
                session.getCreatedAt().toEpochMilli());
    }
}
