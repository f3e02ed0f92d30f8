package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusUpdateMessage implements ServerMessage {

    private String status;
    private String message;
    private Integer progress;
    @JsonProperty("session_id")
    private String sessionId;
    // e.g. "timeout" or "cancelled" when the session ended without feedback
    private String reason;

    public StatusUpdateMessage(String status, String message, String sessionId) {
        this(status, message, null, sessionId, null);
    }

    @Override
    public MessageType messageType() {
        return MessageType.STATUS_UPDATE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStatusUpdate(this);
    }
}
