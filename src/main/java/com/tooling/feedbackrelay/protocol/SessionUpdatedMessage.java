package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionUpdatedMessage implements ServerMessage {

    @JsonProperty("session_id")
    private String sessionId;
    private String summary;
    @JsonProperty("project_directory")
    private String projectDirectory;
    private String timestamp;

    @Override
    public MessageType messageType() {
        return MessageType.SESSION_UPDATED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSessionUpdated(this);
    }
}
