package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackReceivedMessage implements ServerMessage {

    @JsonProperty("session_id")
    private String sessionId;
    private String status;
    private String message;

    @Override
    public MessageType messageType() {
        return MessageType.FEEDBACK_RECEIVED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFeedbackReceived(this);
    }
}
