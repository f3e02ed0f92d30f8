package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionEstablishedMessage implements ServerMessage {

    // null while no session exists yet
    @JsonProperty("session_id")
    private String sessionId;
    @JsonProperty("server_time")
    private String serverTime;

    @Override
    public MessageType messageType() {
        return MessageType.CONNECTION_ESTABLISHED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConnectionEstablished(this);
    }
}
