package com.tooling.feedbackrelay.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatResponseMessage implements ServerMessage {

    private Long timestamp;

    @Override
    public MessageType messageType() {
        return MessageType.HEARTBEAT_RESPONSE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHeartbeatResponse(this);
    }
}
