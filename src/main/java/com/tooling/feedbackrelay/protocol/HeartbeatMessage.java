package com.tooling.feedbackrelay.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatMessage implements ClientMessage {

    private Long timestamp;

    @Override
    public MessageType messageType() {
        return MessageType.HEARTBEAT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHeartbeat(this);
    }
}
