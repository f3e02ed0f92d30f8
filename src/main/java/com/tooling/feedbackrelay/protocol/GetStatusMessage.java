package com.tooling.feedbackrelay.protocol;

import lombok.Data;

@Data
public class GetStatusMessage implements ClientMessage {

    @Override
    public MessageType messageType() {
        return MessageType.GET_STATUS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGetStatus(this);
    }
}
