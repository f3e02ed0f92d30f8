package com.tooling.feedbackrelay.protocol;

/**
 * A message pushed by the hub to its connections.
 */
public interface ServerMessage {

    MessageType messageType();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConnectionEstablished(ConnectionEstablishedMessage message);

        R visitSessionUpdated(SessionUpdatedMessage message);

        R visitFeedbackReceived(FeedbackReceivedMessage message);

        R visitStatusUpdate(StatusUpdateMessage message);

        R visitError(ErrorMessage message);

        R visitHeartbeatResponse(HeartbeatResponseMessage message);
    }
}
