package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.dto.session.CurrentSessionResponse;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.protocol.ServerMessage;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the reconciler reacts to arrives as one of these, on one queue.
 */
public interface TransportEvent {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConnected(Connected event);

        R visitDisconnected(Disconnected event);

        R visitMessageReceived(MessageReceived event);

        R visitPollResult(PollResult event);

        R visitPollFailed(PollFailed event);

        R visitHeartbeatTick(HeartbeatTick event);

        R visitReconnectDue(ReconnectDue event);

        R visitSubmitRequested(SubmitRequested event);

        R visitStop(Stop event);
    }

    @Value
    class Connected implements TransportEvent {
        SessionChangeNotifier transport;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConnected(this);
        }
    }

    @Value
    class Disconnected implements TransportEvent {
        SessionChangeNotifier transport;
        String reason;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDisconnected(this);
        }
    }

    @Value
    class MessageReceived implements TransportEvent {
        ServerMessage message;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMessageReceived(this);
        }
    }

    /** Empty when the server has no session. */
    @Value
    class PollResult implements TransportEvent {
        Optional<CurrentSessionResponse> session;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPollResult(this);
        }
    }

    @Value
    class PollFailed implements TransportEvent {
        String reason;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPollFailed(this);
        }
    }

    @Value
    class HeartbeatTick implements TransportEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHeartbeatTick(this);
        }
    }

    @Value
    class ReconnectDue implements TransportEvent {
        int attempt;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReconnectDue(this);
        }
    }

    @Value
    class SubmitRequested implements TransportEvent {
        String feedbackText;
        List<ImageAttachment> images;
        Map<String, Object> settings;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubmitRequested(this);
        }
    }

    @Value
    class Stop implements TransportEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStop(this);
        }
    }
}
