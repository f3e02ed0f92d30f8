package com.tooling.feedbackrelay.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of message kinds on the relay socket. Kinds are only ever added.
 */
public enum MessageType {
    SUBMIT_FEEDBACK("submit_feedback", Direction.CLIENT_TO_SERVER),
    HEARTBEAT("heartbeat", Direction.CLIENT_TO_SERVER),
    LANGUAGE_SWITCH("language_switch", Direction.CLIENT_TO_SERVER),
    GET_STATUS("get_status", Direction.CLIENT_TO_SERVER),

    CONNECTION_ESTABLISHED("connection_established", Direction.SERVER_TO_CLIENT),
    SESSION_UPDATED("session_updated", Direction.SERVER_TO_CLIENT),
    FEEDBACK_RECEIVED("feedback_received", Direction.SERVER_TO_CLIENT),
    STATUS_UPDATE("status_update", Direction.SERVER_TO_CLIENT),
    ERROR("error", Direction.SERVER_TO_CLIENT),
    HEARTBEAT_RESPONSE("heartbeat_response", Direction.SERVER_TO_CLIENT);

    public enum Direction {
        CLIENT_TO_SERVER,
        SERVER_TO_CLIENT
    }

    private final String wireName;
    private final Direction direction;

    MessageType(String wireName, Direction direction) {
        this.wireName = wireName;
        this.direction = direction;
    }

    public String getWireName() {
        return wireName;
    }

    public Direction getDirection() {
        return direction;
    }

    public static Optional<MessageType> fromWire(String wireName, Direction direction) {
        return Arrays.stream(values())
                .filter(type -> type.direction == direction && type.wireName.equals(wireName))
                .findFirst();
    }
}
