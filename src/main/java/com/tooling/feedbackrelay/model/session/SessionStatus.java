package com.tooling.feedbackrelay.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of a feedback session. Transitions only move forward:
 * {@code waiting -> processing -> submitted -> completed}, or from an awaiting
 * state straight to {@code error}. A session that is replaced before anyone
 * answered is closed as {@code completed}.
 */
public enum SessionStatus {
    WAITING("waiting"),
    PROCESSING("processing"),
    SUBMITTED("submitted"),
    ERROR("error"),
    COMPLETED("completed");

    private final String wireValue;

    SessionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
    }

    /** Waiting, processing or submitted: at most one session may be in one of these. */
    public boolean isActive() {
        return this == WAITING || this == PROCESSING || this == SUBMITTED;
    }

    /** The human has not answered yet; only these states accept a submission or expire. */
    public boolean isAwaitingFeedback() {
        return this == WAITING || this == PROCESSING;
    }

    public boolean isFinal() {
        return this == ERROR || this == COMPLETED;
    }

    public boolean canTransitionTo(SessionStatus next) {
        switch (this) {
            case WAITING:
                return next == PROCESSING || next == ERROR || next == COMPLETED;
            case PROCESSING:
                return next == SUBMITTED || next == ERROR || next == COMPLETED;
            case SUBMITTED:
                return next == COMPLETED;
            default:
                return false;
        }
    }
}
