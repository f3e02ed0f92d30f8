package com.tooling.feedbackrelay.exception;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCode {
    VALIDATION_ERROR("validation_error"),
    STALE_SESSION("stale_session"),
    ALREADY_SUBMITTED("already_submitted"),
    SUPERSEDED("superseded"),
    TIMEOUT("timeout"),
    CONNECTION_ERROR("connection_error"),
    INVALID_MESSAGE("invalid_message"),
    NO_ACTIVE_SESSION("no_active_session");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
