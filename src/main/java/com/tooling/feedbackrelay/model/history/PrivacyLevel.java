package com.tooling.feedbackrelay.model.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How much of the submitted feedback is kept in history.
 */
public enum PrivacyLevel {
    /** Text and image metadata. */
    FULL("full"),
    /** Lengths and counts only. */
    BASIC("basic"),
    /** Timestamp only. */
    DISABLED("disabled");

    private final String wireValue;

    PrivacyLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static PrivacyLevel fromWire(String value) {
        return Arrays.stream(values())
                .filter(level -> level.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown privacy level: " + value));
    }
}
