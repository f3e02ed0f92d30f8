package com.tooling.feedbackrelay.exception;

import lombok.Getter;

/**
 * A pending wait ended because its session was replaced or cancelled.
 */
@Getter
public class SessionSupersededException extends FeedbackRelayException {

    private final String reason;

    public SessionSupersededException(String sessionId, String reason) {
        super(ErrorCode.SUPERSEDED, sessionId, "Session " + sessionId + " ended before feedback arrived (" + reason + ")");
        this.reason = reason;
    }
}
