package com.tooling.feedbackrelay.exception;

public class StaleSessionException extends FeedbackRelayException {

    public StaleSessionException(String sessionId) {
        super(ErrorCode.STALE_SESSION, sessionId, "Session " + sessionId + " is not the active session");
    }
}
