package com.tooling.feedbackrelay.exception;

public class FeedbackTimeoutException extends FeedbackRelayException {

    public FeedbackTimeoutException(String sessionId, long timeoutSeconds) {
        super(ErrorCode.TIMEOUT, sessionId,
                "No feedback for session " + sessionId + " within " + timeoutSeconds + " seconds");
    }
}
