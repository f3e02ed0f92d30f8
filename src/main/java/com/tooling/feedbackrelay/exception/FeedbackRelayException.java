package com.tooling.feedbackrelay.exception;

import lombok.Getter;

@Getter
public class FeedbackRelayException extends RuntimeException {

    /** Shown to the human when a submission targets a request that is gone. */
    public static final String REQUEST_NO_LONGER_ACTIVE = "This feedback request is no longer active";

    private final ErrorCode errorCode;
    private final String sessionId;

    public FeedbackRelayException(ErrorCode errorCode, String sessionId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }

    public FeedbackRelayException(ErrorCode errorCode, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }
}
