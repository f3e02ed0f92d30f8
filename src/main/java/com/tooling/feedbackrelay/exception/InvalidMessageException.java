package com.tooling.feedbackrelay.exception;

public class InvalidMessageException extends FeedbackRelayException {

    public InvalidMessageException(String message, Throwable cause) {
        super(ErrorCode.INVALID_MESSAGE, null, message, cause);
    }
}
