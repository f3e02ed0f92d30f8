package com.tooling.feedbackrelay.exception;

import com.tooling.feedbackrelay.model.session.SessionStatus;
import lombok.Getter;

@Getter
public class AlreadySubmittedException extends FeedbackRelayException {

    private final SessionStatus status;

    public AlreadySubmittedException(String sessionId, SessionStatus status) {
        super(ErrorCode.ALREADY_SUBMITTED, sessionId,
                "Session " + sessionId + " no longer accepts feedback (status " + status.getWireValue() + ")");
        this.status = status;
    }
}
