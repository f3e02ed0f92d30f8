package com.tooling.feedbackrelay.exception;

import lombok.Getter;

import java.util.List;

/**
 * The submission was malformed. Raised before any session state changes.
 */
@Getter
public class FeedbackValidationException extends FeedbackRelayException {

    private final List<String> violations;

    public FeedbackValidationException(List<String> violations) {
        super(ErrorCode.VALIDATION_ERROR, null, "Invalid feedback: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
