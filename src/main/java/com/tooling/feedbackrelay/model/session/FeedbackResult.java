package com.tooling.feedbackrelay.model.session;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the agent receives once the human answered.
 */
@Value
public class FeedbackResult {
    String sessionId;
    String feedbackText;
    List<ImageAttachment> images;
    Map<String, Object> settings;
}
