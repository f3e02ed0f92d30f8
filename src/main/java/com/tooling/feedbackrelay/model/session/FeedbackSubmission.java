package com.tooling.feedbackrelay.model.session;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feedback that already passed validation and may be handed to the session store.
 */
@Value
public class FeedbackSubmission {
    String feedbackText;
    List<ImageAttachment> images;
    Map<String, Object> settings;

    public FeedbackSubmission(String feedbackText, List<ImageAttachment> images, Map<String, Object> settings) {
        this.feedbackText = feedbackText == null ? "" : feedbackText;
        this.images = images == null ? List.of() : List.copyOf(images);
        // settings may hold JSON nulls, which Map.copyOf rejects
        this.settings = settings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }
}
