package com.tooling.feedbackrelay.model.session;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a session at one point in time. This is the only form in
 * which sessions leave the store.
 */
@Value
@Builder(toBuilder = true)
public class SessionSnapshot {
    String id;
    SessionStatus status;
    Instant createdAt;
    Instant completedAt;
    int timeoutSeconds;
    String projectDirectory;
    String summary;
    String feedbackText;
    List<ImageAttachment> images;
    Map<String, Object> settings;
    Instant submittedAt;
    String errorReason;

    public Duration getDuration() {
        if (completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, completedAt);
    }
}
