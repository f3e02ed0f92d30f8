package com.tooling.feedbackrelay.model.session;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mutable session record owned by {@code SessionStore}. Every mutator must be
 * called with the store lock held; other components only ever see
 * {@link SessionSnapshot}s.
 */
@Getter
public class FeedbackSession {

    private final String id;
    private final String projectDirectory;
    private final String summary;
    private final int timeoutSeconds;
    private final Instant createdAt;

    private SessionStatus status = SessionStatus.WAITING;
    private Instant completedAt;
    private Instant submittedAt;
    private String feedbackText;
    private List<ImageAttachment> images = List.of();
    private Map<String, Object> settings = Map.of();
    private String errorReason;
    private long timerGeneration;
    private boolean recordedInHistory;

    public FeedbackSession(String id, String projectDirectory, String summary, int timeoutSeconds, Instant createdAt) {
        this.id = id;
        this.projectDirectory = projectDirectory;
        this.summary = summary;
        this.timeoutSeconds = timeoutSeconds;
        this.createdAt = createdAt;
    }

    public void transitionTo(SessionStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Session " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        if (next.isFinal()) {
            completedAt = at;
        }
    }

    public void fail(String reason, Instant at) {
        transitionTo(SessionStatus.ERROR, at);
        errorReason = reason;
    }

    public void recordSubmission(FeedbackSubmission submission, Instant at) {
        if (feedbackText != null) {
            throw new IllegalStateException("Feedback for session " + id + " was already recorded");
        }
        feedbackText = submission.getFeedbackText();
        images = submission.getImages();
        settings = submission.getSettings();
        submittedAt = at;
    }

    /** Starts a new timer generation; a timer carrying an older generation is stale. */
    public long nextTimerGeneration() {
        return ++timerGeneration;
    }

    public void markRecordedInHistory() {
        recordedInHistory = true;
    }

    public FeedbackResult toResult() {
        return new FeedbackResult(id, feedbackText == null ? "" : feedbackText, images, settings);
    }

    public SessionSnapshot snapshot() {
        return SessionSnapshot.builder()
                .id(id)
                .status(status)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .timeoutSeconds(timeoutSeconds)
                .projectDirectory(projectDirectory)
                .summary(summary)
                .feedbackText(feedbackText)
                .images(images)
                .settings(settings)
                .submittedAt(submittedAt)
                .errorReason(errorReason)
                .build();
    }
}
