package com.tooling.feedbackrelay.model.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Frozen copy of a finished session. Times are epoch milliseconds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryEntry {

    @JsonProperty("session_id")
    String sessionId;
    SessionStatus status;
    String summary;
    @JsonProperty("project_directory")
    String projectDirectory;
    @JsonProperty("created_at")
    long createdAt;
    @JsonProperty("completed_at")
    long completedAt;
    long duration;
    @JsonProperty("error_reason")
    String errorReason;
    @Builder.Default
    List<UserMessage> userMessages = List.of();

    @JsonIgnore
    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }
}
