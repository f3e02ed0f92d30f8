package com.tooling.feedbackrelay.dto.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatusResponse {

    @JsonProperty("has_session")
    private boolean hasSession;
    private String status;
    private String message;
    @JsonProperty("session_info")
    private SessionInfo sessionInfo;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionInfo {
        @JsonProperty("session_id")
        private String sessionId;
        @JsonProperty("project_directory")
        private String projectDirectory;
        private String summary;
        @JsonProperty("feedback_completed")
        private boolean feedbackCompleted;
        @JsonProperty("error_reason")
        private String errorReason;
    }
}
