package com.tooling.feedbackrelay.dto.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionAcceptedResponse {

    @JsonProperty("session_id")
    private String sessionId;
    private String status;
    private String message;
}
