package com.tooling.feedbackrelay.dto.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent-side request. {@code timeout} is in seconds; omitted means the configured default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    private String summary;
    @JsonProperty("project_directory")
    private String projectDirectory;
    private Integer timeout;
}
