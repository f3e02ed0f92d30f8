package com.tooling.feedbackrelay.dto.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tooling.feedbackrelay.model.session.FeedbackResult;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackResultResponse {

    @JsonProperty("session_id")
    private String sessionId;
    @JsonProperty("interactive_feedback")
    private String interactiveFeedback;
    private List<ImageAttachment> images;
    private Map<String, Object> settings;

    public static FeedbackResultResponse from(FeedbackResult result) {
        return new FeedbackResultResponse(result.getSessionId(), result.getFeedbackText(),
                result.getImages(), result.getSettings());
    }
}
