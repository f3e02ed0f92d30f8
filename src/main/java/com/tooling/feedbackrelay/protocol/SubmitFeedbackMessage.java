package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmitFeedbackMessage implements ClientMessage {

    // Optional: the session the tab was showing. Falls back to the connection's session.
    @JsonProperty("session_id")
    private String sessionId;
    private String feedback;
    private List<ImageAttachment> images = new ArrayList<>();
    private Map<String, Object> settings = new HashMap<>();

    @Override
    public MessageType messageType() {
        return MessageType.SUBMIT_FEEDBACK;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSubmitFeedback(this);
    }
}
