package com.tooling.feedbackrelay.dto.session;

import com.tooling.feedbackrelay.model.session.ImageAttachment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP form of {@code submit_feedback}, used by tabs running on the polling transport.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackSubmissionRequest {

    private String feedback;
    private List<ImageAttachment> images = new ArrayList<>();
    private Map<String, Object> settings = new HashMap<>();
}
