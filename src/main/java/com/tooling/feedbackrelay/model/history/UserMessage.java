package com.tooling.feedbackrelay.model.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One submission as retained in history. Which fields are present depends on
 * the privacy level at capture time.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserMessage {
    long timestamp;
    PrivacyLevel privacyLevel;
    String content;
    Integer contentLength;
    Integer imageCount;
    List<ImageMetadata> images;
}
