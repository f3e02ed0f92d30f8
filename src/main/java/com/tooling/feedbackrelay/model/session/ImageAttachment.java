package com.tooling.feedbackrelay.model.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An image pasted or uploaded with the feedback. {@code data} is base64 encoded.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageAttachment {
    String name;
    String type;
    long size;
    String data;
}
