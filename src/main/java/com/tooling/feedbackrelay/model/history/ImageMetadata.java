package com.tooling.feedbackrelay.model.history;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ImageMetadata {
    String name;
    String type;
    long size;
}
