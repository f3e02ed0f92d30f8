package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire frame: {@code { type, data, timestamp }}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageEnvelope {
    private String type;
    private JsonNode data;
    private String timestamp;
}
