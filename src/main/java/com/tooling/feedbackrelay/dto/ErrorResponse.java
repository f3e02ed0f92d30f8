package com.tooling.feedbackrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("error_code")
    private String errorCode;
    private String message;
    @JsonProperty("session_id")
    private String sessionId;
    private List<String> violations;

    public ErrorResponse(String errorCode, String message) {
        this(errorCode, message, null, null);
    }
}
