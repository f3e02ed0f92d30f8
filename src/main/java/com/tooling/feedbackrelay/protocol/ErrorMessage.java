package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorMessage implements ServerMessage {

    @JsonProperty("error_code")
    private String errorCode;
    private String message;
    private Map<String, Object> details;

    @Override
    public MessageType messageType() {
        return MessageType.ERROR;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitError(this);
    }
}
