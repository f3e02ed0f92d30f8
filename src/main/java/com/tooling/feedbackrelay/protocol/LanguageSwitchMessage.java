package com.tooling.feedbackrelay.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LanguageSwitchMessage implements ClientMessage {

    private String language;

    @Override
    public MessageType messageType() {
        return MessageType.LANGUAGE_SWITCH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLanguageSwitch(this);
    }
}
