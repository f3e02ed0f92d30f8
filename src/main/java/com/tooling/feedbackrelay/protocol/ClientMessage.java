package com.tooling.feedbackrelay.protocol;

/**
 * A message sent by a browser tab (or the Java client) to the hub.
 */
public interface ClientMessage {

    MessageType messageType();

    <R> R accept(Visitor<R> visitor);

    /**
     * One method per client kind. Adding a kind breaks every visitor at compile time.
     */
    interface Visitor<R> {
        R visitSubmitFeedback(SubmitFeedbackMessage message);

        R visitHeartbeat(HeartbeatMessage message);

        R visitLanguageSwitch(LanguageSwitchMessage message);

        R visitGetStatus(GetStatusMessage message);
    }
}
