package com.tooling.feedbackrelay.client;

import lombok.Value;

@Value
public class ClientSessionView {
    String sessionId;
    String summary;
    String projectDirectory;
    String status;
}
