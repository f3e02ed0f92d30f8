package com.tooling.feedbackrelay.client;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Socket reconnects exhausted; session changes are detected by polling. */
    POLLING
}
