package com.tooling.feedbackrelay.client;

/**
 * The visible feedback form. Called from the reconciler thread only.
 */
public interface FeedbackForm {

    void showSession(ClientSessionView session);

    /** Back to the writable state, ready for a new answer. */
    void resetToWaiting();

    void clearDraft();

    void showStatus(String status, String message);

    void showError(String errorCode, String message);

    void showConnectionState(ConnectionState state);
}
