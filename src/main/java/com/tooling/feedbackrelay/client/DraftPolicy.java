package com.tooling.feedbackrelay.client;

/**
 * What happens to unsent text in the form when the agent replaces the session.
 */
public enum DraftPolicy {
    DISCARD,
    PRESERVE
}
