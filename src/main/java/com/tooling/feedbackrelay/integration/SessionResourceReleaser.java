package com.tooling.feedbackrelay.integration;

import com.tooling.feedbackrelay.model.session.SessionSnapshot;

/**
 * Frees whatever other components tied to a session (spawned commands, temp
 * files) once that session ends without feedback or is replaced.
 */
public interface SessionResourceReleaser {

    void release(SessionSnapshot session);
}
