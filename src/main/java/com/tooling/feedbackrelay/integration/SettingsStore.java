package com.tooling.feedbackrelay.integration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Keyed store for JSON blobs: UI settings, the session history.
 */
public interface SettingsStore {

    Optional<JsonNode> load(String key);

    void save(String key, JsonNode blob);

    void clear(String key);
}
