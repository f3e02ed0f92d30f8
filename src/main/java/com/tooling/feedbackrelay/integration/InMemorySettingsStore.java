package com.tooling.feedbackrelay.integration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySettingsStore implements SettingsStore {

    private final Map<String, JsonNode> blobs = new ConcurrentHashMap<>();

    @Override
    public Optional<JsonNode> load(String key) {
        return Optional.ofNullable(blobs.get(key)).map(JsonNode::deepCopy);
    }

    @Override
    public void save(String key, JsonNode blob) {
        blobs.put(key, blob.deepCopy());
    }

    @Override
    public void clear(String key) {
        blobs.remove(key);
    }
}
