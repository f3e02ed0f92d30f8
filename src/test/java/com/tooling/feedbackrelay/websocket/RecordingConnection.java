package com.tooling.feedbackrelay.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory connection that keeps every frame it was sent.
 */
public class RecordingConnection implements RelayConnection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> frames = new ArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failOnSend;
    private volatile Instant lastHeartbeatAt;
    private volatile String closeReason;

    public RecordingConnection(String id, Instant connectedAt) {
        this.id = id;
        this.lastHeartbeatAt = connectedAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    @Override
    public void markHeartbeat(Instant at) {
        lastHeartbeatAt = at;
    }

    @Override
    public synchronized void send(String payload) {
        if (failOnSend) {
            throw new IllegalStateException("peer went away");
        }
        frames.add(payload);
    }

    @Override
    public void close(String reason) {
        open = false;
        closeReason = reason;
    }

    public void failOnSend() {
        failOnSend = true;
    }

    public void drop() {
        open = false;
    }

    public String getCloseReason() {
        return closeReason;
    }

    public synchronized List<JsonNode> frames() {
        return frames.stream().map(RecordingConnection::parse).collect(Collectors.toList());
    }

    public List<String> types() {
        return frames().stream().map(frame -> frame.path("type").asText()).collect(Collectors.toList());
    }

    public List<JsonNode> framesOfType(String type) {
        return frames().stream()
                .filter(frame -> type.equals(frame.path("type").asText()))
                .collect(Collectors.toList());
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Frame is not JSON: " + frame, e);
        }
    }
}
