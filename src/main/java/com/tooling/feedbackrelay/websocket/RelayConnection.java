package com.tooling.feedbackrelay.websocket;

import java.time.Instant;

/**
 * One live client link. Connections are never owned by a session; the
 * registry only records which session id each one is attached to.
 */
public interface RelayConnection {

    String getId();

    boolean isOpen();

    Instant getLastHeartbeatAt();

    void markHeartbeat(Instant at);

    /**
     * Queues an encoded frame. Must return without waiting on the peer; delivery
     * failures are reported to the registry asynchronously.
     */
    void send(String payload);

    void close(String reason);
}
