package com.tooling.feedbackrelay.websocket;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import com.tooling.feedbackrelay.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Live client connections and the session each one is attached to.
 * <p>
 * Connections registered while no session exists wait in a pending pool and
 * are attached by the next {@link #migrate}. Membership only changes through
 * register, unregister, pruning and migration.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ProtocolCodec codec;
    private final Clock clock;
    private final Duration silenceLimit;

    private final Object lock = new Object();
    private final Map<String, RelayConnection> connections = new LinkedHashMap<>();
    // connection id -> session id; null value means pending
    private final Map<String, String> attachments = new HashMap<>();
    private String activeSessionId;

    public ConnectionRegistry(ProtocolCodec codec, Clock clock, FeedbackRelayProperties properties) {
        this.codec = codec;
        this.clock = clock;
        this.silenceLimit = Duration.ofSeconds(2L * properties.getHub().getHeartbeatIntervalSeconds());
    }

    /**
     * @return the session the connection was attached to, empty if it went to the pending pool
     */
    public Optional<String> register(RelayConnection connection) {
        synchronized (lock) {
            connections.put(connection.getId(), connection);
            attachments.put(connection.getId(), activeSessionId);
            log.info("Registered connection {} ({} live, attached to {})",
                    connection.getId(), connections.size(), activeSessionId == null ? "pending pool" : activeSessionId);
            return Optional.ofNullable(activeSessionId);
        }
    }

    public void unregister(String connectionId) {
        synchronized (lock) {
            if (connections.remove(connectionId) != null) {
                attachments.remove(connectionId);
                log.info("Unregistered connection {} ({} live)", connectionId, connections.size());
            }
        }
    }

    /**
     * Moves every registered connection, pending ones included, from the old
     * session to the new one without touching the underlying transports.
     *
     * @return number of connections now attached to {@code newSessionId}
     */
    public int migrate(String oldSessionId, String newSessionId) {
        Objects.requireNonNull(newSessionId, "newSessionId");
        synchronized (lock) {
            if (!Objects.equals(oldSessionId, activeSessionId)) {
                log.warn("Migrating from {} but registry was attached to {}", oldSessionId, activeSessionId);
            }
            attachments.replaceAll((connectionId, sessionId) -> newSessionId);
            activeSessionId = newSessionId;
            log.debug("Migrated {} connection(s) from {} to {}", attachments.size(), oldSessionId, newSessionId);
            return attachments.size();
        }
    }

    /**
     * Sends to every connection attached to the active session. Never throws:
     * a connection that cannot take the frame is logged and pruned.
     *
     * @return number of connections the frame was handed to
     */
    public int broadcast(ServerMessage message) {
        List<RelayConnection> targets;
        synchronized (lock) {
            if (activeSessionId == null) {
                log.debug("No active session, dropping {} broadcast", message.messageType().getWireName());
                return 0;
            }
            targets = new ArrayList<>();
            for (Map.Entry<String, String> attachment : attachments.entrySet()) {
                if (activeSessionId.equals(attachment.getValue())) {
                    targets.add(connections.get(attachment.getKey()));
                }
            }
        }
        if (targets.isEmpty()) {
            log.debug("No attached connections for {} broadcast", message.messageType().getWireName());
            return 0;
        }
        String payload = codec.encode(message);
        int delivered = 0;
        for (RelayConnection connection : targets) {
            if (deliver(connection, payload)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} to {}/{} connection(s)", message.messageType().getWireName(), delivered, targets.size());
        return delivered;
    }

    public boolean send(String connectionId, ServerMessage message) {
        RelayConnection connection;
        synchronized (lock) {
            connection = connections.get(connectionId);
        }
        if (connection == null) {
            log.warn("Cannot send {} to unknown connection {}", message.messageType().getWireName(), connectionId);
            return false;
        }
        return deliver(connection, codec.encode(message));
    }

    public void touch(String connectionId) {
        RelayConnection connection;
        synchronized (lock) {
            connection = connections.get(connectionId);
        }
        if (connection != null) {
            connection.markHeartbeat(clock.instant());
        }
    }

    public Optional<String> attachedSessionId(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(attachments.get(connectionId));
        }
    }

    public int attachedCount(String sessionId) {
        synchronized (lock) {
            return (int) attachments.values().stream().filter(sessionId::equals).count();
        }
    }

    public int liveConnectionCount() {
        synchronized (lock) {
            return (int) connections.values().stream().filter(RelayConnection::isOpen).count();
        }
    }

    /** Called by a connection whose asynchronous delivery failed. */
    public void markDead(RelayConnection connection) {
        prune(connection, "delivery failed");
    }

    @Scheduled(fixedDelayString = "${feedback-relay.hub.heartbeat-interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public void pruneSilentConnections() {
        pruneSilent(clock.instant());
    }

    /**
     * Drops connections whose last heartbeat is older than twice the heartbeat
     * interval. Leaving a session with no tabs is fine.
     */
    public int pruneSilent(Instant now) {
        Instant cutoff = now.minus(silenceLimit);
        List<RelayConnection> silent = new ArrayList<>();
        synchronized (lock) {
            for (RelayConnection connection : connections.values()) {
                if (!connection.isOpen() || connection.getLastHeartbeatAt().isBefore(cutoff)) {
                    silent.add(connection);
                }
            }
        }
        silent.forEach(connection -> prune(connection, "heartbeat timeout"));
        return silent.size();
    }

    private boolean deliver(RelayConnection connection, String payload) {
        if (!connection.isOpen()) {
            prune(connection, "connection closed");
            return false;
        }
        try {
            connection.send(payload);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to send to connection {}: {}", connection.getId(), e.getMessage());
            prune(connection, "send failed");
            return false;
        }
    }

    private void prune(RelayConnection connection, String reason) {
        boolean removed;
        synchronized (lock) {
            removed = connections.remove(connection.getId(), connection);
            if (removed) {
                attachments.remove(connection.getId());
            }
        }
        if (removed) {
            log.warn("Pruned connection {}: {}", connection.getId(), reason);
            connection.close(reason);
        }
    }
}
