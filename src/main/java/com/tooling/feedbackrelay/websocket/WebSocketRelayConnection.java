package com.tooling.feedbackrelay.websocket;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Socket-backed connection. Frames go through a per-connection queue drained by
 * a single task at a time, so frames keep their order and a stuck peer only
 * holds up its own drain. The drain writes through a
 * {@link ConcurrentWebSocketSessionDecorator}; once a write has been in flight
 * longer than its send time limit the connection reports itself closed and the
 * registry prunes it.
 */
@Slf4j
public class WebSocketRelayConnection implements RelayConnection {

    private final ConcurrentWebSocketSessionDecorator session;
    private final Executor sendExecutor;
    private final int maxQueuedMessages;
    private final Consumer<RelayConnection> onFailure;

    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile Instant lastHeartbeatAt;

    public WebSocketRelayConnection(WebSocketSession session,
                                    Executor sendExecutor,
                                    FeedbackRelayProperties.Hub hub,
                                    Instant connectedAt,
                                    Consumer<RelayConnection> onFailure) {
        this.session = new ConcurrentWebSocketSessionDecorator(session,
                Math.toIntExact(hub.getSendTimeLimitMillis()), hub.getSendBufferSizeLimitBytes());
        this.sendExecutor = sendExecutor;
        this.maxQueuedMessages = hub.getMaxQueuedMessages();
        this.onFailure = onFailure;
        this.lastHeartbeatAt = connectedAt;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen() && !failed.get() && !sendOverdue();
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
    public void send(String payload) {
        if (!isOpen()) {
            throw new IllegalStateException("Connection " + getId() + " is closed");
        }
        if (queued.incrementAndGet() > maxQueuedMessages) {
            queued.decrementAndGet();
            fail(new IllegalStateException("Outbound backlog exceeded " + maxQueuedMessages + " messages"));
            return;
        }
        outbound.add(payload);
        scheduleDrain();
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY.withReason(reason));
        } catch (IOException e) {
            log.warn("Failed to close connection {}: {}", getId(), e.getMessage());
        }
    }

    private boolean sendOverdue() {
        return session.getTimeSinceSendStarted() > session.getSendTimeLimit();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            sendExecutor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            String next;
            while (!failed.get() && (next = outbound.poll()) != null) {
                queued.decrementAndGet();
                session.sendMessage(new TextMessage(next));
            }
        } catch (IOException | RuntimeException e) {
            fail(e);
        } finally {
            draining.set(false);
        }
        if (!failed.get() && !outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    private void fail(Exception cause) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        log.warn("Delivery to connection {} failed: {}", getId(), cause.getMessage());
        outbound.clear();
        queued.set(0);
        onFailure.accept(this);
    }
}
