package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.dto.session.CurrentSessionResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.exception.FeedbackRelayException;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import com.tooling.feedbackrelay.protocol.ConnectionEstablishedMessage;
import com.tooling.feedbackrelay.protocol.ErrorMessage;
import com.tooling.feedbackrelay.protocol.FeedbackReceivedMessage;
import com.tooling.feedbackrelay.protocol.HeartbeatResponseMessage;
import com.tooling.feedbackrelay.protocol.ServerMessage;
import com.tooling.feedbackrelay.protocol.SessionUpdatedMessage;
import com.tooling.feedbackrelay.protocol.StatusUpdateMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Client side of the relay for one feedback form.
 * <p>
 * Transports, timers and the form all talk to the reconciler by posting
 * {@link TransportEvent}s; a single thread consumes them, so connection state
 * and the displayed session are never touched concurrently. A session whose id
 * differs from the displayed one replaces it in place; a repeated id is a no-op.
 */
@Slf4j
public class ClientReconciler implements TransportEvent.Visitor<Void> {

    private final FeedbackForm form;
    private final TransportFactory transports;
    private final ScheduledExecutorService scheduler;
    private final BackoffPolicy backoff;
    private final Duration heartbeatInterval;
    private final DraftPolicy draftPolicy;

    private final BlockingQueue<TransportEvent> inbox = new LinkedBlockingQueue<>();
    private volatile boolean running;
    private Thread loop;

    // written by the loop thread only
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private SessionChangeNotifier transport;
    private int failedAttempts;
    private volatile ClientSessionView session;
    private ScheduledFuture<?> heartbeat;
    private ScheduledFuture<?> reconnect;

    public ClientReconciler(FeedbackForm form,
                            TransportFactory transports,
                            ScheduledExecutorService scheduler,
                            FeedbackRelayProperties.Client config) {
        this.form = form;
        this.transports = transports;
        this.scheduler = scheduler;
        this.backoff = new BackoffPolicy(
                Duration.ofMillis(config.getReconnectBaseDelayMillis()),
                Duration.ofMillis(config.getReconnectMaxDelayMillis()),
                config.getMaxReconnectAttempts());
        this.heartbeatInterval = Duration.ofMillis(config.getHeartbeatIntervalMillis());
        this.draftPolicy = config.getDraftPolicy();
    }

    /**
     * Starts the event loop thread and the first socket connect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loop = new Thread(this::runLoop, "feedback-reconciler");
        loop.setDaemon(true);
        loop.start();
        post(new TransportEvent.ReconnectDue(0));
    }

    public void stop() {
        post(new TransportEvent.Stop());
    }

    public void submit(String feedbackText, List<ImageAttachment> images, Map<String, Object> settings) {
        post(new TransportEvent.SubmitRequested(feedbackText, images, settings));
    }

    public void post(TransportEvent event) {
        inbox.offer(event);
    }

    public ConnectionState getState() {
        return state;
    }

    public Optional<ClientSessionView> getSession() {
        return Optional.ofNullable(session);
    }

    private void runLoop() {
        while (running) {
            try {
                process(inbox.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            } catch (RuntimeException e) {
                log.error("Reconciler failed to handle event", e);
            }
        }
        log.info("Reconciler stopped");
    }

    /** Handles one event on the calling thread. */
    void process(TransportEvent event) {
        event.accept(this);
    }

    @Override
    public Void visitConnected(TransportEvent.Connected event) {
        if (event.getTransport() != transport) {
            return null;
        }
        failedAttempts = 0;
        moveTo(ConnectionState.CONNECTED);
        cancel(heartbeat);
        heartbeat = scheduler.scheduleAtFixedRate(() -> post(new TransportEvent.HeartbeatTick()),
                heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
        return null;
    }

    @Override
    public Void visitDisconnected(TransportEvent.Disconnected event) {
        // a transport can report the same loss twice (send failure, then close)
        if (event.getTransport() != transport
                || state == ConnectionState.POLLING
                || state == ConnectionState.DISCONNECTED) {
            return null;
        }
        cancel(heartbeat);
        heartbeat = null;
        failedAttempts++;
        Optional<Duration> delay = backoff.delayFor(failedAttempts);
        if (delay.isPresent()) {
            log.info("Disconnected ({}), reconnect attempt {} in {} ms",
                    event.getReason(), failedAttempts, delay.get().toMillis());
            moveTo(ConnectionState.DISCONNECTED);
            int attempt = failedAttempts;
            reconnect = scheduler.schedule(() -> post(new TransportEvent.ReconnectDue(attempt)),
                    delay.get().toMillis(), TimeUnit.MILLISECONDS);
        } else {
            log.warn("Gave up on WebSocket after {} attempts, falling back to polling", backoff.getMaxAttempts());
            transport.stop();
            transport = transports.poll();
            moveTo(ConnectionState.POLLING);
            transport.start(this::post);
        }
        return null;
    }

    @Override
    public Void visitReconnectDue(TransportEvent.ReconnectDue event) {
        if (state != ConnectionState.DISCONNECTED) {
            return null;
        }
        if (transport != null) {
            transport.stop();
        }
        transport = transports.push();
        moveTo(ConnectionState.CONNECTING);
        transport.start(this::post);
        return null;
    }

    @Override
    public Void visitHeartbeatTick(TransportEvent.HeartbeatTick event) {
        if (state == ConnectionState.CONNECTED) {
            transport.sendHeartbeat();
        }
        return null;
    }

    @Override
    public Void visitMessageReceived(TransportEvent.MessageReceived event) {
        event.getMessage().accept(new ServerMessageHandler());
        return null;
    }

    @Override
    public Void visitPollResult(TransportEvent.PollResult event) {
        event.getSession().ifPresent(polled -> {
            ClientSessionView view = toView(polled);
            if (!apply(view) && session != null && !Objects.equals(session.getStatus(), view.getStatus())) {
                session = view;
                form.showStatus(view.getStatus(), "Session " + view.getStatus());
            }
        });
        return null;
    }

    @Override
    public Void visitPollFailed(TransportEvent.PollFailed event) {
        log.debug("Poll failed: {}", event.getReason());
        return null;
    }

    @Override
    public Void visitSubmitRequested(TransportEvent.SubmitRequested event) {
        if (session == null || transport == null) {
            form.showError(ErrorCode.NO_ACTIVE_SESSION.getWireName(), FeedbackRelayException.REQUEST_NO_LONGER_ACTIVE);
            return null;
        }
        transport.submit(session.getSessionId(), event.getFeedbackText(), event.getImages(), event.getSettings());
        return null;
    }

    @Override
    public Void visitStop(TransportEvent.Stop event) {
        running = false;
        cancel(heartbeat);
        cancel(reconnect);
        if (transport != null) {
            transport.stop();
        }
        moveTo(ConnectionState.DISCONNECTED);
        return null;
    }

    /**
     * @return true if the view replaced the displayed session
     */
    private boolean apply(ClientSessionView view) {
        if (session != null && session.getSessionId().equals(view.getSessionId())) {
            return false;
        }
        log.info("Session changed from {} to {}", session == null ? "none" : session.getSessionId(), view.getSessionId());
        session = view;
        form.showSession(view);
        if (awaitsFeedback(view.getStatus())) {
            form.resetToWaiting();
        } else {
            // finished before this tab saw it; the form stays read-only
            form.showStatus(view.getStatus(), "Session " + view.getStatus());
        }
        if (draftPolicy == DraftPolicy.DISCARD) {
            form.clearDraft();
        }
        return true;
    }

    private static boolean awaitsFeedback(String status) {
        return SessionStatus.WAITING.getWireValue().equals(status)
                || SessionStatus.PROCESSING.getWireValue().equals(status);
    }

    private void moveTo(ConnectionState next) {
        if (state != next) {
            log.debug("Connection state {} -> {}", state, next);
            state = next;
            form.showConnectionState(next);
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static ClientSessionView toView(CurrentSessionResponse polled) {
        return new ClientSessionView(polled.getSessionId(), polled.getSummary(), polled.getProjectDirectory(),
                polled.getStatus());
    }

    private class ServerMessageHandler implements ServerMessage.Visitor<Void> {

        @Override
        public Void visitConnectionEstablished(ConnectionEstablishedMessage message) {
            log.debug("Hub acknowledged connection (session {})", message.getSessionId());
            return null;
        }

        @Override
        public Void visitSessionUpdated(SessionUpdatedMessage message) {
            apply(new ClientSessionView(message.getSessionId(), message.getSummary(),
                    message.getProjectDirectory(), SessionStatus.WAITING.getWireValue()));
            return null;
        }

        @Override
        public Void visitFeedbackReceived(FeedbackReceivedMessage message) {
            if (isDisplayed(message.getSessionId())) {
                form.showStatus(SessionStatus.SUBMITTED.getWireValue(), message.getMessage());
            }
            return null;
        }

        @Override
        public Void visitStatusUpdate(StatusUpdateMessage message) {
            if (message.getSessionId() == null || isDisplayed(message.getSessionId())) {
                form.showStatus(message.getStatus(), message.getMessage());
            }
            return null;
        }

        @Override
        public Void visitError(ErrorMessage message) {
            form.showError(message.getErrorCode(), message.getMessage());
            return null;
        }

        @Override
        public Void visitHeartbeatResponse(HeartbeatResponseMessage message) {
            return null;
        }

        private boolean isDisplayed(String sessionId) {
            return session != null && session.getSessionId().equals(sessionId);
        }
    }
}
