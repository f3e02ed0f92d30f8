package com.tooling.feedbackrelay.websocket.handler;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.exception.FeedbackRelayException;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.protocol.ClientMessage;
import com.tooling.feedbackrelay.protocol.ConnectionEstablishedMessage;
import com.tooling.feedbackrelay.protocol.ErrorMessage;
import com.tooling.feedbackrelay.protocol.GetStatusMessage;
import com.tooling.feedbackrelay.protocol.HeartbeatMessage;
import com.tooling.feedbackrelay.protocol.HeartbeatResponseMessage;
import com.tooling.feedbackrelay.protocol.LanguageSwitchMessage;
import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import com.tooling.feedbackrelay.protocol.SessionUpdatedMessage;
import com.tooling.feedbackrelay.protocol.StatusUpdateMessage;
import com.tooling.feedbackrelay.protocol.SubmitFeedbackMessage;
import com.tooling.feedbackrelay.service.FeedbackRelayService;
import com.tooling.feedbackrelay.websocket.ConnectionRegistry;
import com.tooling.feedbackrelay.websocket.WebSocketRelayConnection;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The hub's socket endpoint. Each tab becomes a {@link WebSocketRelayConnection}
 * in the {@link ConnectionRegistry}; inbound frames are decoded and dispatched
 * through {@link ClientMessage.Visitor}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeedbackWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionRegistry registry;
    private final ProtocolCodec codec;
    private final FeedbackRelayService relayService;
    private final FeedbackRelayProperties properties;
    private final Clock clock;

    private final ExecutorService sendExecutor = Executors.newCachedThreadPool();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketRelayConnection connection = new WebSocketRelayConnection(
                session,
                sendExecutor,
                properties.getHub(),
                clock.instant(),
                registry::markDead);
        Optional<String> attachedTo = registry.register(connection);
        log.info("WebSocket connection established: {} (session {})", session.getId(), attachedTo.orElse("none"));

        registry.send(session.getId(), new ConnectionEstablishedMessage(attachedTo.orElse(null), clock.instant().toString()));
        relayService.currentSession()
                .filter(current -> attachedTo.isPresent() && current.getId().equals(attachedTo.get()))
                .ifPresent(current -> registry.send(session.getId(), current.getStatus().isAwaitingFeedback()
                        ? sessionUpdated(current)
                        : statusOf(current)));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String payload = message.getPayload();
        log.debug("Received message from {}: {}", session.getId(), payload);
        registry.touch(session.getId());

        try {
            Optional<ClientMessage> decoded = codec.decodeClientMessage(payload);
            decoded.ifPresent(clientMessage -> clientMessage.accept(new Dispatcher(session.getId())));
        } catch (FeedbackRelayException e) {
            log.warn("Rejected {} message from {}: {}", e.getErrorCode().getWireName(), session.getId(), e.getMessage());
            registry.send(session.getId(), toErrorMessage(e));
        } catch (Exception e) {
            log.error("Failed to handle message from {}: {}", session.getId(), e.getMessage(), e);
            registry.send(session.getId(), new ErrorMessage(ErrorCode.INVALID_MESSAGE.getWireName(),
                    "Could not process message: " + e.getMessage(), null));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("WebSocket transport error for connection {}: {}", session.getId(), exception.getMessage());
        registry.unregister(session.getId());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        log.info("WebSocket connection closed: {} - Status: {}", session.getId(), status);
        registry.unregister(session.getId());
    }

    private class Dispatcher implements ClientMessage.Visitor<Void> {

        private final String connectionId;

        Dispatcher(String connectionId) {
            this.connectionId = connectionId;
        }

        @Override
        public Void visitSubmitFeedback(SubmitFeedbackMessage message) {
            String sessionId = StringUtils.isNotBlank(message.getSessionId())
                    ? message.getSessionId()
                    : registry.attachedSessionId(connectionId).orElse(null);
            if (sessionId == null) {
                registry.send(connectionId, new ErrorMessage(ErrorCode.NO_ACTIVE_SESSION.getWireName(),
                        FeedbackRelayException.REQUEST_NO_LONGER_ACTIVE, null));
                return null;
            }
            relayService.submitFeedback(sessionId, message.getFeedback(), message.getImages(), message.getSettings());
            return null;
        }

        @Override
        public Void visitHeartbeat(HeartbeatMessage message) {
            Long timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.millis();
            registry.send(connectionId, new HeartbeatResponseMessage(timestamp));
            return null;
        }

        @Override
        public Void visitLanguageSwitch(LanguageSwitchMessage message) {
            relayService.switchLanguage(message.getLanguage());
            return null;
        }

        @Override
        public Void visitGetStatus(GetStatusMessage message) {
            StatusUpdateMessage status = relayService.currentSession()
                    .map(FeedbackWebSocketHandler::statusOf)
                    .orElseGet(() -> new StatusUpdateMessage("no_session", "No active feedback request", null));
            registry.send(connectionId, status);
            return null;
        }
    }

    private static StatusUpdateMessage statusOf(SessionSnapshot session) {
        return new StatusUpdateMessage(session.getStatus().getWireValue(), describe(session), null,
                session.getId(), session.getErrorReason());
    }

    private static String describe(SessionSnapshot session) {
        switch (session.getStatus()) {
            case WAITING:
                return "Waiting for feedback";
            case PROCESSING:
                return "Processing feedback";
            case SUBMITTED:
                return "Feedback submitted";
            case COMPLETED:
                return "Feedback request completed";
            case ERROR:
            default:
                return "Feedback request ended: " + StringUtils.defaultString(session.getErrorReason(), "error");
        }
    }

    private static SessionUpdatedMessage sessionUpdated(SessionSnapshot session) {
        return new SessionUpdatedMessage(session.getId(), session.getSummary(), session.getProjectDirectory(),
                session.getCreatedAt().toString());
    }

    private static ErrorMessage toErrorMessage(FeedbackRelayException e) {
        switch (e.getErrorCode()) {
            case STALE_SESSION:
            case ALREADY_SUBMITTED:
            case SUPERSEDED:
                return new ErrorMessage(e.getErrorCode().getWireName(), FeedbackRelayException.REQUEST_NO_LONGER_ACTIVE,
                        e.getSessionId() == null ? null : Map.of("session_id", e.getSessionId()));
            case VALIDATION_ERROR:
                return new ErrorMessage(e.getErrorCode().getWireName(), e.getMessage(),
                        Map.of("violations", ((FeedbackValidationException) e).getViolations()));
            default:
                return new ErrorMessage(e.getErrorCode().getWireName(), e.getMessage(), null);
        }
    }

    @PreDestroy
    public void shutdownExecutor() {
        log.info("Shutting down WebSocket send executor...");
        sendExecutor.shutdown();
        try {
            if (!sendExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Send executor did not terminate in time, forcing shutdown...");
                sendExecutor.shutdownNow();
            }
            log.info("WebSocket send executor shut down gracefully.");
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for send executor shutdown, forcing now.");
            sendExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
