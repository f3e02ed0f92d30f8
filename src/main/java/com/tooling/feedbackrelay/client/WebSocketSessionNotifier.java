package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.exception.InvalidMessageException;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.protocol.HeartbeatMessage;
import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import com.tooling.feedbackrelay.protocol.ServerMessage;
import com.tooling.feedbackrelay.protocol.SubmitFeedbackMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Push transport over the hub's WebSocket endpoint.
 */
@Slf4j
public class WebSocketSessionNotifier implements SessionChangeNotifier {

    private final WebSocketClient webSocketClient;
    private final String url;
    private final ProtocolCodec codec;
    private final Clock clock;

    private volatile Consumer<TransportEvent> sink;
    private volatile WebSocketSession session;
    private volatile boolean stopped;

    public WebSocketSessionNotifier(WebSocketClient webSocketClient, String url, ProtocolCodec codec, Clock clock) {
        this.webSocketClient = webSocketClient;
        this.url = url;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public void start(Consumer<TransportEvent> sink) {
        this.sink = sink;
        log.info("Connecting to {}", url);
        webSocketClient.execute(new Handler(), url)
                .whenComplete((connected, error) -> {
                    if (error != null) {
                        log.warn("WebSocket connect to {} failed: {}", url, error.getMessage());
                        emit(new TransportEvent.Disconnected(this, "connect failed: " + error.getMessage()));
                    }
                });
    }

    @Override
    public void stop() {
        stopped = true;
        close(session);
    }

    @Override
    public void submit(String sessionId, String feedbackText, List<ImageAttachment> images, Map<String, Object> settings) {
        send(codec.encode(new SubmitFeedbackMessage(sessionId, feedbackText,
                images == null ? new ArrayList<>() : new ArrayList<>(images),
                settings == null ? new HashMap<>() : new HashMap<>(settings))));
    }

    @Override
    public void sendHeartbeat() {
        send(codec.encode(new HeartbeatMessage(clock.millis())));
    }

    private synchronized void send(String payload) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.warn("Dropping outbound message, WebSocket is not open");
            return;
        }
        try {
            current.sendMessage(new TextMessage(payload));
        } catch (IOException e) {
            log.warn("Failed to send over WebSocket: {}", e.getMessage());
            emit(new TransportEvent.Disconnected(this, "send failed: " + e.getMessage()));
        }
    }

    private static void close(WebSocketSession target) {
        if (target != null && target.isOpen()) {
            try {
                target.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Failed to close WebSocket: {}", e.getMessage());
            }
        }
    }

    private void emit(TransportEvent event) {
        Consumer<TransportEvent> target = sink;
        if (target != null && !stopped) {
            target.accept(event);
        }
    }

    private class Handler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession established) {
            session = established;
            // stop() may have run while the handshake was in flight
            if (stopped) {
                log.info("WebSocket {} connected after stop, closing it", established.getId());
                close(established);
                return;
            }
            log.info("WebSocket connected: {}", established.getId());
            emit(new TransportEvent.Connected(WebSocketSessionNotifier.this));
        }

        @Override
        protected void handleTextMessage(WebSocketSession ignored, TextMessage message) {
            try {
                Optional<ServerMessage> decoded = codec.decodeServerMessage(message.getPayload());
                decoded.ifPresent(serverMessage -> emit(new TransportEvent.MessageReceived(serverMessage)));
            } catch (InvalidMessageException e) {
                log.warn("Ignoring unreadable server message: {}", e.getMessage());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession failed, Throwable exception) {
            log.warn("WebSocket transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
            log.info("WebSocket closed: {}", status);
            emit(new TransportEvent.Disconnected(WebSocketSessionNotifier.this, "closed: " + status));
        }
    }
}
