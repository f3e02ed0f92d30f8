package com.tooling.feedbackrelay.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketSessionNotifierTest {

    private static final String URL = "ws://127.0.0.1:8765/ws";

    @Mock
    private WebSocketClient webSocketClient;
    @Mock
    private WebSocketSession socket;

    private final List<TransportEvent> events = new ArrayList<>();
    private WebSocketSessionNotifier notifier;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(webSocketClient.execute(any(WebSocketHandler.class), anyString())).thenReturn(new CompletableFuture<>());
        when(socket.getId()).thenReturn("socket-1");
        when(socket.isOpen()).thenReturn(true);
        notifier = new WebSocketSessionNotifier(webSocketClient, URL,
                new ProtocolCodec(new ObjectMapper(), Clock.systemUTC()), Clock.systemUTC());
    }

    @Test
    void handshakeFinishingAfterStop_closesSocket_andStaysSilent() throws Exception {
        WebSocketHandler handler = start();

        notifier.stop();
        handler.afterConnectionEstablished(socket);

        verify(socket).close(CloseStatus.NORMAL);
        assertTrue(events.isEmpty());
    }

    @Test
    void handshake_reportsConnected_andStopClosesSocket() throws Exception {
        WebSocketHandler handler = start();

        handler.afterConnectionEstablished(socket);
        notifier.stop();

        assertEquals(1, events.size());
        assertInstanceOf(TransportEvent.Connected.class, events.get(0));
        verify(socket).close(CloseStatus.NORMAL);
    }

    private WebSocketHandler start() {
        notifier.start(events::add);
        ArgumentCaptor<WebSocketHandler> handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        verify(webSocketClient).execute(handler.capture(), eq(URL));
        return handler.getValue();
    }
}
