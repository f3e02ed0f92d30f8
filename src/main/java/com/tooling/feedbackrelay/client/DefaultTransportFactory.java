package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds transports against one relay server, e.g. {@code http://127.0.0.1:8765}.
 */
public class DefaultTransportFactory implements TransportFactory {

    private final String serverUrl;
    private final ProtocolCodec codec;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;
    private final WebSocketClient webSocketClient = new StandardWebSocketClient();
    private final WebClient webClient;

    public DefaultTransportFactory(String serverUrl,
                                   ProtocolCodec codec,
                                   Clock clock,
                                   ScheduledExecutorService scheduler,
                                   Duration pollInterval) {
        this.serverUrl = StringUtils.removeEnd(serverUrl, "/");
        this.codec = codec;
        this.clock = clock;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
        this.webClient = WebClient.builder()
                .baseUrl(this.serverUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public SessionChangeNotifier push() {
        return new WebSocketSessionNotifier(webSocketClient, webSocketUrl(serverUrl), codec, clock);
    }

    @Override
    public SessionChangeNotifier poll() {
        return new PollingSessionNotifier(webClient, scheduler, pollInterval);
    }

    static String webSocketUrl(String httpUrl) {
        String base = StringUtils.removeEnd(httpUrl, "/");
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return base + "/ws";
    }
}
