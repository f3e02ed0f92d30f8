package com.tooling.feedbackrelay.websocket.config;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.websocket.handler.FeedbackWebSocketHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws";

    @Autowired
    private FeedbackWebSocketHandler feedbackWebSocketHandler;

    @Autowired
    private FeedbackRelayProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(feedbackWebSocketHandler, ENDPOINT)
                .setAllowedOriginPatterns(properties.getHub().getAllowedOrigins().toArray(new String[0]));
    }
}
