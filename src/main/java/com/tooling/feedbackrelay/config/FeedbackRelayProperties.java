package com.tooling.feedbackrelay.config;

import com.tooling.feedbackrelay.client.DraftPolicy;
import com.tooling.feedbackrelay.model.history.PrivacyLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "feedback-relay")
public class FeedbackRelayProperties {

    /** URL a human opens to answer; handed to the surface launcher. */
    private String publicUrl = "http://127.0.0.1:8765";

    private final Session session = new Session();
    private final Hub hub = new Hub();
    private final History history = new History();
    private final Validation validation = new Validation();
    private final Client client = new Client();

    @Data
    public static class Session {
        private int defaultTimeoutSeconds = 600;
        private int minTimeoutSeconds = 30;
        private int maxTimeoutSeconds = 7200;
        // extra time the agent waits so the supervisor's timeout wins the race
        private int waitGraceSeconds = 5;
    }

    @Data
    public static class Hub {
        private int heartbeatIntervalSeconds = 60;
        private long sendTimeLimitMillis = 5000;
        private int sendBufferSizeLimitBytes = 512 * 1024;
        private int maxQueuedMessages = 256;
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class History {
        private int maxEntries = 10;
        private int retentionHours = 72;
        private PrivacyLevel privacyLevel = PrivacyLevel.FULL;
    }

    @Data
    public static class Validation {
        private int maxFeedbackLength = 100_000;
        private long maxImageSizeBytes = 1024 * 1024;
        private int maxImages = 10;
    }

    @Data
    public static class Client {
        private String serverUrl = "http://127.0.0.1:8765";
        private long reconnectBaseDelayMillis = 1000;
        private long reconnectMaxDelayMillis = 30_000;
        private int maxReconnectAttempts = 5;
        private long pollIntervalMillis = 5000;
        private long heartbeatIntervalMillis = 60_000;
        private DraftPolicy draftPolicy = DraftPolicy.DISCARD;
    }
}
