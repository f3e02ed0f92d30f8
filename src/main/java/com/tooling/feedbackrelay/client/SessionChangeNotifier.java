package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.model.session.ImageAttachment;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One way of learning about session changes and sending feedback back. Push
 * and poll implementations are interchangeable; both report through the sink
 * given to {@link #start}.
 */
public interface SessionChangeNotifier {

    void start(Consumer<TransportEvent> sink);

    void stop();

    void submit(String sessionId, String feedbackText, List<ImageAttachment> images, Map<String, Object> settings);

    /** No-op for transports without a liveness contract. */
    void sendHeartbeat();
}
