package com.tooling.feedbackrelay.client;

import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.dto.session.CurrentSessionResponse;
import com.tooling.feedbackrelay.dto.session.FeedbackSubmissionRequest;
import com.tooling.feedbackrelay.dto.session.SubmissionAcceptedResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.protocol.ErrorMessage;
import com.tooling.feedbackrelay.protocol.FeedbackReceivedMessage;
import com.tooling.feedbackrelay.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Poll transport: asks {@code GET /api/current-session} on a fixed delay. The
 * next poll is scheduled only after the previous one settled, so two requests
 * are never in flight together.
 */
@Slf4j
public class PollingSessionNotifier implements SessionChangeNotifier {

    static final String CURRENT_SESSION_PATH = "/api/current-session";
    static final String SUBMIT_PATH = "/api/sessions/{sessionId}/feedback";

    private final WebClient webClient;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private volatile boolean running;
    private volatile Consumer<TransportEvent> sink;
    private volatile ScheduledFuture<?> nextPoll;

    public PollingSessionNotifier(WebClient webClient, ScheduledExecutorService scheduler, Duration interval) {
        this.webClient = webClient;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    @Override
    public void start(Consumer<TransportEvent> sink) {
        this.sink = sink;
        running = true;
        log.info("Polling {} every {} ms", CURRENT_SESSION_PATH, interval.toMillis());
        poll();
    }

    @Override
    public void stop() {
        running = false;
        ScheduledFuture<?> pending = nextPoll;
        if (pending != null) {
            pending.cancel(false);
        }
    }

    void poll() {
        if (!running) {
            return;
        }
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Previous poll still in flight, skipping");
            return;
        }
        webClient.get()
                .uri(CURRENT_SESSION_PATH)
                .exchangeToMono(this::readSession)
                .doFinally(signal -> {
                    inFlight.set(false);
                    scheduleNext();
                })
                .subscribe(
                        session -> emit(new TransportEvent.PollResult(session)),
                        error -> {
                            log.debug("Poll failed: {}", error.getMessage());
                            emit(new TransportEvent.PollFailed(String.valueOf(error.getMessage())));
                        });
    }

    boolean isPollInFlight() {
        return inFlight.get();
    }

    @Override
    public void submit(String sessionId, String feedbackText, List<ImageAttachment> images, Map<String, Object> settings) {
        FeedbackSubmissionRequest request = new FeedbackSubmissionRequest(feedbackText,
                images == null ? new ArrayList<>() : new ArrayList<>(images),
                settings == null ? new HashMap<>() : new HashMap<>(settings));
        webClient.post()
                .uri(SUBMIT_PATH, sessionId)
                .bodyValue(request)
                .exchangeToMono(this::readSubmissionOutcome)
                .subscribe(
                        message -> emit(new TransportEvent.MessageReceived(message)),
                        error -> {
                            log.warn("Feedback submission for session {} failed: {}", sessionId, error.getMessage());
                            emit(new TransportEvent.MessageReceived(new ErrorMessage(
                                    ErrorCode.CONNECTION_ERROR.getWireName(), "Could not reach the feedback server", null)));
                        });
    }

    @Override
    public void sendHeartbeat() {
        // the server only tracks liveness of socket connections
    }

    private Mono<Optional<CurrentSessionResponse>> readSession(ClientResponse response) {
        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().thenReturn(Optional.<CurrentSessionResponse>empty());
        }
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(CurrentSessionResponse.class).map(Optional::of);
        }
        return response.createException().flatMap(error -> Mono.<Optional<CurrentSessionResponse>>error(error));
    }

    private Mono<ServerMessage> readSubmissionOutcome(ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(SubmissionAcceptedResponse.class)
                    .<ServerMessage>map(accepted -> new FeedbackReceivedMessage(
                            accepted.getSessionId(), accepted.getStatus(), accepted.getMessage()));
        }
        int status = response.statusCode().value();
        return response.bodyToMono(ErrorResponse.class)
                .<ServerMessage>map(error -> new ErrorMessage(error.getErrorCode(), error.getMessage(), null))
                .defaultIfEmpty(new ErrorMessage(ErrorCode.CONNECTION_ERROR.getWireName(), "HTTP " + status, null));
    }

    private void scheduleNext() {
        if (running) {
            nextPoll = scheduler.schedule(this::poll, interval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void emit(TransportEvent event) {
        Consumer<TransportEvent> target = sink;
        if (target != null && running) {
            target.accept(event);
        }
    }
}
