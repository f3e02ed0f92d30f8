package com.tooling.feedbackrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooling.feedbackrelay.MutableClock;
import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.AlreadySubmittedException;
import com.tooling.feedbackrelay.exception.FeedbackTimeoutException;
import com.tooling.feedbackrelay.exception.SessionSupersededException;
import com.tooling.feedbackrelay.exception.StaleSessionException;
import com.tooling.feedbackrelay.integration.InMemorySettingsStore;
import com.tooling.feedbackrelay.integration.SessionResourceReleaser;
import com.tooling.feedbackrelay.model.history.HistoryEntry;
import com.tooling.feedbackrelay.model.session.FeedbackResult;
import com.tooling.feedbackrelay.model.session.FeedbackSubmission;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import com.tooling.feedbackrelay.protocol.ProtocolCodec;
import com.tooling.feedbackrelay.websocket.ConnectionRegistry;
import com.tooling.feedbackrelay.websocket.RecordingConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SessionStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ScheduledExecutorService timerScheduler;
    @Mock
    private SessionResourceReleaser resourceReleaser;

    private final List<Runnable> scheduledTimers = new ArrayList<>();
    private MutableClock clock;
    private ConnectionRegistry registry;
    private SessionHistoryService history;
    private SessionStore store;
    private ExecutorService agentThreads;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        doAnswer(invocation -> {
            scheduledTimers.add(invocation.getArgument(0));
            return mock(ScheduledFuture.class);
        }).when(timerScheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        clock = new MutableClock(START);
        FeedbackRelayProperties properties = new FeedbackRelayProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        registry = new ConnectionRegistry(new ProtocolCodec(objectMapper, clock), clock, properties);
        history = new SessionHistoryService(new InMemorySettingsStore(), objectMapper, clock, properties);
        store = new SessionStore(registry, new TimeoutSupervisor(timerScheduler), history, resourceReleaser, clock);
        agentThreads = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        agentThreads.shutdownNow();
    }

    @Test
    void createOrReplace_alwaysExposesLatestSession_withFreshId() {
        Set<String> ids = new HashSet<>();
        String last = null;
        for (int i = 0; i < 5; i++) {
            last = store.createOrReplace("summary " + i, "/work", 600);
            ids.add(last);
            assertEquals(last, store.getCurrent().orElseThrow().getId());
        }

        assertEquals(5, ids.size());
        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals("summary 4", current.getSummary());
        assertEquals(SessionStatus.WAITING, current.getStatus());
        assertEquals(4, history.entries().size());
        assertTrue(history.entries().stream().allMatch(entry -> entry.getStatus() == SessionStatus.COMPLETED));
    }

    @Test
    void createOrReplace_sendsExactlyOneSessionUpdatedPerReplacement() {
        RecordingConnection early = new RecordingConnection("early", START);
        registry.register(early);

        String first = store.createOrReplace("first", "/work", 600);
        RecordingConnection late = new RecordingConnection("late", START);
        registry.register(late);
        String second = store.createOrReplace("second", "/work", 600);
        String third = store.createOrReplace("third", "/work", 600);

        List<JsonNode> earlyUpdates = early.framesOfType("session_updated");
        assertEquals(3, earlyUpdates.size());
        assertEquals(first, earlyUpdates.get(0).path("data").path("session_id").asText());
        assertEquals(second, earlyUpdates.get(1).path("data").path("session_id").asText());
        assertEquals(third, earlyUpdates.get(2).path("data").path("session_id").asText());
        assertEquals(2, late.framesOfType("session_updated").size());
        assertTrue(early.isOpen());
        assertTrue(late.isOpen());
    }

    @Test
    void createOrReplace_migratesConnections_andSupersedesPendingWait() throws Exception {
        String first = store.createOrReplace("first", "/work", 600);
        registry.register(new RecordingConnection("tab-1", START));
        registry.register(new RecordingConnection("tab-2", START));
        Future<FeedbackResult> pending = agentThreads.submit(() -> store.waitForSubmission(first, Duration.ofSeconds(30)));

        String second = store.createOrReplace("second", "/work", 600);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        SessionSupersededException superseded = assertInstanceOf(SessionSupersededException.class, failure.getCause());
        assertEquals(first, superseded.getSessionId());
        assertEquals(SessionStore.REASON_REPLACED, superseded.getReason());

        assertEquals(2, registry.attachedCount(second));
        assertEquals(0, registry.attachedCount(first));
        assertEquals(1, history.entries().size());
        HistoryEntry recorded = history.entries().get(0);
        assertEquals(first, recorded.getSessionId());
        assertEquals(SessionStatus.COMPLETED, recorded.getStatus());
        verify(resourceReleaser).release(any(SessionSnapshot.class));
    }

    @Test
    void submitFeedback_wakesWaiter_withSubmittedText() throws Exception {
        String sessionId = store.createOrReplace("done", "/work", 600);
        Future<FeedbackResult> pending = agentThreads.submit(() -> store.waitForSubmission(sessionId, Duration.ofSeconds(30)));

        store.submitFeedback(sessionId, new FeedbackSubmission("lgtm", List.of(), Map.of()));

        FeedbackResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(sessionId, result.getSessionId());
        assertEquals("lgtm", result.getFeedbackText());
        assertTrue(result.getImages().isEmpty());
        assertEquals(SessionStatus.SUBMITTED, store.getCurrent().orElseThrow().getStatus());

        assertTrue(store.complete(sessionId));
        assertEquals(1, history.entries().size());
        HistoryEntry recorded = history.entries().get(0);
        assertEquals(SessionStatus.COMPLETED, recorded.getStatus());
        assertEquals("lgtm", recorded.getUserMessages().get(0).getContent());
    }

    @Test
    void submitFeedback_broadcastsProcessingBeforeFeedbackReceived() {
        RecordingConnection tab = new RecordingConnection("tab", START);
        registry.register(tab);
        String sessionId = store.createOrReplace("order", "/work", 600);

        store.submitFeedback(sessionId, new FeedbackSubmission("ok", List.of(), Map.of()));

        assertEquals(List.of("session_updated", "status_update", "feedback_received"), tab.types());
        assertEquals("processing", tab.framesOfType("status_update").get(0).path("data").path("status").asText());
    }

    @Test
    void submitFeedback_rejectsSecondSubmission_andKeepsFirstText() {
        String sessionId = store.createOrReplace("twice", "/work", 600);
        store.submitFeedback(sessionId, new FeedbackSubmission("first answer", List.of(), Map.of()));

        AlreadySubmittedException rejected = assertThrows(AlreadySubmittedException.class,
                () -> store.submitFeedback(sessionId, new FeedbackSubmission("second answer", List.of(), Map.of())));

        assertEquals(SessionStatus.SUBMITTED, rejected.getStatus());
        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals("first answer", current.getFeedbackText());
        assertTrue(current.getImages().isEmpty());
    }

    @Test
    void submitFeedback_rejectsReplacedSessionId() {
        String first = store.createOrReplace("first", "/work", 600);
        String second = store.createOrReplace("second", "/work", 600);

        assertThrows(StaleSessionException.class,
                () -> store.submitFeedback(first, new FeedbackSubmission("late", List.of(), Map.of())));

        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals(second, current.getId());
        assertEquals(SessionStatus.WAITING, current.getStatus());
    }

    @Test
    void timerFiringAfterSubmission_isNoOp() {
        RecordingConnection tab = new RecordingConnection("tab", START);
        registry.register(tab);
        String sessionId = store.createOrReplace("race", "/work", 600);
        store.submitFeedback(sessionId, new FeedbackSubmission("in time", List.of(), Map.of()));

        scheduledTimers.get(0).run();

        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals(SessionStatus.SUBMITTED, current.getStatus());
        assertNull(current.getErrorReason());
        assertTrue(history.entries().isEmpty());
        assertFalse(tab.framesOfType("status_update").stream()
                .anyMatch(frame -> "timeout".equals(frame.path("data").path("reason").asText())));
        verify(resourceReleaser, never()).release(any());
    }

    @Test
    void timerOfReplacedSession_doesNotTouchNewSession() {
        store.createOrReplace("first", "/work", 600);
        String second = store.createOrReplace("second", "/work", 600);

        scheduledTimers.get(0).run();

        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals(second, current.getId());
        assertEquals(SessionStatus.WAITING, current.getStatus());
    }

    @Test
    void expiry_failsWaiter_recordsErrorInHistory_andNotifiesTabs() {
        RecordingConnection tab = new RecordingConnection("tab", START);
        registry.register(tab);
        String sessionId = store.createOrReplace("slow human", "/work", 5);
        clock.advance(Duration.ofSeconds(5));

        scheduledTimers.get(0).run();

        FeedbackTimeoutException timeout = assertThrows(FeedbackTimeoutException.class,
                () -> store.waitForSubmission(sessionId, Duration.ofSeconds(1)));
        assertEquals(sessionId, timeout.getSessionId());

        SessionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals(SessionStatus.ERROR, current.getStatus());
        assertEquals(SessionStore.REASON_TIMEOUT, current.getErrorReason());

        assertEquals(1, history.entries().size());
        HistoryEntry recorded = history.entries().get(0);
        assertEquals(SessionStatus.ERROR, recorded.getStatus());
        assertEquals(5000, recorded.getDuration());

        JsonNode statusUpdate = tab.framesOfType("status_update").get(0).path("data");
        assertEquals("error", statusUpdate.path("status").asText());
        assertEquals("timeout", statusUpdate.path("reason").asText());
        verify(resourceReleaser).release(any(SessionSnapshot.class));

        assertThrows(AlreadySubmittedException.class,
                () -> store.submitFeedback(sessionId, new FeedbackSubmission("too late", List.of(), Map.of())));
    }

    @Test
    void expiry_withRealTimer_unblocksWaiterWithTimeout() {
        SessionStore realTimers = new SessionStore(registry, new TimeoutSupervisor(), history, resourceReleaser, clock);
        String sessionId = realTimers.createOrReplace("real timer", "/work", 1);

        assertThrows(FeedbackTimeoutException.class,
                () -> realTimers.waitForSubmission(sessionId, Duration.ofSeconds(10)));
        assertEquals(1, history.entries().size());
        assertEquals(SessionStatus.ERROR, history.entries().get(0).getStatus());
    }

    @Test
    void cancel_failsWaiterAsSuperseded_withCancelledReason() throws Exception {
        String sessionId = store.createOrReplace("cancel me", "/work", 600);
        Future<FeedbackResult> pending = agentThreads.submit(() -> store.waitForSubmission(sessionId, Duration.ofSeconds(30)));

        assertTrue(store.cancel(sessionId));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        SessionSupersededException superseded = assertInstanceOf(SessionSupersededException.class, failure.getCause());
        assertEquals(SessionStore.REASON_CANCELLED, superseded.getReason());
        assertEquals(SessionStatus.ERROR, store.getCurrent().orElseThrow().getStatus());
        assertEquals(SessionStore.REASON_CANCELLED, history.entries().get(0).getErrorReason());
        assertFalse(store.cancel(sessionId));
    }

    @Test
    void waitForSubmission_unknownSession_isStale() {
        store.createOrReplace("only", "/work", 600);

        assertThrows(StaleSessionException.class,
                () -> store.waitForSubmission("no-such-session", Duration.ofSeconds(1)));
    }

    @Test
    void waitForSubmission_givesUpAfterItsOwnTimeout_leavingSessionWaiting() {
        String sessionId = store.createOrReplace("patient", "/work", 600);

        assertThrows(FeedbackTimeoutException.class,
                () -> store.waitForSubmission(sessionId, Duration.ofMillis(50)));
        assertEquals(SessionStatus.WAITING, store.getCurrent().orElseThrow().getStatus());
    }

    @Test
    void replacingSubmittedSession_stillDeliversResult_andRecordsItOnce() throws Exception {
        String first = store.createOrReplace("first", "/work", 600);
        store.submitFeedback(first, new FeedbackSubmission("answer", List.of(), Map.of()));

        String second = store.createOrReplace("second", "/work", 600);

        assertEquals("answer", store.waitForSubmission(first, Duration.ofSeconds(1)).getFeedbackText());
        assertFalse(store.complete(first));
        assertNotEquals(first, second);
        assertEquals(1, history.entries().size());
        assertEquals(SessionStatus.COMPLETED, history.entries().get(0).getStatus());
    }

    @Test
    void submissionRacingReplacement_alwaysHasOneWinner_andRecordsOldSessionOnce() throws Exception {
        FeedbackRelayProperties properties = new FeedbackRelayProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        int submissionWins = 0;
        int replacementWins = 0;

        for (int round = 0; round < 50; round++) {
            ConnectionRegistry raceRegistry = new ConnectionRegistry(new ProtocolCodec(objectMapper, clock), clock, properties);
            SessionHistoryService raceHistory = new SessionHistoryService(new InMemorySettingsStore(), objectMapper, clock, properties);
            SessionStore raceStore = new SessionStore(raceRegistry, new TimeoutSupervisor(timerScheduler),
                    raceHistory, resourceReleaser, clock);
            String first = raceStore.createOrReplace("first", "/work", 600);
            String answer = "answer " + round;
            Future<FeedbackResult> waiter = agentThreads.submit(() -> raceStore.waitForSubmission(first, Duration.ofSeconds(10)));

            CountDownLatch go = new CountDownLatch(1);
            Future<Boolean> submitter = agentThreads.submit(() -> {
                go.await();
                try {
                    raceStore.submitFeedback(first, new FeedbackSubmission(answer, List.of(), Map.of()));
                    return true;
                } catch (StaleSessionException e) {
                    return false;
                }
            });
            Future<String> replacer = agentThreads.submit(() -> {
                go.await();
                return raceStore.createOrReplace("second", "/work", 600);
            });
            go.countDown();

            boolean submitted = submitter.get(5, TimeUnit.SECONDS);
            String second = replacer.get(5, TimeUnit.SECONDS);

            SessionSnapshot current = raceStore.getCurrent().orElseThrow();
            assertEquals(second, current.getId());
            assertEquals(SessionStatus.WAITING, current.getStatus());

            List<HistoryEntry> recorded = raceHistory.entries().stream()
                    .filter(entry -> entry.getSessionId().equals(first))
                    .collect(Collectors.toList());
            assertEquals(1, recorded.size());
            assertEquals(SessionStatus.COMPLETED, recorded.get(0).getStatus());

            if (submitted) {
                submissionWins++;
                assertEquals(answer, waiter.get(5, TimeUnit.SECONDS).getFeedbackText());
                assertEquals(answer, recorded.get(0).getUserMessages().get(0).getContent());
            } else {
                replacementWins++;
                ExecutionException failure = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
                assertInstanceOf(SessionSupersededException.class, failure.getCause());
                assertTrue(recorded.get(0).getUserMessages().isEmpty());
            }
        }

        assertEquals(50, submissionWins + replacementWins);
    }

    @Test
    void shutdown_cancelsPendingSession() {
        store.createOrReplace("pending", "/work", 600);

        store.shutdown();

        assertEquals(SessionStatus.ERROR, store.getCurrent().orElseThrow().getStatus());
    }
}
