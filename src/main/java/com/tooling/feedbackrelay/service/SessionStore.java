package com.tooling.feedbackrelay.service;

import com.tooling.feedbackrelay.exception.AlreadySubmittedException;
import com.tooling.feedbackrelay.exception.FeedbackTimeoutException;
import com.tooling.feedbackrelay.exception.SessionSupersededException;
import com.tooling.feedbackrelay.exception.StaleSessionException;
import com.tooling.feedbackrelay.integration.SessionResourceReleaser;
import com.tooling.feedbackrelay.model.session.FeedbackResult;
import com.tooling.feedbackrelay.model.session.FeedbackSession;
import com.tooling.feedbackrelay.model.session.FeedbackSubmission;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import com.tooling.feedbackrelay.protocol.FeedbackReceivedMessage;
import com.tooling.feedbackrelay.protocol.SessionUpdatedMessage;
import com.tooling.feedbackrelay.protocol.StatusUpdateMessage;
import com.tooling.feedbackrelay.service.TimeoutSupervisor.TimerTicket;
import com.tooling.feedbackrelay.utils.RelayUtils;
import com.tooling.feedbackrelay.websocket.ConnectionRegistry;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the single current session.
 * <p>
 * Every mutation (replacement, submission, expiry, cancel) runs under one lock,
 * so a submission racing a replacement either lands on the old session before
 * it is closed or fails as stale against the new one. Broadcasts are issued
 * while the lock is held to keep their order identical to the order of state
 * changes; {@link ConnectionRegistry#broadcast} only enqueues, so this never
 * waits on a peer.
 * <p>
 * Agent threads blocked in {@link #waitForSubmission} park on a condition and
 * re-check the outcome recorded for their own session id after every wakeup.
 */
@Service
@Slf4j
public class SessionStore {

    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_REPLACED = "replaced";

    private static final int REMEMBERED_OUTCOMES = 32;

    enum OutcomeKind {
        SUBMITTED,
        SUPERSEDED,
        CANCELLED,
        TIMED_OUT
    }

    /**
     * How a session's wait ended. Waiters only act on the signal keyed by their own id.
     */
    @Value
    static class WakeSignal {
        String sessionId;
        OutcomeKind kind;
        FeedbackResult result;
        String reason;
        int timeoutSeconds;
    }

    private final ConnectionRegistry registry;
    private final TimeoutSupervisor timeoutSupervisor;
    private final SessionHistoryService history;
    private final SessionResourceReleaser resourceReleaser;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final Map<String, WakeSignal> outcomes = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, WakeSignal> eldest) {
            return size() > REMEMBERED_OUTCOMES;
        }
    };
    private FeedbackSession current;
    private volatile SessionSnapshot currentSnapshot;

    public SessionStore(ConnectionRegistry registry,
                        TimeoutSupervisor timeoutSupervisor,
                        SessionHistoryService history,
                        SessionResourceReleaser resourceReleaser,
                        Clock clock) {
        this.registry = registry;
        this.timeoutSupervisor = timeoutSupervisor;
        this.history = history;
        this.resourceReleaser = resourceReleaser;
        this.clock = clock;
        timeoutSupervisor.setExpiryHandler(this::expire);
    }

    /**
     * Closes the current session, if any, and makes a new one current. All
     * registered connections are moved to the new session and told about it
     * with exactly one {@code session_updated}.
     *
     * @return id of the new session
     */
    public String createOrReplace(String summary, String projectDirectory, int timeoutSeconds) {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, was " + timeoutSeconds);
        }
        SessionSnapshot replaced = null;
        String sessionId;
        lock.lock();
        try {
            Instant now = clock.instant();
            FeedbackSession previous = current;
            String previousId = previous == null ? null : previous.getId();
            if (previous != null) {
                replaced = closeReplaced(previous, now);
            }

            sessionId = UUID.randomUUID().toString();
            FeedbackSession created = new FeedbackSession(sessionId, projectDirectory, summary, timeoutSeconds, now);
            current = created;
            timeoutSupervisor.arm(new TimerTicket(sessionId, created.nextTimerGeneration()), timeoutSeconds);
            int attached = registry.migrate(previousId, sessionId);
            publish();
            registry.broadcast(new SessionUpdatedMessage(sessionId, summary, projectDirectory, now.toString()));
            stateChanged.signalAll();

            if (previousId == null) {
                log.info("Created session {} ({}s timeout, {} connection(s)): {}",
                        sessionId, timeoutSeconds, attached, RelayUtils.preview(summary));
            } else {
                log.info("Replaced session {} with {} ({}s timeout, {} connection(s)): {}",
                        previousId, sessionId, timeoutSeconds, attached, RelayUtils.preview(summary));
            }
        } finally {
            lock.unlock();
        }
        if (replaced != null) {
            release(replaced);
        }
        return sessionId;
    }

    public Optional<SessionSnapshot> getCurrent() {
        return Optional.ofNullable(currentSnapshot);
    }

    /**
     * Records the human's answer. The session passes through {@code processing}
     * so tabs can show the two-phase acknowledgement.
     *
     * @throws StaleSessionException     if {@code sessionId} is not the current session
     * @throws AlreadySubmittedException if the current session no longer awaits feedback
     */
    public SessionSnapshot submitFeedback(String sessionId, FeedbackSubmission submission) {
        lock.lock();
        try {
            FeedbackSession session = current;
            if (session == null || !session.getId().equals(sessionId)) {
                log.warn("Rejected feedback for stale session {} (current is {})",
                        sessionId, session == null ? "none" : session.getId());
                throw new StaleSessionException(sessionId);
            }
            if (!session.getStatus().isAwaitingFeedback()) {
                log.warn("Rejected duplicate feedback for session {} in status {}",
                        sessionId, session.getStatus().getWireValue());
                throw new AlreadySubmittedException(sessionId, session.getStatus());
            }

            Instant now = clock.instant();
            session.transitionTo(SessionStatus.PROCESSING, now);
            publish();
            registry.broadcast(new StatusUpdateMessage(SessionStatus.PROCESSING.getWireValue(),
                    "Processing feedback", sessionId));

            session.recordSubmission(submission, now);
            session.transitionTo(SessionStatus.SUBMITTED, now);
            timeoutSupervisor.cancel(sessionId);
            session.nextTimerGeneration();
            outcomes.put(sessionId, new WakeSignal(sessionId, OutcomeKind.SUBMITTED,
                    session.toResult(), null, session.getTimeoutSeconds()));
            publish();
            registry.broadcast(new FeedbackReceivedMessage(sessionId, "success", "Feedback received"));
            stateChanged.signalAll();

            log.info("Feedback submitted for session {} ({} chars, {} image(s)): {}",
                    sessionId, submission.getFeedbackText().length(), submission.getImages().size(),
                    RelayUtils.preview(submission.getFeedbackText()));
            return currentSnapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the session is answered, expires, is replaced or cancelled,
     * or {@code timeout} elapses. The lock is released while parked.
     *
     * @throws StaleSessionException      if the id is neither current nor recently finished
     * @throws SessionSupersededException if the session was replaced or cancelled first
     * @throws FeedbackTimeoutException   if the session expired or {@code timeout} elapsed
     */
    public FeedbackResult waitForSubmission(String sessionId, Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            if (!outcomes.containsKey(sessionId) && (current == null || !current.getId().equals(sessionId))) {
                throw new StaleSessionException(sessionId);
            }
            while (true) {
                // signals for other sessions wake us too; only our own id counts
                WakeSignal signal = outcomes.get(sessionId);
                if (signal != null) {
                    return resolve(signal);
                }
                if (remainingNanos <= 0) {
                    log.warn("Gave up waiting for session {} after {}", sessionId, timeout);
                    throw new FeedbackTimeoutException(sessionId, timeout.toSeconds());
                }
                remainingNanos = stateChanged.awaitNanos(remainingNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes a submitted session once its result reached the agent.
     *
     * @return false if the session is not current or not submitted
     */
    public boolean complete(String sessionId) {
        lock.lock();
        try {
            FeedbackSession session = current;
            if (session == null || !session.getId().equals(sessionId)
                    || session.getStatus() != SessionStatus.SUBMITTED) {
                return false;
            }
            session.transitionTo(SessionStatus.COMPLETED, clock.instant());
            recordInHistory(session);
            publish();
            registry.broadcast(new StatusUpdateMessage(SessionStatus.COMPLETED.getWireValue(),
                    "Feedback delivered", sessionId));
            log.info("Session {} completed in {} ms", sessionId, currentSnapshot.getDuration().toMillis());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends a session that is still awaiting feedback. Its waiter fails with
     * {@link SessionSupersededException} carrying reason {@code cancelled}.
     *
     * @return false if the session is not current or no longer awaiting feedback
     */
    public boolean cancel(String sessionId) {
        SessionSnapshot cancelled;
        lock.lock();
        try {
            FeedbackSession session = current;
            if (session == null || !session.getId().equals(sessionId) || !session.getStatus().isAwaitingFeedback()) {
                return false;
            }
            session.fail(REASON_CANCELLED, clock.instant());
            timeoutSupervisor.cancel(sessionId);
            session.nextTimerGeneration();
            outcomes.put(sessionId, new WakeSignal(sessionId, OutcomeKind.CANCELLED,
                    null, REASON_CANCELLED, session.getTimeoutSeconds()));
            recordInHistory(session);
            publish();
            registry.broadcast(new StatusUpdateMessage(SessionStatus.ERROR.getWireValue(),
                    "Feedback request was cancelled", null, sessionId, REASON_CANCELLED));
            stateChanged.signalAll();
            cancelled = currentSnapshot;
            log.info("Cancelled session {}", sessionId);
        } finally {
            lock.unlock();
        }
        release(cancelled);
        return true;
    }

    /**
     * Timer callback. A ticket whose generation is behind the session's, or
     * whose session already left the awaiting states, is ignored.
     */
    void expire(TimerTicket ticket) {
        SessionSnapshot expired;
        lock.lock();
        try {
            FeedbackSession session = current;
            if (session == null
                    || !session.getId().equals(ticket.getSessionId())
                    || session.getTimerGeneration() != ticket.getGeneration()
                    || !session.getStatus().isAwaitingFeedback()) {
                log.debug("Ignoring stale timer for session {} (generation {})",
                        ticket.getSessionId(), ticket.getGeneration());
                return;
            }
            session.fail(REASON_TIMEOUT, clock.instant());
            session.nextTimerGeneration();
            outcomes.put(session.getId(), new WakeSignal(session.getId(), OutcomeKind.TIMED_OUT,
                    null, REASON_TIMEOUT, session.getTimeoutSeconds()));
            recordInHistory(session);
            publish();
            registry.broadcast(new StatusUpdateMessage(SessionStatus.ERROR.getWireValue(),
                    "No feedback within " + session.getTimeoutSeconds() + " seconds",
                    null, session.getId(), REASON_TIMEOUT));
            stateChanged.signalAll();
            expired = currentSnapshot;
            log.warn("Session {} timed out after {}s without feedback", session.getId(), session.getTimeoutSeconds());
        } finally {
            lock.unlock();
        }
        release(expired);
    }

    @PreDestroy
    public void shutdown() {
        getCurrent()
                .filter(session -> session.getStatus().isAwaitingFeedback())
                .ifPresent(session -> {
                    log.info("Shutting down, cancelling pending session {}", session.getId());
                    cancel(session.getId());
                });
    }

    /**
     * @return the replaced session if it still held resources, else null
     */
    // lock held
    private SessionSnapshot closeReplaced(FeedbackSession previous, Instant now) {
        boolean wasAwaiting = previous.getStatus().isAwaitingFeedback();
        if (previous.getStatus().isActive()) {
            previous.transitionTo(SessionStatus.COMPLETED, now);
        }
        timeoutSupervisor.cancel(previous.getId());
        previous.nextTimerGeneration();
        outcomes.putIfAbsent(previous.getId(), new WakeSignal(previous.getId(), OutcomeKind.SUPERSEDED,
                null, REASON_REPLACED, previous.getTimeoutSeconds()));
        recordInHistory(previous);
        return wasAwaiting ? previous.snapshot() : null;
    }

    // lock held
    private void recordInHistory(FeedbackSession session) {
        if (session.isRecordedInHistory()) {
            return;
        }
        session.markRecordedInHistory();
        try {
            history.record(session.snapshot());
        } catch (RuntimeException e) {
            log.error("Failed to record session {} in history", session.getId(), e);
        }
    }

    private void publish() {
        currentSnapshot = current == null ? null : current.snapshot();
    }

    private FeedbackResult resolve(WakeSignal signal) {
        switch (signal.getKind()) {
            case SUBMITTED:
                return signal.getResult();
            case SUPERSEDED:
            case CANCELLED:
                throw new SessionSupersededException(signal.getSessionId(), signal.getReason());
            case TIMED_OUT:
                throw new FeedbackTimeoutException(signal.getSessionId(), signal.getTimeoutSeconds());
            default:
                throw new IllegalStateException("Unhandled outcome " + signal.getKind());
        }
    }

    private void release(SessionSnapshot session) {
        try {
            resourceReleaser.release(session);
        } catch (RuntimeException e) {
            log.error("Failed to release resources of session {}", session.getId(), e);
        }
    }
}
