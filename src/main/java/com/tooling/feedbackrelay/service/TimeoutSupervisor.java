package com.tooling.feedbackrelay.service;

import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One deadline timer per session. The supervisor only schedules and cancels;
 * whether a firing timer still matters is decided by the expiry handler, which
 * compares the ticket's generation with the session's current one.
 */
@Component
@Slf4j
public class TimeoutSupervisor {

    /**
     * Identifies one arming of a session's timer.
     */
    @Value
    public static class TimerTicket {
        String sessionId;
        long generation;
    }

    @Value
    private static class ArmedTimer {
        TimerTicket ticket;
        ScheduledFuture<?> future;
    }

    public interface ExpiryHandler {
        void onExpired(TimerTicket ticket);
    }

    private final ScheduledExecutorService scheduler;
    private final Map<String, ArmedTimer> timers = new ConcurrentHashMap<>();
    private volatile ExpiryHandler expiryHandler = ticket ->
            log.warn("Timer for session {} fired before an expiry handler was set", ticket.getSessionId());

    @Autowired
    public TimeoutSupervisor() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "feedback-timeouts");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public TimeoutSupervisor(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void setExpiryHandler(ExpiryHandler expiryHandler) {
        this.expiryHandler = expiryHandler;
    }

    public void arm(TimerTicket ticket, long timeoutSeconds) {
        cancel(ticket.getSessionId());
        ScheduledFuture<?> future = scheduler.schedule(() -> fire(ticket), timeoutSeconds, TimeUnit.SECONDS);
        timers.put(ticket.getSessionId(), new ArmedTimer(ticket, future));
        log.debug("Armed {}s timer for session {} (generation {})",
                timeoutSeconds, ticket.getSessionId(), ticket.getGeneration());
    }

    public void cancel(String sessionId) {
        ArmedTimer armed = timers.remove(sessionId);
        if (armed != null) {
            if (armed.getFuture() != null) {
                armed.getFuture().cancel(false);
            }
            log.debug("Cancelled timer for session {}", sessionId);
        }
    }

    public boolean isArmed(String sessionId) {
        return timers.containsKey(sessionId);
    }

    /**
     * Runs the expiry handler for a ticket. A ticket from a cancelled or
     * re-armed timer reaches the handler too and must be ignored there.
     */
    public void fire(TimerTicket ticket) {
        timers.computeIfPresent(ticket.getSessionId(),
                (sessionId, armed) -> armed.getTicket().equals(ticket) ? null : armed);
        try {
            expiryHandler.onExpired(ticket);
        } catch (RuntimeException e) {
            log.error("Expiry handling failed for session {}", ticket.getSessionId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down timeout supervisor...");
        timers.keySet().forEach(this::cancel);
        timers.clear();
        scheduler.shutdownNow();
    }
}
