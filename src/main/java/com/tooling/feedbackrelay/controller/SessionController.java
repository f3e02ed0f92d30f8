package com.tooling.feedbackrelay.controller;

import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.dto.session.CurrentSessionResponse;
import com.tooling.feedbackrelay.dto.session.FeedbackSubmissionRequest;
import com.tooling.feedbackrelay.dto.session.SessionStatusResponse;
import com.tooling.feedbackrelay.dto.session.SubmissionAcceptedResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import com.tooling.feedbackrelay.service.FeedbackRelayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Human-facing HTTP surface: the polling fallback and the HTTP form of submission.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class SessionController {

    private final FeedbackRelayService relayService;

    public SessionController(FeedbackRelayService relayService) {
        this.relayService = relayService;
    }

    @GetMapping("/current-session")
    public ResponseEntity<?> getCurrentSession() {
        Optional<SessionSnapshot> current = relayService.currentSession();
        if (current.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse(ErrorCode.NO_ACTIVE_SESSION.getWireName(), "No active session"));
        }
        return ResponseEntity.ok(CurrentSessionResponse.from(current.get()));
    }

    @GetMapping("/session-status")
    public ResponseEntity<SessionStatusResponse> getSessionStatus() {
        SessionStatusResponse response = relayService.currentSession()
                .map(session -> new SessionStatusResponse(
                        true,
                        session.getStatus().isActive() ? "active" : session.getStatus().getWireValue(),
                        "Session " + session.getStatus().getWireValue(),
                        new SessionStatusResponse.SessionInfo(
                                session.getId(),
                                session.getProjectDirectory(),
                                session.getSummary(),
                                session.getSubmittedAt() != null,
                                session.getErrorReason())))
                .orElseGet(() -> new SessionStatusResponse(false, "no_session", "No active session", null));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/sessions/{sessionId}/feedback")
    public ResponseEntity<SubmissionAcceptedResponse> submitFeedback(@PathVariable String sessionId,
                                                                     @RequestBody FeedbackSubmissionRequest request) {
        log.info("HTTP feedback submission for session {}", sessionId);
        SessionSnapshot session = relayService.submitFeedback(
                sessionId, request.getFeedback(), request.getImages(), request.getSettings());
        return ResponseEntity.ok(new SubmissionAcceptedResponse(
                session.getId(), session.getStatus().getWireValue(), "Feedback received"));
    }

    @PostMapping("/current-session/cancel")
    public ResponseEntity<?> cancelCurrentSession() {
        Optional<String> cancelled = relayService.cancelCurrent();
        if (cancelled.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse(ErrorCode.NO_ACTIVE_SESSION.getWireName(), "No session awaiting feedback"));
        }
        return ResponseEntity.ok(Map.of("session_id", cancelled.get(), "status", SessionStatus.ERROR.getWireValue()));
    }
}
