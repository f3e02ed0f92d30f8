package com.tooling.feedbackrelay.controller;

import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.dto.session.FeedbackRequest;
import com.tooling.feedbackrelay.dto.session.FeedbackResultResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.model.session.FeedbackResult;
import com.tooling.feedbackrelay.service.FeedbackRelayService;
import com.tooling.feedbackrelay.utils.RelayUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agent-facing call. The request thread blocks until the human answers, the
 * request times out or it is replaced by a newer one.
 */
@RestController
@RequestMapping("/api/feedback-requests")
@Slf4j
public class FeedbackRequestController {

    private final FeedbackRelayService relayService;

    public FeedbackRequestController(FeedbackRelayService relayService) {
        this.relayService = relayService;
    }

    @PostMapping
    public ResponseEntity<?> requestFeedback(@RequestBody FeedbackRequest request) {
        log.info("Agent requested feedback for {}: {}", request.getProjectDirectory(), RelayUtils.preview(request.getSummary()));
        try {
            FeedbackResult result = relayService.requestFeedback(
                    request.getSummary(), request.getProjectDirectory(), request.getTimeout());
            return ResponseEntity.ok(FeedbackResultResponse.from(result));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for feedback on {}", request.getProjectDirectory());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse(ErrorCode.CONNECTION_ERROR.getWireName(), "Interrupted while waiting for feedback"));
        }
    }
}
