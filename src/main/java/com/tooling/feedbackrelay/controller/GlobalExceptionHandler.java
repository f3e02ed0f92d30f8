package com.tooling.feedbackrelay.controller;

import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.exception.FeedbackRelayException;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps relay errors to {@code { error_code, message }} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FeedbackValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(FeedbackValidationException e) {
        ErrorResponse error = new ErrorResponse(e.getErrorCode().getWireName(), e.getMessage(), e.getSessionId(), e.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(FeedbackRelayException.class)
    public ResponseEntity<ErrorResponse> handleRelay(FeedbackRelayException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        String message = e.getMessage();
        if (e.getErrorCode() == ErrorCode.STALE_SESSION || e.getErrorCode() == ErrorCode.ALREADY_SUBMITTED) {
            message = FeedbackRelayException.REQUEST_NO_LONGER_ACTIVE;
        }
        log.warn("Request failed with {}: {}", e.getErrorCode().getWireName(), e.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode().getWireName(), message, e.getSessionId(), null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorCode.INVALID_MESSAGE.getWireName(), "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_error", "An unexpected error occurred"));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case VALIDATION_ERROR:
            case INVALID_MESSAGE:
                return HttpStatus.BAD_REQUEST;
            case STALE_SESSION:
            case ALREADY_SUBMITTED:
                return HttpStatus.CONFLICT;
            case SUPERSEDED:
                return HttpStatus.GONE;
            case TIMEOUT:
                return HttpStatus.REQUEST_TIMEOUT;
            case NO_ACTIVE_SESSION:
                return HttpStatus.NOT_FOUND;
            case CONNECTION_ERROR:
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
