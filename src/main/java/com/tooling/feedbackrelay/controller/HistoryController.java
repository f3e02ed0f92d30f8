package com.tooling.feedbackrelay.controller;

import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.dto.history.HistoryResponse;
import com.tooling.feedbackrelay.dto.history.ImportResultResponse;
import com.tooling.feedbackrelay.service.SessionHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/history")
@Slf4j
public class HistoryController {

    private final SessionHistoryService historyService;

    public HistoryController(SessionHistoryService historyService) {
        this.historyService = historyService;
    }

    @GetMapping
    public ResponseEntity<HistoryResponse> getHistory() {
        return ResponseEntity.ok(new HistoryResponse(
                historyService.entries(),
                historyService.stats(),
                historyService.getPrivacyLevel().getWireValue()));
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportAll() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"session-history.json\"")
                .body(historyService.exportAll());
    }

    @GetMapping(value = "/{sessionId}/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> exportOne(@PathVariable String sessionId) {
        Optional<String> export = historyService.exportOne(sessionId);
        if (export.isEmpty()) {
            return notFound(sessionId);
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"session-" + sessionId + ".json\"")
                .body(export.get());
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ImportResultResponse> importHistory(@RequestBody String body) {
        int imported = historyService.importEntries(body);
        return ResponseEntity.ok(new ImportResultResponse(imported, historyService.entries().size()));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearAll() {
        historyService.clearAll();
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> clearOne(@PathVariable String sessionId) {
        if (!historyService.clearOne(sessionId)) {
            return notFound(sessionId);
        }
        return ResponseEntity.ok(Map.of("status", "success", "session_id", sessionId));
    }

    private ResponseEntity<ErrorResponse> notFound(String sessionId) {
        log.warn("No history entry for session {}", sessionId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("not_found", "No history entry for session " + sessionId));
    }
}
