package com.tooling.feedbackrelay.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooling.feedbackrelay.dto.ErrorResponse;
import com.tooling.feedbackrelay.exception.ErrorCode;
import com.tooling.feedbackrelay.integration.SettingsStore;
import com.tooling.feedbackrelay.model.history.PrivacyLevel;
import com.tooling.feedbackrelay.service.FeedbackRelayService;
import com.tooling.feedbackrelay.service.SessionHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Opaque UI settings blob. The only field read here is the history privacy level.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class SettingsController {

    static final String PRIVACY_LEVEL_FIELD = "privacyLevel";

    private final SettingsStore settingsStore;
    private final SessionHistoryService historyService;
    private final ObjectMapper objectMapper;

    public SettingsController(SettingsStore settingsStore, SessionHistoryService historyService, ObjectMapper objectMapper) {
        this.settingsStore = settingsStore;
        this.historyService = historyService;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/load-settings")
    public ResponseEntity<JsonNode> loadSettings() {
        return ResponseEntity.ok(settingsStore.load(FeedbackRelayService.UI_SETTINGS_KEY)
                .orElseGet(objectMapper::createObjectNode));
    }

    @PostMapping("/save-settings")
    public ResponseEntity<?> saveSettings(@RequestBody JsonNode settings) {
        if (settings == null || !settings.isObject()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ErrorResponse(ErrorCode.VALIDATION_ERROR.getWireName(), "Settings must be a JSON object"));
        }
        JsonNode privacy = settings.get(PRIVACY_LEVEL_FIELD);
        if (privacy != null && privacy.isTextual()) {
            try {
                historyService.setPrivacyLevel(PrivacyLevel.fromWire(privacy.asText()));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(new ErrorResponse(ErrorCode.VALIDATION_ERROR.getWireName(), e.getMessage()));
            }
        }
        settingsStore.save(FeedbackRelayService.UI_SETTINGS_KEY, settings);
        log.info("Saved UI settings ({} field(s))", settings.size());
        return ResponseEntity.ok(Map.of("status", "success", "message", "Settings saved"));
    }

    @PostMapping("/clear-settings")
    public ResponseEntity<Map<String, String>> clearSettings() {
        settingsStore.clear(FeedbackRelayService.UI_SETTINGS_KEY);
        log.info("Cleared UI settings");
        return ResponseEntity.ok(Map.of("status", "success", "message", "Settings cleared"));
    }
}
