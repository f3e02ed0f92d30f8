package com.tooling.feedbackrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import com.tooling.feedbackrelay.integration.SettingsStore;
import com.tooling.feedbackrelay.integration.SurfaceLauncher;
import com.tooling.feedbackrelay.model.session.FeedbackResult;
import com.tooling.feedbackrelay.model.session.FeedbackSubmission;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.utils.RelayUtils;
import com.tooling.feedbackrelay.websocket.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point used by the agent-facing surface and the human-facing
 * transports. Holds no state of its own.
 */
@Service
@Slf4j
public class FeedbackRelayService {

    public static final String UI_SETTINGS_KEY = "ui_settings";

    private final SessionStore sessionStore;
    private final ConnectionRegistry registry;
    private final FeedbackValidator validator;
    private final SurfaceLauncher surfaceLauncher;
    private final SettingsStore settingsStore;
    private final ObjectMapper objectMapper;
    private final FeedbackRelayProperties properties;

    public FeedbackRelayService(SessionStore sessionStore,
                                ConnectionRegistry registry,
                                FeedbackValidator validator,
                                SurfaceLauncher surfaceLauncher,
                                SettingsStore settingsStore,
                                ObjectMapper objectMapper,
                                FeedbackRelayProperties properties) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.validator = validator;
        this.surfaceLauncher = surfaceLauncher;
        this.settingsStore = settingsStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Opens a new feedback request, replacing any pending one, and blocks until
     * the human answers or the request ends otherwise.
     *
     * @param timeoutSeconds null for the configured default; clamped to the configured range
     */
    public FeedbackResult requestFeedback(String summary, String projectDirectory, Integer timeoutSeconds)
            throws InterruptedException {
        if (StringUtils.isBlank(summary)) {
            throw new FeedbackValidationException(List.of("summary must not be blank"));
        }
        int timeout = effectiveTimeout(timeoutSeconds);
        String sessionId = sessionStore.createOrReplace(summary, StringUtils.defaultString(projectDirectory, "."), timeout);

        // a tab that is already open picks the session up from session_updated
        if (registry.liveConnectionCount() == 0) {
            log.info("No open feedback tab, launching one for session {}", sessionId);
            surfaceLauncher.open(properties.getPublicUrl());
        } else {
            log.debug("Reusing {} open tab(s) for session {}", registry.liveConnectionCount(), sessionId);
        }

        Duration wait = Duration.ofSeconds(timeout + properties.getSession().getWaitGraceSeconds());
        FeedbackResult result = sessionStore.waitForSubmission(sessionId, wait);
        sessionStore.complete(sessionId);
        log.info("Returning feedback for session {} to the agent: {}", sessionId, RelayUtils.preview(result.getFeedbackText()));
        return result;
    }

    public SessionSnapshot submitFeedback(String sessionId,
                                          String feedbackText,
                                          List<ImageAttachment> images,
                                          Map<String, Object> settings) {
        FeedbackSubmission submission = validator.validate(feedbackText, images, settings);
        return sessionStore.submitFeedback(sessionId, submission);
    }

    public Optional<SessionSnapshot> currentSession() {
        return sessionStore.getCurrent();
    }

    /**
     * @return the id of the cancelled session, empty if nothing was awaiting feedback
     */
    public Optional<String> cancelCurrent() {
        return sessionStore.getCurrent()
                .map(SessionSnapshot::getId)
                .filter(sessionStore::cancel);
    }

    public void switchLanguage(String language) {
        if (StringUtils.isBlank(language)) {
            throw new FeedbackValidationException(List.of("language must not be blank"));
        }
        JsonNode stored = settingsStore.load(UI_SETTINGS_KEY).orElseGet(objectMapper::createObjectNode);
        ObjectNode settings = stored.isObject() ? (ObjectNode) stored : objectMapper.createObjectNode();
        settings.put("language", language);
        settingsStore.save(UI_SETTINGS_KEY, settings);
        log.info("UI language switched to {}", language);
    }

    int effectiveTimeout(Integer requested) {
        FeedbackRelayProperties.Session limits = properties.getSession();
        if (requested == null) {
            return limits.getDefaultTimeoutSeconds();
        }
        int clamped = RelayUtils.clamp(requested, limits.getMinTimeoutSeconds(), limits.getMaxTimeoutSeconds());
        if (clamped != requested) {
            log.warn("Requested timeout {}s is outside {}-{}s, using {}s",
                    requested, limits.getMinTimeoutSeconds(), limits.getMaxTimeoutSeconds(), clamped);
        }
        return clamped;
    }
}
