package com.tooling.feedbackrelay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import com.tooling.feedbackrelay.integration.SettingsStore;
import com.tooling.feedbackrelay.model.history.HistoryEntry;
import com.tooling.feedbackrelay.model.history.HistoryStats;
import com.tooling.feedbackrelay.model.history.ImageMetadata;
import com.tooling.feedbackrelay.model.history.PrivacyLevel;
import com.tooling.feedbackrelay.model.history.UserMessage;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.utils.RelayUtils;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Capped, age-pruned log of finished sessions, newest first.
 * <p>
 * Entries are immutable. Appending an entry whose session id is already known
 * replaces it in place, merging both user message lists by timestamp. The
 * whole log is written through {@link SettingsStore} after every change.
 */
@Service
@Slf4j
public class SessionHistoryService {

    static final String STORAGE_KEY = "session_history";
    static final String FORMAT_VERSION = "1.0";

    private final SettingsStore settingsStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxEntries;
    private final Duration retention;
    private volatile PrivacyLevel privacyLevel;

    private final LinkedList<HistoryEntry> entries = new LinkedList<>();
    private long lastCleanup;

    public SessionHistoryService(SettingsStore settingsStore,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 FeedbackRelayProperties properties) {
        this.settingsStore = settingsStore;
        this.objectMapper = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
        this.maxEntries = properties.getHistory().getMaxEntries();
        this.retention = Duration.ofHours(properties.getHistory().getRetentionHours());
        this.privacyLevel = properties.getHistory().getPrivacyLevel();
    }

    @PostConstruct
    public synchronized void load() {
        Optional<JsonNode> stored = settingsStore.load(STORAGE_KEY);
        if (stored.isEmpty()) {
            log.info("No stored session history, starting empty");
            return;
        }
        try {
            JsonNode blob = stored.get();
            entries.clear();
            entries.addAll(readEntries(blob));
            lastCleanup = blob.path("lastCleanup").asLong(0);
            prune();
            log.info("Loaded {} session history entries", entries.size());
        } catch (JsonProcessingException | IllegalArgumentException | FeedbackValidationException e) {
            log.error("Stored session history is unreadable, starting empty. Reason: {}", e.getMessage(), e);
            entries.clear();
        }
    }

    /**
     * Captures a finished session, applying the privacy level in effect now.
     */
    public HistoryEntry record(SessionSnapshot session) {
        Instant completedAt = session.getCompletedAt() != null ? session.getCompletedAt() : clock.instant();
        List<UserMessage> userMessages = new ArrayList<>();
        if (session.getSubmittedAt() != null) {
            userMessages.add(captureUserMessage(session, privacyLevel));
        }
        HistoryEntry entry = HistoryEntry.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .summary(session.getSummary())
                .projectDirectory(session.getProjectDirectory())
                .createdAt(session.getCreatedAt().toEpochMilli())
                .completedAt(completedAt.toEpochMilli())
                .duration(Duration.between(session.getCreatedAt(), completedAt).toMillis())
                .errorReason(session.getErrorReason())
                .userMessages(List.copyOf(userMessages))
                .build();
        return append(entry);
    }

    public synchronized HistoryEntry append(HistoryEntry entry) {
        HistoryEntry stored = entry;
        int existingIndex = indexOf(entry.getSessionId());
        if (existingIndex >= 0) {
            HistoryEntry existing = entries.get(existingIndex);
            stored = entry.toBuilder()
                    .userMessages(mergeUserMessages(existing.getUserMessages(), entry.getUserMessages()))
                    .build();
            entries.set(existingIndex, stored);
            log.debug("Merged history entry for session {}", entry.getSessionId());
        } else {
            entries.addFirst(stored);
            log.info("Recorded session {} in history as {}", entry.getSessionId(), entry.getStatus().getWireValue());
        }
        prune();
        persist();
        return stored;
    }

    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized Optional<HistoryEntry> find(String sessionId) {
        int index = indexOf(sessionId);
        return index >= 0 ? Optional.of(entries.get(index)) : Optional.empty();
    }

    public synchronized HistoryStats stats() {
        long todayStart = RelayUtils.startOfToday(clock).toEpochMilli();
        List<HistoryEntry> today = entries.stream()
                .filter(entry -> entry.getCreatedAt() >= todayStart)
                .collect(Collectors.toList());
        List<HistoryEntry> completedToday = today.stream()
                .filter(entry -> entry.isCompleted() && entry.getDuration() > 0)
                .collect(Collectors.toList());
        long averageDuration = 0;
        if (!completedToday.isEmpty()) {
            long total = completedToday.stream().mapToLong(HistoryEntry::getDuration).sum();
            averageDuration = Math.round((double) total / completedToday.size());
        }
        return new HistoryStats(today.size(), averageDuration, entries.size());
    }

    public synchronized String exportAll() {
        ObjectNode export = objectMapper.createObjectNode();
        export.put("exportedAt", clock.instant().toString());
        export.put("totalSessions", entries.size());
        export.set("sessions", objectMapper.valueToTree(entries));
        return write(export);
    }

    public synchronized Optional<String> exportOne(String sessionId) {
        return find(sessionId).map(entry -> {
            ObjectNode export = objectMapper.createObjectNode();
            export.put("exportedAt", clock.instant().toString());
            export.set("session", objectMapper.valueToTree(entry));
            return write(export);
        });
    }

    /**
     * Accepts the output of either export call, or a bare array of entries.
     * Nothing is appended unless every entry in the batch is well formed.
     *
     * @return number of entries appended
     * @throws FeedbackValidationException if the input is not JSON or any entry lacks a session id or status
     */
    public int importEntries(String json) {
        List<HistoryEntry> imported;
        try {
            imported = readEntries(objectMapper.readTree(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FeedbackValidationException(List.of("History import is not valid JSON: " + e.getMessage()));
        }
        // oldest first so the newest ends up on top
        imported.sort(Comparator.comparingLong(HistoryEntry::getCreatedAt));
        imported.forEach(this::append);
        log.info("Imported {} history entries", imported.size());
        return imported.size();
    }

    public synchronized void clearAll() {
        int removed = entries.size();
        entries.clear();
        persist();
        log.info("Cleared {} history entries", removed);
    }

    public synchronized boolean clearOne(String sessionId) {
        boolean removed = entries.removeIf(entry -> entry.getSessionId().equals(sessionId));
        if (removed) {
            persist();
            log.info("Removed session {} from history", sessionId);
        }
        return removed;
    }

    public PrivacyLevel getPrivacyLevel() {
        return privacyLevel;
    }

    public void setPrivacyLevel(PrivacyLevel privacyLevel) {
        if (this.privacyLevel != privacyLevel) {
            log.info("History privacy level changed from {} to {}", this.privacyLevel.getWireValue(), privacyLevel.getWireValue());
            this.privacyLevel = privacyLevel;
        }
    }

    static UserMessage captureUserMessage(SessionSnapshot session, PrivacyLevel level) {
        long timestamp = session.getSubmittedAt().toEpochMilli();
        String text = session.getFeedbackText() == null ? "" : session.getFeedbackText();
        List<ImageAttachment> images = session.getImages() == null ? List.of() : session.getImages();
        UserMessage.UserMessageBuilder message = UserMessage.builder()
                .timestamp(timestamp)
                .privacyLevel(level);
        switch (level) {
            case FULL:
                return message.content(text)
                        .contentLength(text.length())
                        .imageCount(images.size())
                        .images(images.stream()
                                .map(image -> ImageMetadata.builder()
                                        .name(image.getName())
                                        .type(image.getType())
                                        .size(image.getSize())
                                        .build())
                                .collect(Collectors.toList()))
                        .build();
            case BASIC:
                return message.contentLength(text.length())
                        .imageCount(images.size())
                        .build();
            case DISABLED:
            default:
                return message.build();
        }
    }

    private static List<UserMessage> mergeUserMessages(List<UserMessage> existing, List<UserMessage> incoming) {
        Map<Long, UserMessage> byTimestamp = new LinkedHashMap<>();
        existing.forEach(message -> byTimestamp.putIfAbsent(message.getTimestamp(), message));
        incoming.forEach(message -> byTimestamp.putIfAbsent(message.getTimestamp(), message));
        return byTimestamp.values().stream()
                .sorted(Comparator.comparingLong(UserMessage::getTimestamp))
                .collect(Collectors.toUnmodifiableList());
    }

    private int indexOf(String sessionId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getSessionId().equals(sessionId)) {
                return i;
            }
        }
        return -1;
    }

    // size first, then age
    private void prune() {
        while (entries.size() > maxEntries) {
            HistoryEntry dropped = entries.removeLast();
            log.debug("History full, dropped session {}", dropped.getSessionId());
        }
        long cutoff = clock.instant().minus(retention).toEpochMilli();
        entries.removeIf(entry -> Math.max(entry.getCompletedAt(), entry.getCreatedAt()) < cutoff);
        lastCleanup = clock.millis();
    }

    private void persist() {
        ObjectNode blob = objectMapper.createObjectNode();
        blob.put("version", FORMAT_VERSION);
        blob.set("sessions", objectMapper.valueToTree(entries));
        blob.put("lastCleanup", lastCleanup);
        blob.put("savedAt", clock.millis());
        try {
            settingsStore.save(STORAGE_KEY, blob);
        } catch (RuntimeException e) {
            log.error("Failed to persist session history ({} entries). Reason: {}", entries.size(), e.getMessage(), e);
        }
    }

    private List<HistoryEntry> readEntries(JsonNode root) throws JsonProcessingException {
        JsonNode sessions;
        if (root.isArray()) {
            sessions = root;
        } else if (root.has("sessions")) {
            sessions = root.get("sessions");
        } else if (root.has("session")) {
            ArrayNode single = objectMapper.createArrayNode();
            single.add(root.get("session"));
            sessions = single;
        } else {
            throw new IllegalArgumentException("Expected an array, a 'sessions' list or a 'session' object");
        }
        List<HistoryEntry> result = new ArrayList<>();
        List<String> violations = new ArrayList<>();
        int index = 0;
        for (JsonNode node : sessions) {
            HistoryEntry entry = objectMapper.treeToValue(node, HistoryEntry.class);
            if (StringUtils.isBlank(entry.getSessionId())) {
                violations.add("History entry " + index + " has no session_id");
            }
            if (entry.getStatus() == null) {
                violations.add("History entry " + index + " has no status");
            }
            if (entry.getUserMessages() == null) {
                entry = entry.toBuilder().userMessages(List.of()).build();
            }
            result.add(entry);
            index++;
        }
        if (!violations.isEmpty()) {
            throw new FeedbackValidationException(violations);
        }
        return result;
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session history", e);
        }
    }
}
