package com.tooling.feedbackrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooling.feedbackrelay.MutableClock;
import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import com.tooling.feedbackrelay.integration.InMemorySettingsStore;
import com.tooling.feedbackrelay.model.history.HistoryEntry;
import com.tooling.feedbackrelay.model.history.HistoryStats;
import com.tooling.feedbackrelay.model.history.PrivacyLevel;
import com.tooling.feedbackrelay.model.history.UserMessage;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import com.tooling.feedbackrelay.model.session.SessionSnapshot;
import com.tooling.feedbackrelay.model.session.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private InMemorySettingsStore settingsStore;
    private FeedbackRelayProperties properties;
    private SessionHistoryService history;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        settingsStore = new InMemorySettingsStore();
        properties = new FeedbackRelayProperties();
        history = new SessionHistoryService(settingsStore, objectMapper, clock, properties);
    }

    @Test
    void record_keepsNewestFirst_andCapsAtMaxEntries() {
        for (int i = 1; i <= 12; i++) {
            history.record(finished("s" + i, NOW.minusSeconds(60), SessionStatus.COMPLETED));
        }

        List<String> ids = history.entries().stream().map(HistoryEntry::getSessionId).collect(Collectors.toList());
        assertEquals(10, ids.size());
        assertEquals("s12", ids.get(0));
        assertEquals("s3", ids.get(9));
    }

    @Test
    void record_dropsEntriesOlderThanRetention() {
        history.record(finished("old", NOW.minus(Duration.ofHours(80)), SessionStatus.COMPLETED).toBuilder()
                .completedAt(NOW.minus(Duration.ofHours(79)))
                .build());
        history.record(finished("fresh", NOW.minusSeconds(30), SessionStatus.COMPLETED));

        assertEquals(List.of("fresh"),
                history.entries().stream().map(HistoryEntry::getSessionId).collect(Collectors.toList()));
    }

    @Test
    void record_atFullPrivacy_keepsTextAndImageMetadata() {
        HistoryEntry entry = history.record(submitted("s1", "fix the header", image()));

        UserMessage message = entry.getUserMessages().get(0);
        assertEquals("fix the header", message.getContent());
        assertEquals(14, message.getContentLength());
        assertEquals(1, message.getImageCount());
        assertEquals("shot.png", message.getImages().get(0).getName());
        assertEquals(PrivacyLevel.FULL, message.getPrivacyLevel());
    }

    @Test
    void record_atBasicPrivacy_keepsOnlyCounts() {
        history.setPrivacyLevel(PrivacyLevel.BASIC);

        UserMessage message = history.record(submitted("s1", "secret", image())).getUserMessages().get(0);

        assertNull(message.getContent());
        assertNull(message.getImages());
        assertEquals(6, message.getContentLength());
        assertEquals(1, message.getImageCount());
    }

    @Test
    void record_withPrivacyDisabled_keepsTimestampOnly() {
        history.setPrivacyLevel(PrivacyLevel.DISABLED);

        UserMessage message = history.record(submitted("s1", "secret", image())).getUserMessages().get(0);

        assertNull(message.getContent());
        assertNull(message.getContentLength());
        assertNull(message.getImageCount());
        assertEquals(NOW.minusSeconds(10).toEpochMilli(), message.getTimestamp());
    }

    @Test
    void record_withoutSubmission_hasNoUserMessages() {
        HistoryEntry entry = history.record(finished("s1", NOW.minusSeconds(60), SessionStatus.ERROR));

        assertTrue(entry.getUserMessages().isEmpty());
        assertEquals(60_000, entry.getDuration());
    }

    @Test
    void append_sameSessionTwice_replacesEntry_andMergesMessages() {
        UserMessage first = UserMessage.builder().timestamp(100).content("a").build();
        UserMessage second = UserMessage.builder().timestamp(200).content("b").build();
        history.append(entry("s1", SessionStatus.COMPLETED, List.of(second)));
        history.append(entry("s2", SessionStatus.COMPLETED, List.of()));

        HistoryEntry merged = history.append(entry("s1", SessionStatus.COMPLETED, List.of(first, second)));

        assertEquals(2, history.entries().size());
        assertEquals("s2", history.entries().get(0).getSessionId());
        assertEquals(List.of(100L, 200L),
                merged.getUserMessages().stream().map(UserMessage::getTimestamp).collect(Collectors.toList()));
    }

    @Test
    void stats_countsTodayOnly_andAveragesCompletedDurations() {
        history.record(finished("yesterday", NOW.minus(Duration.ofHours(20)), SessionStatus.COMPLETED));
        history.record(finished("fast", NOW.minusSeconds(10), SessionStatus.COMPLETED));
        history.record(finished("slow", NOW.minusSeconds(30), SessionStatus.COMPLETED));
        history.record(finished("failed", NOW.minusSeconds(600), SessionStatus.ERROR));

        HistoryStats stats = history.stats();

        assertEquals(3, stats.getTodayCount());
        assertEquals(20_000, stats.getAverageDurationMillis());
        assertEquals(4, stats.getTotalSessions());
    }

    @Test
    void exportAll_thenImportIntoEmptyHistory_restoresEntries() {
        history.record(submitted("s1", "first", image()));
        clock.advance(Duration.ofSeconds(5));
        history.record(finished("s2", NOW, SessionStatus.ERROR));
        String exported = history.exportAll();

        SessionHistoryService other = new SessionHistoryService(new InMemorySettingsStore(), objectMapper, clock, properties);
        int imported = other.importEntries(exported);

        assertEquals(2, imported);
        assertEquals(List.of("s2", "s1"),
                other.entries().stream().map(HistoryEntry::getSessionId).collect(Collectors.toList()));
        assertEquals("first", other.find("s1").orElseThrow().getUserMessages().get(0).getContent());
    }

    @Test
    void exportOne_unknownSession_isEmpty() throws Exception {
        history.record(finished("s1", NOW.minusSeconds(5), SessionStatus.COMPLETED));

        assertTrue(history.exportOne("missing").isEmpty());
        JsonNode exported = objectMapper.readTree(history.exportOne("s1").orElseThrow());
        assertEquals("s1", exported.path("session").path("session_id").asText());
        assertEquals("completed", exported.path("session").path("status").asText());
    }

    @Test
    void importEntries_rejectsGarbage() {
        assertThrows(FeedbackValidationException.class, () -> history.importEntries("not json"));
        assertThrows(FeedbackValidationException.class, () -> history.importEntries("{\"foo\":1}"));
    }

    @Test
    void importEntries_entryWithoutStatus_isRejected_andNothingStored() {
        String json = "[{\"session_id\":\"s1\",\"created_at\":1,\"completed_at\":2}]";

        FeedbackValidationException error = assertThrows(FeedbackValidationException.class,
                () -> history.importEntries(json));

        assertEquals(List.of("History entry 0 has no status"), error.getViolations());
        assertTrue(history.entries().isEmpty());
        assertTrue(settingsStore.load(SessionHistoryService.STORAGE_KEY).isEmpty());
    }

    @Test
    void importEntries_entryWithoutSessionId_isRejected_andLaterSessionsStillRecord() {
        String json = "[{\"session_id\":\"  \",\"status\":\"completed\"},{\"status\":\"error\"}]";

        FeedbackValidationException error = assertThrows(FeedbackValidationException.class,
                () -> history.importEntries(json));
        history.record(finished("s1", NOW.minusSeconds(5), SessionStatus.COMPLETED));

        assertEquals(2, error.getViolations().size());
        assertEquals(List.of("s1"),
                history.entries().stream().map(HistoryEntry::getSessionId).collect(Collectors.toList()));
    }

    @Test
    void importEntries_oneBadEntry_rejectsWholeBatch() {
        String json = "{\"sessions\":["
                + "{\"session_id\":\"good\",\"status\":\"completed\",\"created_at\":" + NOW.toEpochMilli()
                + ",\"completed_at\":" + NOW.toEpochMilli() + "},"
                + "{\"session_id\":\"bad\"}]}";

        assertThrows(FeedbackValidationException.class, () -> history.importEntries(json));

        assertTrue(history.entries().isEmpty());
    }

    @Test
    void importEntries_nullUserMessages_isTreatedAsEmpty_andMergesLater() {
        String json = "[{\"session_id\":\"s1\",\"status\":\"completed\",\"userMessages\":null,\"created_at\":"
                + NOW.toEpochMilli() + ",\"completed_at\":" + NOW.toEpochMilli() + "}]";

        assertEquals(1, history.importEntries(json));
        assertTrue(history.find("s1").orElseThrow().getUserMessages().isEmpty());

        UserMessage message = UserMessage.builder().timestamp(100).content("late").build();
        HistoryEntry merged = history.append(entry("s1", SessionStatus.COMPLETED, List.of(message)));

        assertEquals(List.of(message), merged.getUserMessages());
    }

    @Test
    void load_blobWithIncompleteEntry_startsEmpty() throws Exception {
        settingsStore.save(SessionHistoryService.STORAGE_KEY,
                objectMapper.readTree("{\"version\":\"1.0\",\"sessions\":[{\"status\":\"completed\"}]}"));

        history.load();
        history.record(finished("s1", NOW.minusSeconds(5), SessionStatus.COMPLETED));

        assertEquals(1, history.entries().size());
    }

    @Test
    void load_restoresPersistedEntries() {
        history.record(finished("s1", NOW.minusSeconds(5), SessionStatus.COMPLETED));
        assertTrue(settingsStore.load(SessionHistoryService.STORAGE_KEY).isPresent());

        SessionHistoryService reloaded = new SessionHistoryService(settingsStore, objectMapper, clock, properties);
        reloaded.load();

        assertEquals("s1", reloaded.entries().get(0).getSessionId());
    }

    @Test
    void load_unreadableBlob_startsEmpty() throws Exception {
        settingsStore.save(SessionHistoryService.STORAGE_KEY, objectMapper.readTree("{\"version\":\"1.0\"}"));

        history.load();

        assertTrue(history.entries().isEmpty());
    }

    @Test
    void clearOne_andClearAll_removeEntries() {
        history.record(finished("s1", NOW.minusSeconds(5), SessionStatus.COMPLETED));
        history.record(finished("s2", NOW.minusSeconds(5), SessionStatus.COMPLETED));

        assertTrue(history.clearOne("s1"));
        assertFalse(history.clearOne("s1"));
        assertEquals(1, history.entries().size());

        history.clearAll();
        assertTrue(history.entries().isEmpty());
    }

    private SessionSnapshot finished(String id, Instant createdAt, SessionStatus status) {
        return SessionSnapshot.builder()
                .id(id)
                .status(status)
                .summary("summary " + id)
                .projectDirectory("/work")
                .createdAt(createdAt)
                .completedAt(clock.instant())
                .timeoutSeconds(600)
                .errorReason(status == SessionStatus.ERROR ? "timeout" : null)
                .build();
    }

    private SessionSnapshot submitted(String id, String text, ImageAttachment image) {
        return SessionSnapshot.builder()
                .id(id)
                .status(SessionStatus.COMPLETED)
                .summary("summary " + id)
                .projectDirectory("/work")
                .createdAt(NOW.minusSeconds(60))
                .submittedAt(NOW.minusSeconds(10))
                .completedAt(NOW)
                .timeoutSeconds(600)
                .feedbackText(text)
                .images(List.of(image))
                .settings(Map.of())
                .build();
    }

    private static ImageAttachment image() {
        return ImageAttachment.builder().name("shot.png").type("image/png").size(4).data("YWJjZA==").build();
    }

    private static HistoryEntry entry(String id, SessionStatus status, List<UserMessage> messages) {
        return HistoryEntry.builder()
                .sessionId(id)
                .status(status)
                .summary(id)
                .createdAt(NOW.toEpochMilli())
                .completedAt(NOW.toEpochMilli())
                .userMessages(messages)
                .build();
    }
}
