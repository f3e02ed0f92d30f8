package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooling.feedbackrelay.MutableClock;
import com.tooling.feedbackrelay.exception.InvalidMessageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtocolCodecTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProtocolCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ProtocolCodec(objectMapper, new MutableClock(NOW));
    }

    @Test
    void encode_wrapsMessageInEnvelope_withSnakeCaseFields() throws Exception {
        String frame = codec.encode(new SessionUpdatedMessage("s1", "Did the thing", "/work", NOW.toString()));

        JsonNode root = objectMapper.readTree(frame);
        assertEquals("session_updated", root.path("type").asText());
        assertEquals(NOW.toString(), root.path("timestamp").asText());
        JsonNode data = root.path("data");
        assertEquals("s1", data.path("session_id").asText());
        assertEquals("Did the thing", data.path("summary").asText());
        assertEquals("/work", data.path("project_directory").asText());
    }

    @Test
    void encode_statusUpdate_omitsAbsentOptionalFields() throws Exception {
        JsonNode data = objectMapper.readTree(codec.encode(new StatusUpdateMessage("waiting", "Waiting", null)))
                .path("data");

        assertFalse(data.has("progress"));
        assertFalse(data.has("reason"));
        assertFalse(data.has("session_id"));
    }

    @Test
    void decodeClientMessage_readsSubmitFeedbackFromData() {
        String frame = "{\"type\":\"submit_feedback\",\"data\":{\"session_id\":\"s1\",\"feedback\":\"lgtm\","
                + "\"images\":[{\"name\":\"a.png\",\"data\":\"aGk=\",\"size\":2}],\"settings\":{\"k\":1}},"
                + "\"timestamp\":\"2024-05-01T10:00:00Z\"}";

        ClientMessage message = codec.decodeClientMessage(frame).orElseThrow();

        SubmitFeedbackMessage submit = assertInstanceOf(SubmitFeedbackMessage.class, message);
        assertEquals("s1", submit.getSessionId());
        assertEquals("lgtm", submit.getFeedback());
        assertEquals("a.png", submit.getImages().get(0).getName());
        assertEquals(1, submit.getSettings().get("k"));
    }

    @Test
    void decodeClientMessage_acceptsFlatFrames() {
        ClientMessage message = codec.decodeClientMessage("{\"type\":\"heartbeat\",\"timestamp\":1714557600000}")
                .orElseThrow();

        HeartbeatMessage heartbeat = assertInstanceOf(HeartbeatMessage.class, message);
        assertEquals(1714557600000L, heartbeat.getTimestamp());
    }

    @Test
    void decodeClientMessage_ignoresUnknownTypeAndUnknownFields() {
        assertEquals(Optional.empty(), codec.decodeClientMessage("{\"type\":\"run_command\",\"data\":{}}"));

        ClientMessage message = codec.decodeClientMessage(
                "{\"type\":\"language_switch\",\"data\":{\"language\":\"en\",\"added_later\":true}}").orElseThrow();
        assertEquals("en", ((LanguageSwitchMessage) message).getLanguage());
    }

    @Test
    void decodeClientMessage_rejectsServerKinds() {
        assertTrue(codec.decodeClientMessage("{\"type\":\"session_updated\",\"data\":{}}").isEmpty());
    }

    @Test
    void decodeClientMessage_rejectsMalformedInput() {
        assertThrows(InvalidMessageException.class, () -> codec.decodeClientMessage("{not json"));
        assertThrows(InvalidMessageException.class, () -> codec.decodeClientMessage("   "));
        assertThrows(InvalidMessageException.class, () -> codec.decodeClientMessage("[1,2]"));
        assertThrows(InvalidMessageException.class,
                () -> codec.decodeClientMessage("{\"type\":\"submit_feedback\",\"data\":{\"images\":\"nope\"}}"));
    }

    @Test
    void decodeServerMessage_readsEncodedFrame() {
        String frame = codec.encode(new ErrorMessage("stale_session", "This feedback request is no longer active", null));

        ServerMessage message = codec.decodeServerMessage(frame).orElseThrow();

        ErrorMessage error = assertInstanceOf(ErrorMessage.class, message);
        assertEquals("stale_session", error.getErrorCode());
        assertEquals(MessageType.ERROR, error.messageType());
    }

    @Test
    void decodeServerMessage_ignoresKindsFromNewerServers() {
        assertTrue(codec.decodeServerMessage("{\"type\":\"command_output\",\"data\":{\"output\":\"x\"}}").isEmpty());
    }
}
