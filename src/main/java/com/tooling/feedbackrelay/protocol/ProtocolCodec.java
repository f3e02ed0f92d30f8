package com.tooling.feedbackrelay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tooling.feedbackrelay.exception.InvalidMessageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Encodes and decodes relay frames. Both directions tolerate unknown kinds by
 * returning an empty result, and read fields either from {@code data} or, for
 * older clients that send flat objects, from the frame itself.
 */
@Component
@Slf4j
public class ProtocolCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProtocolCodec(ObjectMapper objectMapper, Clock clock) {
        // fields added by newer peers must not break older ones
        this.objectMapper = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    public String encode(ServerMessage message) {
        return write(message.messageType(), message);
    }

    public String encode(ClientMessage message) {
        return write(message.messageType(), message);
    }

    public Optional<ClientMessage> decodeClientMessage(String text) {
        JsonNode root = readFrame(text);
        String wireType = root.path("type").asText(null);
        Optional<MessageType> type = MessageType.fromWire(wireType, MessageType.Direction.CLIENT_TO_SERVER);
        if (type.isEmpty()) {
            log.warn("Ignoring client message of unknown type '{}'", wireType);
            return Optional.empty();
        }
        JsonNode data = payloadOf(root);
        switch (type.get()) {
            case SUBMIT_FEEDBACK:
                return Optional.of(read(data, SubmitFeedbackMessage.class));
            case HEARTBEAT:
                return Optional.of(read(data, HeartbeatMessage.class));
            case LANGUAGE_SWITCH:
                return Optional.of(read(data, LanguageSwitchMessage.class));
            case GET_STATUS:
                return Optional.of(new GetStatusMessage());
            default:
                throw new IllegalStateException("Unhandled client message type " + type.get());
        }
    }

    public Optional<ServerMessage> decodeServerMessage(String text) {
        JsonNode root = readFrame(text);
        String wireType = root.path("type").asText(null);
        Optional<MessageType> type = MessageType.fromWire(wireType, MessageType.Direction.SERVER_TO_CLIENT);
        if (type.isEmpty()) {
            log.debug("Ignoring server message of unknown type '{}'", wireType);
            return Optional.empty();
        }
        JsonNode data = payloadOf(root);
        switch (type.get()) {
            case CONNECTION_ESTABLISHED:
                return Optional.of(read(data, ConnectionEstablishedMessage.class));
            case SESSION_UPDATED:
                return Optional.of(read(data, SessionUpdatedMessage.class));
            case FEEDBACK_RECEIVED:
                return Optional.of(read(data, FeedbackReceivedMessage.class));
            case STATUS_UPDATE:
                return Optional.of(read(data, StatusUpdateMessage.class));
            case ERROR:
                return Optional.of(read(data, ErrorMessage.class));
            case HEARTBEAT_RESPONSE:
                return Optional.of(read(data, HeartbeatResponseMessage.class));
            default:
                throw new IllegalStateException("Unhandled server message type " + type.get());
        }
    }

    private String write(MessageType type, Object message) {
        MessageEnvelope envelope = new MessageEnvelope(
                type.getWireName(),
                objectMapper.valueToTree(message),
                clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + type.getWireName() + " message", e);
        }
    }

    private JsonNode readFrame(String text) {
        if (StringUtils.isBlank(text)) {
            throw new InvalidMessageException("Empty message", null);
        }
        try {
            JsonNode root = objectMapper.readTree(text);
            if (root == null || !root.isObject()) {
                throw new InvalidMessageException("Message must be a JSON object", null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed JSON message: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode payloadOf(JsonNode root) {
        JsonNode data = root.get("data");
        if (data != null && data.isObject()) {
            return data;
        }
        ObjectNode flat = ((ObjectNode) root).deepCopy();
        flat.remove("type");
        return flat;
    }

    private <T> T read(JsonNode data, Class<T> type) {
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidMessageException("Invalid " + type.getSimpleName() + " payload", e);
        }
    }
}
