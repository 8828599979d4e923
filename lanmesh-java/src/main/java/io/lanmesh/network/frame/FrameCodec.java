package io.lanmesh.network.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lanmesh.network.handshake.HandshakeException;
import io.lanmesh.network.handshake.HandshakeMessage;

import java.util.Optional;

/**
 * JSON encoding of handshake messages and steady-state frames, one object per line.
 * The encoded form never contains a raw newline; line termination is added by the
 * pipeline's {@code LineEncoder}.
 */
public final class FrameCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.INDENT_OUTPUT, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    public String encode(Frame frame) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("event", frame.event());
        node.set("data", frame.data());
        return write(node, frame.event());
    }

    public String encode(HandshakeMessage message) {
        return write(message, message.getClass().getSimpleName());
    }

    /**
     * @return the frame, or empty if {@code line} is not a JSON object
     */
    public Optional<Frame> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(line);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            JsonNode event = node.get("event");
            String name = event != null && event.isTextual() ? event.asText() : Frame.DEFAULT_EVENT;
            JsonNode data = node.get("data");
            return Optional.of(new Frame(name, data == null || data.isNull() ? null : data));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public HandshakeMessage decodeHandshake(String line) throws HandshakeException {
        try {
            HandshakeMessage message = MAPPER.readValue(line, HandshakeMessage.class);
            if (message == null) {
                throw new HandshakeException(HandshakeException.Reason.MALFORMED, "empty handshake line");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new HandshakeException(HandshakeException.Reason.MALFORMED,
                "undecodable handshake line: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Converts an application payload (map, list, POJO, {@link JsonNode}) to a tree.
     */
    public JsonNode toData(Object data) {
        if (data == null) {
            return MAPPER.createObjectNode();
        }
        if (data instanceof JsonNode node) {
            return node;
        }
        try {
            return MAPPER.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable: " + data.getClass().getName(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + what, e);
        }
    }
}
