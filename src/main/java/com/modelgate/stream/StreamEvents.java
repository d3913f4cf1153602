package com.modelgate.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelgate.errors.StreamProtocolException;
import com.modelgate.shared.model.Mappers;
import com.modelgate.shared.model.StreamEvent;
import org.slf4j.Logger;

/**
 * Decoding and logging of inbound channel messages.
 */
public final class StreamEvents {

    private static final ObjectMapper MAPPER = Mappers.json();

    static final String NATIVE_METADATA_KEY = "provider_metadata";
    static final String METADATA_KEY = "providerMetadata";

    private StreamEvents() {}

    /** Renames the engine's {@code provider_metadata} to {@code providerMetadata}. */
    public static JsonNode normalize(JsonNode message) {
        if (!(message instanceof ObjectNode obj) || !obj.hasNonNull(NATIVE_METADATA_KEY)) return message;
        var copy = obj.deepCopy();
        copy.set(METADATA_KEY, copy.remove(NATIVE_METADATA_KEY));
        return copy;
    }

    /**
     * @throws StreamProtocolException when the message has no known {@code type} or does not fit it
     */
    public static StreamEvent parse(String requestId, JsonNode message) {
        if (message == null || !message.isObject()) {
            throw new StreamProtocolException("Stream event for request " + requestId + " is not an object");
        }
        try {
            return MAPPER.treeToValue(normalize(message), StreamEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw StreamProtocolException.malformedEvent(requestId, e);
        }
    }

    public static void log(Logger log, String requestId, StreamEvent event) {
        if (event instanceof StreamEvent.Error e) {
            log.error("[stream {}] Error: {}", requestId, e.message());
        } else if (event instanceof StreamEvent.Done d) {
            log.info("[stream {}] Done: {}", requestId, d.finishReason() != null ? d.finishReason() : "unknown");
        } else if (event instanceof StreamEvent.ToolCall t) {
            log.info("[stream {}] Tool call: {} (id: {})", requestId, t.toolName(), t.toolCallId());
        } else if (event instanceof StreamEvent.TextDelta t) {
            log.debug("[stream {}] Text delta: {} chars", requestId, length(t.text()));
        } else if (event instanceof StreamEvent.ReasoningDelta r) {
            log.debug("[stream {}] Reasoning delta: {} chars", requestId, length(r.text()));
        } else if (event instanceof StreamEvent.ReasoningStart r) {
            log.debug("[stream {}] Reasoning start: {}", requestId, r.id());
        } else if (event instanceof StreamEvent.ReasoningEnd r) {
            log.debug("[stream {}] Reasoning end: {}", requestId, r.id());
        } else if (event instanceof StreamEvent.Usage u) {
            log.debug("[stream {}] Usage: {} in, {} out", requestId, u.inputTokens(), u.outputTokens());
        } else if (event instanceof StreamEvent.TextStart) {
            log.debug("[stream {}] Text start", requestId);
        } else {
            log.debug("[stream {}] Event: {}", requestId, event.getClass().getSimpleName());
        }
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}
