package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One incremental unit of a streamed response. {@link Done} and {@link Error}
 * are terminal: nothing follows them on the same request.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StreamEvent.TextStart.class, name = "text-start"),
    @JsonSubTypes.Type(value = StreamEvent.TextDelta.class, name = "text-delta"),
    @JsonSubTypes.Type(value = StreamEvent.ToolCall.class, name = "tool-call"),
    @JsonSubTypes.Type(value = StreamEvent.ReasoningStart.class, name = "reasoning-start"),
    @JsonSubTypes.Type(value = StreamEvent.ReasoningDelta.class, name = "reasoning-delta"),
    @JsonSubTypes.Type(value = StreamEvent.ReasoningEnd.class, name = "reasoning-end"),
    @JsonSubTypes.Type(value = StreamEvent.Usage.class, name = "usage"),
    @JsonSubTypes.Type(value = StreamEvent.Done.class, name = "done"),
    @JsonSubTypes.Type(value = StreamEvent.Error.class, name = "error"),
    @JsonSubTypes.Type(value = StreamEvent.Raw.class, name = "raw")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface StreamEvent {

    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }

    record TextStart() implements StreamEvent {}

    record TextDelta(String text) implements StreamEvent {}

    record ToolCall(
        String toolCallId,
        String toolName,
        JsonNode input,
        Map<String, Object> providerMetadata
    ) implements StreamEvent {}

    record ReasoningStart(String id, Map<String, Object> providerMetadata) implements StreamEvent {}

    record ReasoningDelta(String id, String text, Map<String, Object> providerMetadata) implements StreamEvent {}

    record ReasoningEnd(String id) implements StreamEvent {}

    record Usage(
        @JsonProperty("input_tokens") int inputTokens,
        @JsonProperty("output_tokens") int outputTokens,
        @JsonProperty("total_tokens") Integer totalTokens,
        @JsonProperty("cached_input_tokens") Integer cachedInputTokens,
        @JsonProperty("cache_creation_input_tokens") Integer cacheCreationInputTokens
    ) implements StreamEvent {}

    record Done(@JsonProperty("finish_reason") String finishReason) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Error(String message, String name) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Raw(@JsonProperty("raw_value") String rawValue) implements StreamEvent {}
}
