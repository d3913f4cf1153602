package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One typed part of a multi-part message body. The {@code type} discriminator
 * is a regular property so it survives inside untyped {@link Message#content()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentPart.Text.class, name = "text"),
    @JsonSubTypes.Type(value = ContentPart.Image.class, name = "image"),
    @JsonSubTypes.Type(value = ContentPart.ToolCall.class, name = "tool-call"),
    @JsonSubTypes.Type(value = ContentPart.ToolResult.class, name = "tool-result"),
    @JsonSubTypes.Type(value = ContentPart.Reasoning.class, name = "reasoning")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface ContentPart {

    @JsonProperty("type")
    String type();

    record Text(String text) implements ContentPart {
        @Override
        public String type() { return "text"; }
    }

    /** Image as a data URL or remote URL. */
    record Image(String image) implements ContentPart {
        @Override
        public String type() { return "image"; }
    }

    record ToolCall(
        String toolCallId,
        String toolName,
        JsonNode input,
        Map<String, Object> providerMetadata
    ) implements ContentPart {
        @Override
        public String type() { return "tool-call"; }
    }

    record ToolResult(String toolCallId, String toolName, JsonNode output) implements ContentPart {
        @Override
        public String type() { return "tool-result"; }
    }

    record Reasoning(String text, Map<String, Object> providerOptions) implements ContentPart {
        @Override
        public String type() { return "reasoning"; }
    }
}
