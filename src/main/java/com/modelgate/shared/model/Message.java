package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * A chat message. {@code content} is either a plain {@link String} or a
 * {@code List<ContentPart>}; tool messages always carry parts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
    String role,
    Object content,
    Map<String, Object> providerOptions
) {
    public Message {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Message role is required");
        }
        if (!(content instanceof String) && !(content instanceof List<?>)) {
            throw new IllegalArgumentException("Message content must be text or a list of parts");
        }
        if ("tool".equals(role) && !(content instanceof List<?>)) {
            throw new IllegalArgumentException("Tool messages must carry content parts");
        }
    }

    public static Message system(String text) {
        return new Message("system", text, null);
    }

    public static Message user(String text) {
        return new Message("user", text, null);
    }

    public static Message user(List<ContentPart> parts) {
        return new Message("user", List.copyOf(parts), null);
    }

    public static Message assistant(String text) {
        return new Message("assistant", text, null);
    }

    public static Message assistant(List<ContentPart> parts) {
        return new Message("assistant", List.copyOf(parts), null);
    }

    public static Message tool(List<ContentPart> parts) {
        return new Message("tool", List.copyOf(parts), null);
    }
}
