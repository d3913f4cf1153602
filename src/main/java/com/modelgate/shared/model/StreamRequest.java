package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Payload of one streaming text-generation call. {@code model} is a model key,
 * optionally suffixed with {@code @providerId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamRequest(
    String model,
    List<Message> messages,
    List<ToolDefinition> tools,
    Boolean stream,
    Double temperature,
    Integer maxTokens,
    Double topP,
    Integer topK,
    Map<String, Object> providerOptions,
    String requestId,
    TraceContext traceContext
) {
    public StreamRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Stream request model is required");
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public static StreamRequest prompt(String model, String prompt) {
        return messages(model, List.of(Message.user(prompt)));
    }

    public static StreamRequest messages(String model, List<Message> messages) {
        return new StreamRequest(model, messages, null, true, null, null, null, null, null, null, null);
    }

    public StreamRequest withTools(List<ToolDefinition> tools) {
        return new StreamRequest(model, messages, tools, stream, temperature, maxTokens, topP, topK,
                providerOptions, requestId, traceContext);
    }

    public StreamRequest withSampling(Double temperature, Integer maxTokens, Double topP, Integer topK) {
        return new StreamRequest(model, messages, tools, stream, temperature, maxTokens, topP, topK,
                providerOptions, requestId, traceContext);
    }

    public StreamRequest withRequestId(String requestId) {
        return new StreamRequest(model, messages, tools, stream, temperature, maxTokens, topP, topK,
                providerOptions, requestId, traceContext);
    }

    public StreamRequest withTraceContext(TraceContext traceContext) {
        return new StreamRequest(model, messages, tools, stream, temperature, maxTokens, topP, topK,
                providerOptions, requestId, traceContext);
    }
}
