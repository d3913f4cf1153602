package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceContext(
    String traceId,
    String spanName,
    String parentSpanId,
    Map<String, String> metadata
) {
    public TraceContext withMetadata(String key, String value) {
        var merged = new LinkedHashMap<String, String>();
        if (metadata != null) merged.putAll(metadata);
        merged.put(key, value);
        return new TraceContext(traceId, spanName, parentSpanId, merged);
    }
}
