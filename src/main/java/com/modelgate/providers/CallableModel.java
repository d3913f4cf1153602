package com.modelgate.providers;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A model bound to one provider endpoint. The remote engine owns the actual
 * wire protocol; this handle only carries what it needs to reach the provider.
 */
public record CallableModel(
    String providerId,
    String providerName,
    String modelName,
    String baseUrl,
    ProtocolType protocol,
    AuthStrategy auth,
    Map<String, String> headers,
    JsonNode extraBody
) {
    public CallableModel {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    /** Static provider headers followed by credential headers. */
    public Map<String, String> requestHeaders(Instant now) {
        var all = new LinkedHashMap<>(headers);
        all.putAll(auth.headers(now));
        return all;
    }
}
