package com.modelgate.providers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A user-defined provider, or a partial override of a built-in one. Every
 * field except {@code id} may be null, meaning "not specified".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomProviderConfig(
    String id,
    String name,
    ProtocolType type,
    String baseUrl,
    String apiKey,
    Boolean enabled,
    String description,
    Map<String, String> headers,
    JsonNode extraBody
) {
    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    /** Overlays the non-null fields of {@code patch} onto this config. */
    public CustomProviderConfig merge(CustomProviderConfig patch) {
        return new CustomProviderConfig(
            id,
            patch.name() != null ? patch.name() : name,
            patch.type() != null ? patch.type() : type,
            patch.baseUrl() != null ? patch.baseUrl() : baseUrl,
            patch.apiKey() != null ? patch.apiKey() : apiKey,
            patch.enabled() != null ? patch.enabled() : enabled,
            patch.description() != null ? patch.description() : description,
            patch.headers() != null ? patch.headers() : headers,
            patch.extraBody() != null ? patch.extraBody() : extraBody
        );
    }

    public CustomProviderConfig withId(String newId) {
        return new CustomProviderConfig(newId, name, type, baseUrl, apiKey, enabled, description, headers, extraBody);
    }
}
