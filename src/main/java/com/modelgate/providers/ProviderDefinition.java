package com.modelgate.providers;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record ProviderDefinition(
    String id,
    String name,
    String baseUrl,
    ProtocolType protocol,
    AuthType authType,
    boolean supportsOAuth,
    boolean supportsAltBilling,
    boolean supportsInternational,
    String altBillingBaseUrl,
    String internationalBaseUrl,
    Map<String, String> headers,
    JsonNode extraBody,
    boolean custom
) {
    public ProviderDefinition {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    static ProviderDefinition of(String id, String name, String baseUrl, ProtocolType protocol, AuthType authType) {
        return new ProviderDefinition(id, name, baseUrl, protocol, authType,
                false, false, false, null, null, Map.of(), null, false);
    }

    ProviderDefinition withOAuth() {
        return new ProviderDefinition(id, name, baseUrl, protocol, authType, true, supportsAltBilling,
                supportsInternational, altBillingBaseUrl, internationalBaseUrl, headers, extraBody, custom);
    }

    ProviderDefinition withAltBilling(String url) {
        return new ProviderDefinition(id, name, baseUrl, protocol, authType, supportsOAuth, true,
                supportsInternational, url, internationalBaseUrl, headers, extraBody, custom);
    }

    ProviderDefinition withInternational(String url) {
        return new ProviderDefinition(id, name, baseUrl, protocol, authType, supportsOAuth, supportsAltBilling,
                true, altBillingBaseUrl, url, headers, extraBody, custom);
    }

    /**
     * Applies the fields a custom entry specifies. Capability flags are not
     * configurable from custom entries and are kept as-is.
     */
    ProviderDefinition overriddenBy(CustomProviderConfig custom) {
        var protocolOverride = custom.type() != null ? custom.type() : protocol;
        return new ProviderDefinition(
            id,
            custom.name() != null ? custom.name() : name,
            custom.baseUrl() != null && !custom.baseUrl().isBlank() ? custom.baseUrl() : baseUrl,
            protocolOverride,
            custom.type() != null ? authFor(protocolOverride) : authType,
            supportsOAuth,
            supportsAltBilling,
            supportsInternational,
            altBillingBaseUrl,
            internationalBaseUrl,
            custom.headers() != null ? custom.headers() : headers,
            custom.extraBody() != null ? custom.extraBody() : extraBody,
            this.custom
        );
    }

    static ProviderDefinition fromCustom(CustomProviderConfig custom) {
        return new ProviderDefinition(
            custom.id(),
            custom.name() != null ? custom.name() : custom.id(),
            custom.baseUrl(),
            custom.type(),
            authFor(custom.type()),
            false, false, false, null, null,
            custom.headers(),
            custom.extraBody(),
            true
        );
    }

    static AuthType authFor(ProtocolType protocol) {
        return protocol == ProtocolType.ANTHROPIC ? AuthType.API_KEY : AuthType.BEARER;
    }
}
