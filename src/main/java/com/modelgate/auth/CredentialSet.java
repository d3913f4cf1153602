package com.modelgate.auth;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything that proves, or configures, access to providers. Immutable; the
 * {@code with*} methods return modified copies.
 */
public record CredentialSet(
    Map<String, String> apiKeys,
    Map<String, String> baseUrlOverrides,
    Map<String, Boolean> altBillingFlags,
    Map<String, Boolean> internationalFlags,
    Map<String, OAuthBundle> oauth
) {
    /** Credential value that marks a local, credential-less provider as enabled. */
    public static final String LOCAL_ENABLED = "enabled";

    public CredentialSet {
        apiKeys = nonBlank(apiKeys);
        baseUrlOverrides = nonBlank(baseUrlOverrides);
        altBillingFlags = altBillingFlags != null ? Map.copyOf(altBillingFlags) : Map.of();
        internationalFlags = internationalFlags != null ? Map.copyOf(internationalFlags) : Map.of();
        oauth = oauth != null ? Map.copyOf(oauth) : Map.of();
    }

    public static CredentialSet empty() {
        return new CredentialSet(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    /** Returns the stored secret for a provider, or null. */
    public String secret(String providerId) {
        return apiKeys.get(providerId);
    }

    public boolean hasValidOAuth(String providerId, Instant now) {
        var bundle = oauth.get(providerId);
        return bundle != null && bundle.isUsable(now);
    }

    public boolean altBilling(String providerId) {
        return Boolean.TRUE.equals(altBillingFlags.get(providerId));
    }

    public boolean international(String providerId) {
        return Boolean.TRUE.equals(internationalFlags.get(providerId));
    }

    public CredentialSet withApiKey(String providerId, String apiKey) {
        var keys = new HashMap<>(apiKeys);
        putOrRemove(keys, providerId, apiKey);
        return new CredentialSet(keys, baseUrlOverrides, altBillingFlags, internationalFlags, oauth);
    }

    public CredentialSet withBaseUrl(String providerId, String baseUrl) {
        var urls = new HashMap<>(baseUrlOverrides);
        putOrRemove(urls, providerId, baseUrl);
        return new CredentialSet(apiKeys, urls, altBillingFlags, internationalFlags, oauth);
    }

    public CredentialSet withAltBilling(String providerId, boolean enabled) {
        var flags = new HashMap<>(altBillingFlags);
        flags.put(providerId, enabled);
        return new CredentialSet(apiKeys, baseUrlOverrides, flags, internationalFlags, oauth);
    }

    public CredentialSet withInternational(String providerId, boolean enabled) {
        var flags = new HashMap<>(internationalFlags);
        flags.put(providerId, enabled);
        return new CredentialSet(apiKeys, baseUrlOverrides, altBillingFlags, flags, oauth);
    }

    private static void putOrRemove(Map<String, String> map, String key, String value) {
        if (value == null || value.isBlank()) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }

    private static Map<String, String> nonBlank(Map<String, String> source) {
        if (source == null) return Map.of();
        var copy = new HashMap<String, String>();
        source.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) copy.put(k, v);
        });
        return Map.copyOf(copy);
    }
}
