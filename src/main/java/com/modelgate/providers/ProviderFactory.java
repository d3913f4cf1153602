package com.modelgate.providers;

import com.modelgate.auth.CredentialSet;
import com.modelgate.auth.OAuthTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one {@link ModelResolver} per usable provider. A provider missing
 * from the result is unavailable, which is not an error.
 */
public class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private ProviderFactory() {}

    public static Map<String, ModelResolver> createProviders(CredentialSet credentials,
                                                             ProviderRegistry registry,
                                                             List<CustomProviderConfig> customProviders,
                                                             Map<String, OAuthTokenStore> oauthStores,
                                                             Instant now) {
        var customs = byId(customProviders);
        var result = new LinkedHashMap<String, ModelResolver>();
        for (var def : registry.all()) {
            if (!isUsable(def.id(), credentials, customs, now)) continue;
            var baseUrl = resolveBaseUrl(def, credentials);
            var auth = resolveAuth(def, credentials, customs.get(def.id()), oauthStores.get(def.id()), now);
            result.put(def.id(), modelName -> new CallableModel(
                    def.id(), def.name(), modelName, baseUrl, def.protocol(), auth, def.headers(), def.extraBody()));
            log.debug("Provider {} ready: auth={} baseUrl={}", def.id(), auth.type(), baseUrl);
        }
        return result;
    }

    /**
     * A provider is usable with a stored secret (the local-enabled marker
     * counts), an enabled custom entry carrying an API key, or an unexpired
     * OAuth token.
     */
    public static boolean isUsable(String providerId, CredentialSet credentials,
                                   Map<String, CustomProviderConfig> customs, Instant now) {
        if (credentials.secret(providerId) != null) return true;
        var custom = customs.get(providerId);
        if (custom != null && custom.isEnabled() && custom.apiKey() != null && !custom.apiKey().isBlank()) {
            return true;
        }
        return credentials.hasValidOAuth(providerId, now);
    }

    /** Override, then international endpoint, then alt-billing endpoint, then the default. */
    public static String resolveBaseUrl(ProviderDefinition def, CredentialSet credentials) {
        var override = credentials.baseUrlOverrides().get(def.id());
        if (override != null) return override;
        if (def.supportsInternational() && credentials.international(def.id())
                && def.internationalBaseUrl() != null) {
            return def.internationalBaseUrl();
        }
        if (def.supportsAltBilling() && credentials.altBilling(def.id()) && def.altBillingBaseUrl() != null) {
            return def.altBillingBaseUrl();
        }
        return def.baseUrl();
    }

    static AuthStrategy resolveAuth(ProviderDefinition def, CredentialSet credentials,
                                    CustomProviderConfig custom, OAuthTokenStore oauthStore, Instant now) {
        if (def.supportsOAuth() && credentials.hasValidOAuth(def.id(), now)) {
            return AuthStrategy.oauth(credentials.oauth().get(def.id()), oauthStore);
        }
        var secret = credentials.secret(def.id());
        if (secret == null && custom != null && custom.isEnabled()) secret = custom.apiKey();
        if (secret == null || (CredentialSet.LOCAL_ENABLED.equals(secret) && def.authType() == AuthType.NONE)) {
            return AuthStrategy.none();
        }
        return switch (def.authType()) {
            case NONE -> AuthStrategy.none();
            case BEARER -> AuthStrategy.bearer(secret);
            case API_KEY -> AuthStrategy.apiKey(secret);
            // an OAuth-only definition with a plain key falls back to bearer
            case OAUTH_BEARER -> AuthStrategy.bearer(secret);
        };
    }

    public static Map<String, CustomProviderConfig> byId(List<CustomProviderConfig> customProviders) {
        var map = new LinkedHashMap<String, CustomProviderConfig>();
        if (customProviders == null) return map;
        for (var custom : customProviders) {
            if (custom != null && custom.id() != null) map.put(custom.id(), custom);
        }
        return map;
    }
}
