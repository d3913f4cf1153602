package com.modelgate.providers;

import com.modelgate.auth.OAuthBundle;
import com.modelgate.auth.OAuthTokenStore;
import com.modelgate.errors.GatewayException;

import java.time.Instant;
import java.util.Map;

/**
 * How a provider request is authenticated. One instance per resolved
 * provider; header construction is a single switch over {@link AuthType}.
 */
public final class AuthStrategy {

    private final AuthType type;
    private final String secret;
    private final OAuthTokenStore tokenStore;
    private volatile OAuthBundle token;

    private AuthStrategy(AuthType type, String secret, OAuthTokenStore tokenStore, OAuthBundle token) {
        this.type = type;
        this.secret = secret;
        this.tokenStore = tokenStore;
        this.token = token;
    }

    public static AuthStrategy none() {
        return new AuthStrategy(AuthType.NONE, null, null, null);
    }

    public static AuthStrategy bearer(String secret) {
        return new AuthStrategy(AuthType.BEARER, secret, null, null);
    }

    public static AuthStrategy apiKey(String secret) {
        return new AuthStrategy(AuthType.API_KEY, secret, null, null);
    }

    /**
     * @param tokenStore may be null, in which case an expired token cannot be refreshed
     */
    public static AuthStrategy oauth(OAuthBundle token, OAuthTokenStore tokenStore) {
        return new AuthStrategy(AuthType.OAUTH_BEARER, null, tokenStore, token);
    }

    public AuthType type() {
        return type;
    }

    /** Headers carrying the credential. Refreshes an expired OAuth token first. */
    public Map<String, String> headers(Instant now) {
        return switch (type) {
            case NONE -> Map.of();
            case BEARER -> Map.of("Authorization", "Bearer " + secret);
            case API_KEY -> Map.of("x-api-key", secret);
            case OAUTH_BEARER -> Map.of("Authorization", "Bearer " + usableToken(now).accessToken());
        };
    }

    private OAuthBundle usableToken(Instant now) {
        var current = token;
        if (current != null && current.isUsable(now)) return current;
        if (tokenStore != null && current != null && current.canRefresh()) {
            var refreshed = tokenStore.refresh();
            if (refreshed != null && refreshed.isUsable(now)) {
                token = refreshed;
                return refreshed;
            }
        }
        throw new GatewayException("OAUTH_TOKEN_EXPIRED",
                "OAuth token expired and could not be refreshed"
                        + (tokenStore != null ? " for provider " + tokenStore.providerId() : ""));
    }

    @Override
    public String toString() {
        return "AuthStrategy[" + type + "]";
    }
}
