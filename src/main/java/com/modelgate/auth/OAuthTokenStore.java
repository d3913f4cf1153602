package com.modelgate.auth;

/**
 * Per-provider source of OAuth tokens.
 */
public interface OAuthTokenStore {

    String providerId();

    /** Returns the stored bundle, or null when the provider is not connected. */
    OAuthBundle currentToken();

    /** Exchanges the stored refresh token for a new bundle and persists it. */
    OAuthBundle refresh();
}
