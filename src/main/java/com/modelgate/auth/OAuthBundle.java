package com.modelgate.auth;

import java.time.Instant;

/**
 * Tokens obtained through an OAuth login. A null {@code expiresAt} means the
 * token carries no expiry.
 */
public record OAuthBundle(
    String accessToken,
    String refreshToken,
    Instant expiresAt,
    String accountId
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsable(Instant now) {
        return accessToken != null && !accessToken.isBlank() && !isExpired(now);
    }

    public boolean canRefresh() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
