package com.modelgate.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.bridge.MessageBridge;
import com.modelgate.errors.GatewayException;
import com.modelgate.settings.SettingsKeys;
import com.modelgate.settings.SettingsStore;
import com.modelgate.shared.model.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * OAuth tokens kept in the settings store and refreshed by a command on the
 * remote engine, which owns the provider's token endpoint.
 */
public class BridgeOAuthTokenStore implements OAuthTokenStore {

    private static final Logger log = LoggerFactory.getLogger(BridgeOAuthTokenStore.class);
    private static final ObjectMapper MAPPER = Mappers.json();

    private final String providerId;
    private final SettingsStore settings;
    private final MessageBridge bridge;
    private final String refreshCommand;
    private final Clock clock;

    public BridgeOAuthTokenStore(String providerId, SettingsStore settings, MessageBridge bridge,
                                 String refreshCommand, Clock clock) {
        this.providerId = providerId;
        this.settings = settings;
        this.bridge = bridge;
        this.refreshCommand = refreshCommand;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public OAuthBundle currentToken() {
        var values = settings.getBatch(List.of(
                SettingsKeys.oauthAccessToken(providerId),
                SettingsKeys.oauthRefreshToken(providerId),
                SettingsKeys.oauthExpiresAt(providerId),
                SettingsKeys.oauthAccountId(providerId)));
        var accessToken = values.get(SettingsKeys.oauthAccessToken(providerId));
        if (accessToken == null || accessToken.isBlank()) return null;
        return new OAuthBundle(
                accessToken,
                values.get(SettingsKeys.oauthRefreshToken(providerId)),
                parseEpochMillis(values.get(SettingsKeys.oauthExpiresAt(providerId))),
                values.get(SettingsKeys.oauthAccountId(providerId)));
    }

    /**
     * Blocks until the engine answers. The command receives
     * {@code {"request": {"refreshToken": ...}}} and answers with
     * {@code accessToken}, {@code refreshToken}, {@code expiresAt} (epoch
     * millis) and optionally {@code accountId}. A missing refresh token in the
     * answer keeps the current one.
     */
    @Override
    public synchronized OAuthBundle refresh() {
        var current = currentToken();
        if (current == null || !current.canRefresh()) {
            throw new GatewayException("OAUTH_REFRESH_UNAVAILABLE",
                    "No refresh token stored for provider " + providerId);
        }
        var payload = MAPPER.createObjectNode();
        payload.putObject("request").put("refreshToken", current.refreshToken());
        JsonNode response;
        try {
            response = bridge.invoke(refreshCommand, payload).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("OAUTH_REFRESH_FAILED", "Interrupted refreshing OAuth token for " + providerId, e);
        } catch (ExecutionException e) {
            throw new GatewayException("OAUTH_REFRESH_FAILED",
                    "OAuth refresh failed for " + providerId + ": " + e.getCause().getMessage(), e.getCause());
        }

        var accessToken = response != null ? response.path("accessToken").asText(null) : null;
        if (accessToken == null || accessToken.isBlank()) {
            throw new GatewayException("OAUTH_REFRESH_FAILED",
                    "OAuth refresh for " + providerId + " returned no access token");
        }
        var refreshed = new OAuthBundle(
                accessToken,
                response.hasNonNull("refreshToken") ? response.get("refreshToken").asText() : current.refreshToken(),
                expiry(response),
                response.hasNonNull("accountId") ? response.get("accountId").asText() : current.accountId());
        save(refreshed);
        log.info("Refreshed OAuth token for {}", providerId);
        return refreshed;
    }

    public void save(OAuthBundle bundle) {
        settings.set(SettingsKeys.oauthAccessToken(providerId), bundle.accessToken());
        settings.set(SettingsKeys.oauthRefreshToken(providerId), bundle.refreshToken());
        settings.set(SettingsKeys.oauthExpiresAt(providerId),
                bundle.expiresAt() != null ? String.valueOf(bundle.expiresAt().toEpochMilli()) : null);
        settings.set(SettingsKeys.oauthAccountId(providerId), bundle.accountId());
    }

    private Instant expiry(JsonNode response) {
        if (response.hasNonNull("expiresAt")) return Instant.ofEpochMilli(response.get("expiresAt").asLong());
        if (response.hasNonNull("expiresIn")) return clock.instant().plusSeconds(response.get("expiresIn").asLong());
        return null;
    }

    private Instant parseEpochMillis(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Malformed OAuth expiry for {}, treating the token as expired: {}", providerId, value);
            return Instant.EPOCH;
        }
    }
}
