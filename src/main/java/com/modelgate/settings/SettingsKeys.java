package com.modelgate.settings;

/**
 * Key naming for provider settings.
 */
public final class SettingsKeys {

    private SettingsKeys() {}

    public static String apiKey(String providerId) {
        return "api_key_" + providerId;
    }

    public static String baseUrl(String providerId) {
        return "base_url_" + providerId;
    }

    /** Alt-billing flag; the key name predates the generic term. */
    public static String altBilling(String providerId) {
        return "use_coding_plan_" + providerId;
    }

    public static String international(String providerId) {
        return "use_international_" + providerId;
    }

    public static String oauthAccessToken(String providerId) {
        return "oauth_" + providerId + "_access_token";
    }

    public static String oauthRefreshToken(String providerId) {
        return "oauth_" + providerId + "_refresh_token";
    }

    /** Epoch milliseconds. */
    public static String oauthExpiresAt(String providerId) {
        return "oauth_" + providerId + "_expires_at";
    }

    public static String oauthAccountId(String providerId) {
        return "oauth_" + providerId + "_account_id";
    }
}
