package com.modelgate.providers;

public enum AuthType {
    /** Local providers; no credential travels with the request. */
    NONE,
    /** {@code Authorization: Bearer <key>}. */
    BEARER,
    /** {@code x-api-key: <key>}. */
    API_KEY,
    /** Bearer token obtained through OAuth, refreshed when expired. */
    OAUTH_BEARER
}
