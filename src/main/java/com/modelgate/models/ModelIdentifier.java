package com.modelgate.models;

/**
 * A model key, optionally pinned to a provider as {@code model@providerId}.
 * The split happens at the last {@code @}, so model keys may contain one.
 */
public record ModelIdentifier(String modelKey, String providerId) {

    public static ModelIdentifier parse(String identifier) {
        if (identifier == null) throw new IllegalArgumentException("Model identifier is required");
        var at = identifier.lastIndexOf('@');
        if (at <= 0 || at == identifier.length() - 1) return new ModelIdentifier(identifier, null);
        return new ModelIdentifier(identifier.substring(0, at), identifier.substring(at + 1));
    }

    public static String format(String modelKey, String providerId) {
        return providerId == null ? modelKey : modelKey + "@" + providerId;
    }

    public boolean hasProvider() {
        return providerId != null;
    }
}
