package com.modelgate.settings;

import java.util.Collection;
import java.util.Map;

/**
 * Flat string key/value persistence for user settings.
 */
public interface SettingsStore {

    /** Returns the value, or null when the key is absent. */
    String get(String key);

    /** Stores a value. A null or blank value removes the key. */
    void set(String key, String value);

    /** Values for the given keys; absent keys are left out of the result. */
    Map<String, String> getBatch(Collection<String> keys);

    Map<String, String> getByPrefix(String prefix);
}
