package com.modelgate.stream;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request ids currently bound to a live stream. An id is live from
 * {@link #acquire} until {@link #release}.
 */
public class RequestIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Set<String> live = ConcurrentHashMap.newKeySet();

    /** 16 URL-safe characters. */
    public static String generate() {
        var bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Marks an id live. A null {@code requested} draws a fresh id.
     *
     * @throws IllegalArgumentException when the requested id is already live
     */
    public String acquire(String requested) {
        if (requested != null) {
            if (requested.isBlank()) throw new IllegalArgumentException("Request id must not be blank");
            if (!live.add(requested)) {
                throw new IllegalArgumentException("Request id already in use: " + requested);
            }
            return requested;
        }
        String id;
        do {
            id = generate();
        } while (!live.add(id));
        return id;
    }

    public void release(String requestId) {
        live.remove(requestId);
    }

    public boolean isLive(String requestId) {
        return live.contains(requestId);
    }

    public int liveCount() {
        return live.size();
    }
}
