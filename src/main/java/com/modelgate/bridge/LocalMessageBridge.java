package com.modelgate.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-process {@link MessageBridge}. Commands are served by registered
 * handlers and {@link #emit} fans a message out to the channel's listeners on
 * the calling thread.
 */
public class LocalMessageBridge implements MessageBridge {

    private static final Logger log = LoggerFactory.getLogger(LocalMessageBridge.class);

    private final Map<String, Function<JsonNode, CompletableFuture<JsonNode>>> commands = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<JsonNode>>> listeners = new ConcurrentHashMap<>();

    public void registerCommand(String command, Function<JsonNode, CompletableFuture<JsonNode>> handler) {
        commands.put(command, handler);
    }

    @Override
    public CompletableFuture<JsonNode> invoke(String command, JsonNode payload) {
        var handler = commands.get(command);
        if (handler == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Unknown command: " + command));
        }
        try {
            return handler.apply(payload);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Subscription> subscribe(String channel, Consumer<JsonNode> listener) {
        synchronized (this) {
            listeners.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(listener);
        }
        var active = new AtomicBoolean(true);
        return CompletableFuture.completedFuture(() -> {
            if (active.compareAndSet(true, false)) {
                synchronized (this) {
                    listeners.computeIfPresent(channel, (k, v) -> {
                        v.remove(listener);
                        return v.isEmpty() ? null : v;
                    });
                }
            }
        });
    }

    /** Delivers a message to the channel's current listeners. */
    public synchronized void emit(String channel, JsonNode message) {
        var channelListeners = listeners.get(channel);
        if (channelListeners == null || channelListeners.isEmpty()) {
            log.debug("Dropping message on {}: no listener", channel);
            return;
        }
        for (var listener : channelListeners) {
            listener.accept(message);
        }
    }

    public int listenerCount(String channel) {
        var channelListeners = listeners.get(channel);
        return channelListeners == null ? 0 : channelListeners.size();
    }

    public int totalListenerCount() {
        return listeners.values().stream().mapToInt(List::size).sum();
    }
}
