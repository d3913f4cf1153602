package com.modelgate.bridge;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Message-passing boundary to the out-of-process engine. Commands are
 * request/response; channels carry ordered event streams.
 */
public interface MessageBridge {

    /** Invokes a remote command. The future fails when the engine rejects it. */
    CompletableFuture<JsonNode> invoke(String command, JsonNode payload);

    /**
     * Registers a listener on a channel. Messages on one channel reach the
     * listener in emission order, never concurrently.
     */
    CompletableFuture<Subscription> subscribe(String channel, Consumer<JsonNode> listener);
}
