package com.modelgate.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.bridge.MessageBridge;
import com.modelgate.bridge.Subscription;
import com.modelgate.errors.StreamCancelledException;
import com.modelgate.errors.StreamProtocolException;
import com.modelgate.errors.StreamTransportException;
import com.modelgate.observability.StreamMetrics;
import com.modelgate.shared.config.StreamConfig;
import com.modelgate.shared.model.Mappers;
import com.modelgate.shared.model.StreamEvent;
import com.modelgate.shared.model.StreamRequest;
import com.modelgate.shared.model.StreamResponse;
import com.modelgate.shared.model.TextResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues streaming requests to the remote engine and exposes their events as
 * a blocking iterator.
 *
 * <p>Per request: subscribe to the request's channel, then invoke the stream
 * command, then check that the engine echoed the same request id. Teardown
 * (unsubscribe, close the queue, detach from the cancellation signal) runs
 * exactly once, on the terminal event, cancellation, or any failure.
 */
public class LlmStreamClient {

    private static final Logger log = LoggerFactory.getLogger(LlmStreamClient.class);
    private static final ObjectMapper MAPPER = Mappers.json();

    static final String CLIENT_START_KEY = "client_start_ms";

    private final MessageBridge bridge;
    private final StreamConfig config;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final RequestIds requestIds = new RequestIds();

    public LlmStreamClient(MessageBridge bridge, StreamConfig config, StreamMetrics metrics, Clock clock) {
        this.bridge = bridge;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CompletableFuture<StreamTextResult> streamText(StreamRequest request) {
        return streamText(request, new CancellationSignal());
    }

    /**
     * Starts a stream. The future fails with {@link StreamCancelledException}
     * when the signal fires before it completes, {@link StreamProtocolException}
     * on a request id mismatch, and {@link StreamTransportException} when the
     * subscription or the invocation fails.
     */
    public CompletableFuture<StreamTextResult> streamText(StreamRequest request, CancellationSignal signal) {
        var clientStartMs = clock.millis();
        String requestId;
        try {
            requestId = requestIds.acquire(request.requestId());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        var call = new StreamCall(requestId, clientStartMs);
        metrics.started();
        if (signal.isCancelled()) {
            log.info("[stream {}] Already aborted, stopping", requestId);
            call.abort();
            return call.result;
        }
        call.detachSignal = signal.onCancel(() -> {
            log.info("[stream {}] Abort signal received, stopping", requestId);
            call.abort();
        });

        var channel = config.channelFor(requestId);
        call.transition(StreamState.LISTENING);
        CompletableFuture<Subscription> subscribed;
        try {
            subscribed = bridge.subscribe(channel, call::onMessage);
        } catch (RuntimeException e) {
            subscribed = CompletableFuture.failedFuture(e);
        }
        subscribed.whenComplete((subscription, error) -> {
            if (error != null) {
                call.fail(new StreamTransportException("Failed to subscribe to " + channel, unwrap(error)));
                return;
            }
            if (!call.attach(subscription)) return;
            log.info("[stream {}] Listening on {}, invoking {}", requestId, channel, config.command());
            invoke(call, request, clientStartMs);
        });
        return call.result;
    }

    private void invoke(StreamCall call, StreamRequest request, long clientStartMs) {
        var trace = request.traceContext() != null
                ? request.traceContext().withMetadata(CLIENT_START_KEY, String.valueOf(clientStartMs))
                : null;
        var sent = request.withRequestId(call.requestId).withTraceContext(trace);
        var payload = MAPPER.createObjectNode();
        payload.set("request", MAPPER.valueToTree(sent));

        call.transition(StreamState.SENT);
        CompletableFuture<JsonNode> invoked;
        try {
            invoked = bridge.invoke(config.command(), payload);
        } catch (RuntimeException e) {
            invoked = CompletableFuture.failedFuture(e);
        }
        invoked.whenComplete((response, error) -> {
            if (error != null) {
                call.fail(new StreamTransportException(
                        "LLM stream invocation failed for request " + call.requestId, unwrap(error)));
                return;
            }
            String echoed;
            try {
                var ack = response != null ? MAPPER.treeToValue(response, StreamResponse.class) : null;
                echoed = ack != null ? ack.requestId() : null;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                call.fail(StreamProtocolException.malformedEvent(call.requestId, e));
                return;
            }
            if (!call.requestId.equals(echoed)) {
                call.fail(StreamProtocolException.requestIdMismatch(call.requestId, echoed));
                return;
            }
            call.result.complete(new StreamTextResult(call.requestId, call.events()));
        });
    }

    /**
     * Drains a stream, concatenating text deltas. Error events are logged, not
     * thrown.
     *
     * @throws com.modelgate.errors.GatewayException when the stream fails to start or breaks mid-way
     */
    public TextResult collectText(StreamRequest request, CancellationSignal signal) {
        StreamTextResult result;
        try {
            result = streamText(request, signal).join();
        } catch (CompletionException e) {
            throw propagate(e.getCause());
        }
        var text = new StringBuilder();
        String finishReason = null;
        var events = result.events();
        while (events.hasNext()) {
            var event = events.next();
            if (event instanceof StreamEvent.TextDelta delta && delta.text() != null) {
                text.append(delta.text());
            } else if (event instanceof StreamEvent.Done done) {
                finishReason = done.finishReason();
            } else if (event instanceof StreamEvent.Error error) {
                log.error("[stream {}] Error event received: {}", result.requestId(), error.message());
            }
        }
        return new TextResult(text.toString(), finishReason);
    }

    public TextResult collectText(StreamRequest request) {
        return collectText(request, new CancellationSignal());
    }

    /** Ids of streams that have not been torn down yet. */
    public int liveRequests() {
        return requestIds.liveCount();
    }

    private static RuntimeException propagate(Throwable error) {
        return error instanceof RuntimeException re
                ? re
                : new StreamTransportException("LLM stream failed", error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /** State of one in-flight request. */
    private final class StreamCall {

        final String requestId;
        final long startedAtMs;
        final EventQueue<StreamEvent> queue = new EventQueue<>(config.compactionThreshold());
        final CompletableFuture<StreamTextResult> result = new CompletableFuture<>();
        final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.CREATED);
        final AtomicBoolean tornDown = new AtomicBoolean();
        volatile Runnable detachSignal;
        private Subscription subscription;

        StreamCall(String requestId, long startedAtMs) {
            this.requestId = requestId;
            this.startedAtMs = startedAtMs;
        }

        void transition(StreamState next) {
            var previous = state.getAndUpdate(s -> s.isFinal() ? s : next);
            if (!previous.isFinal()) log.debug("[stream {}] {} -> {}", requestId, previous, next);
        }

        /** @return false when teardown already ran; the subscription is then released here */
        boolean attach(Subscription sub) {
            synchronized (this) {
                if (!tornDown.get()) {
                    subscription = sub;
                    return true;
                }
            }
            release(sub);
            return false;
        }

        /** Iterates the queue; an interrupted consumer aborts the stream. */
        Iterator<StreamEvent> events() {
            var delegate = queue.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    try {
                        return delegate.hasNext();
                    } catch (CancellationException e) {
                        throw interrupted();
                    }
                }

                @Override
                public StreamEvent next() {
                    try {
                        return delegate.next();
                    } catch (CancellationException e) {
                        throw interrupted();
                    }
                }
            };
        }

        private StreamCancelledException interrupted() {
            log.info("[stream {}] Consumer interrupted, stopping", requestId);
            abort();
            return new StreamCancelledException(requestId);
        }

        void onMessage(JsonNode message) {
            if (tornDown.get()) {
                log.debug("[stream {}] Ignoring event after teardown", requestId);
                return;
            }
            StreamEvent event;
            try {
                event = StreamEvents.parse(requestId, message);
            } catch (StreamProtocolException e) {
                log.error("[stream {}] {}", requestId, e.getMessage());
                fail(e);
                return;
            }
            if (state.get() == StreamState.SENT) transition(StreamState.STREAMING);
            StreamEvents.log(log, requestId, event);
            queue.push(event);
            if (event.isTerminal()) {
                log.info("[stream {}] Terminal event received", requestId);
                teardown(event instanceof StreamEvent.Done ? StreamState.DONE : StreamState.ERROR, null);
            }
        }

        void abort() {
            var cancelled = new StreamCancelledException(requestId);
            teardown(StreamState.ABORTED, cancelled);
            result.completeExceptionally(cancelled);
        }

        void fail(RuntimeException error) {
            teardown(StreamState.ERROR, error);
            result.completeExceptionally(error);
        }

        /** Runs once; later calls return immediately. */
        void teardown(StreamState finalState, RuntimeException queueFailure) {
            if (!tornDown.compareAndSet(false, true)) return;
            var previous = state.getAndSet(finalState);
            log.info("[stream {}] Stopping stream ({} -> {})", requestId, previous, finalState);

            Subscription sub;
            synchronized (this) {
                sub = subscription;
                subscription = null;
            }
            if (sub != null) release(sub);
            var detach = detachSignal;
            if (detach != null) {
                try {
                    detach.run();
                } catch (RuntimeException e) {
                    log.warn("[stream {}] Failed to detach cancellation listener: {}", requestId, e.getMessage());
                }
            }

            if (queueFailure != null) {
                queue.fail(queueFailure);
            } else {
                queue.finish();
            }
            requestIds.release(requestId);

            var elapsed = Duration.ofMillis(Math.max(0, clock.millis() - startedAtMs));
            switch (finalState) {
                case DONE -> metrics.completed(elapsed);
                case ABORTED -> metrics.cancelled(elapsed);
                default -> metrics.failed(elapsed);
            }
        }

        private void release(Subscription sub) {
            try {
                sub.unsubscribe();
            } catch (RuntimeException e) {
                log.warn("[stream {}] Unsubscribe failed: {}", requestId, e.getMessage());
            }
        }
    }
}
