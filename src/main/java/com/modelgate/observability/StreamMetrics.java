package com.modelgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class StreamMetrics {

    private final MeterRegistry registry;
    private final Counter started;
    private final Counter completed;
    private final Counter failed;
    private final Counter cancelled;
    private final Timer duration;

    public StreamMetrics() {
        this(new SimpleMeterRegistry());
    }

    public StreamMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.started = Counter.builder("modelgate.stream.started").register(registry);
        this.completed = Counter.builder("modelgate.stream.completed").register(registry);
        this.failed = Counter.builder("modelgate.stream.failed").register(registry);
        this.cancelled = Counter.builder("modelgate.stream.cancelled").register(registry);
        this.duration = Timer.builder("modelgate.stream.duration").register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public void started() {
        started.increment();
    }

    public void completed(Duration elapsed) {
        completed.increment();
        duration.record(elapsed);
    }

    public void failed(Duration elapsed) {
        failed.increment();
        duration.record(elapsed);
    }

    public void cancelled(Duration elapsed) {
        cancelled.increment();
        duration.record(elapsed);
    }
}
