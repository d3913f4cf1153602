package com.modelgate.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Turns pushed values into a blocking, single-pass {@link Iterator}.
 *
 * <p>A push that finds the consumer already waiting on an empty buffer is
 * handed over directly. Otherwise values are buffered; once the consumer has
 * drained the whole buffer past {@code compactionThreshold} entries the
 * consumed prefix is dropped. Values always come out in push order.
 *
 * <p>After {@link #finish()} the remaining values are still delivered before
 * the iterator ends. After {@link #fail(RuntimeException)} they are delivered
 * and then the failure is thrown from {@code hasNext()}.
 *
 * <p>A consumer interrupted while waiting gets a {@link CancellationException}
 * with its interrupt flag restored.
 */
public class EventQueue<T> {

    private final int compactionThreshold;
    private final List<T> buffer = new ArrayList<>();
    private int readIndex;
    private T handoff;
    private boolean consumerWaiting;
    private boolean done;
    private RuntimeException failure;
    private boolean iterated;

    public EventQueue() {
        this(1024);
    }

    public EventQueue(int compactionThreshold) {
        if (compactionThreshold < 1) throw new IllegalArgumentException("compactionThreshold must be positive");
        this.compactionThreshold = compactionThreshold;
    }

    /** Ignored once the queue is finished or failed. */
    public synchronized void push(T value) {
        Objects.requireNonNull(value, "value");
        if (done) return;
        if (consumerWaiting && handoff == null && readIndex == buffer.size()) {
            handoff = value;
        } else {
            buffer.add(value);
        }
        notifyAll();
    }

    public synchronized void finish() {
        if (done) return;
        done = true;
        notifyAll();
    }

    public synchronized void fail(RuntimeException error) {
        if (done) return;
        done = true;
        failure = error;
        notifyAll();
    }

    public synchronized boolean isDone() {
        return done;
    }

    /** Values pushed but not yet consumed. */
    public synchronized int pending() {
        return buffer.size() - readIndex + (handoff != null ? 1 : 0);
    }

    synchronized int bufferSize() {
        return buffer.size();
    }

    /**
     * @throws IllegalStateException on a second call
     */
    public synchronized Iterator<T> iterator() {
        if (iterated) throw new IllegalStateException("EventQueue can only be iterated once");
        iterated = true;
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return awaitNext();
            }

            @Override
            public T next() {
                return take();
            }
        };
    }

    private synchronized boolean awaitNext() {
        while (true) {
            if (handoff != null || readIndex < buffer.size()) return true;
            if (done) {
                if (failure != null) throw failure;
                return false;
            }
            consumerWaiting = true;
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for the next event");
            } finally {
                consumerWaiting = false;
            }
        }
    }

    private synchronized T take() {
        if (!awaitNext()) throw new NoSuchElementException();
        if (handoff != null) {
            var value = handoff;
            handoff = null;
            return value;
        }
        var value = buffer.get(readIndex);
        buffer.set(readIndex, null);
        readIndex++;
        if (readIndex > compactionThreshold && readIndex == buffer.size()) {
            buffer.clear();
            readIndex = 0;
        }
        return value;
    }
}
