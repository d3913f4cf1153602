package com.modelgate.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-owned cancellation flag. Listeners run once, on the thread that
 * first calls {@link #cancel()}.
 */
public final class CancellationSignal {

    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /** Idempotent. Every listener runs even if an earlier one throws. */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        RuntimeException failure = null;
        for (var listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
    }

    /**
     * Registers a listener. When already cancelled it runs immediately.
     *
     * @return removes the listener; safe to call more than once
     */
    public Runnable onCancel(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {};
    }

    public synchronized int listenerCount() {
        return listeners.size();
    }
}
