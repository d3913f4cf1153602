package com.modelgate.bridge;

/** Handle for one channel listener. */
@FunctionalInterface
public interface Subscription {

    /** Detaches the listener. Calling it again has no effect. */
    void unsubscribe();
}
