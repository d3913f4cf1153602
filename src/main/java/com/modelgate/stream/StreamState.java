package com.modelgate.stream;

/**
 * Lifecycle of one streaming request. DONE, ERROR and ABORTED are final.
 */
public enum StreamState {
    CREATED,
    LISTENING,
    SENT,
    STREAMING,
    DONE,
    ERROR,
    ABORTED;

    public boolean isFinal() {
        return this == DONE || this == ERROR || this == ABORTED;
    }
}
