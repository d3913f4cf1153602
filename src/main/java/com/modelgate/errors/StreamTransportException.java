package com.modelgate.errors;

/**
 * The remote invocation was rejected or the event channel could not be opened.
 * Retrying is left to the caller.
 */
public class StreamTransportException extends GatewayException {

    public StreamTransportException(String message, Throwable cause) {
        super("STREAM_TRANSPORT", message, cause);
    }
}
