package com.modelgate.errors;

public class StreamProtocolException extends GatewayException {

    public StreamProtocolException(String message) {
        super("STREAM_PROTOCOL", message);
    }

    public StreamProtocolException(String message, Throwable cause) {
        super("STREAM_PROTOCOL", message, cause);
    }

    public static StreamProtocolException requestIdMismatch(String expected, String actual) {
        return new StreamProtocolException(
                "LLM stream requestId mismatch: expected " + expected + ", got " + actual);
    }

    public static StreamProtocolException malformedEvent(String requestId, Throwable cause) {
        return new StreamProtocolException(
                "Malformed stream event for request " + requestId + ": " + cause.getMessage(), cause);
    }
}
