package com.modelgate.errors;

public class StreamCancelledException extends GatewayException {

    private final String requestId;

    public StreamCancelledException(String requestId) {
        super("STREAM_CANCELLED", "LLM request aborted: " + requestId);
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
