package com.modelgate.errors;

/**
 * Base of every failure the gateway raises on purpose.
 * The code is stable and meant for callers that branch on the failure kind.
 */
public class GatewayException extends RuntimeException {

    private final String code;

    public GatewayException(String code, String message) {
        super(message);
        this.code = code;
    }

    public GatewayException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
