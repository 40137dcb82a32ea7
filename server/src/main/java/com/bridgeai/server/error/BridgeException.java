package com.bridgeai.server.error;

/**
 * Failure raised by the bridge core. The {@link ErrorCode} tells callers whether
 * the condition is recoverable (capacity, not-found) or not.
 */
public class BridgeException extends RuntimeException {

    private final ErrorCode code;

    public BridgeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BridgeException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static BridgeException notInitialized(String component) {
        return new BridgeException(ErrorCode.NOT_INITIALIZED, component + " is not initialized");
    }

    @Override
    public String toString() {
        return "BridgeException{code=" + code + ", message='" + getMessage() + "'}";
    }
}
