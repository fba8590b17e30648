package com.ttp.trust.api;

/**
 * The storage layer behind a {@link GraphAccessPort} failed. The failure is
 * retryable. The engine does not retry and hands it to the caller.
 */
public class PortUnavailableException extends RuntimeException {

    public PortUnavailableException(String message) {
        super(message);
    }

    public PortUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return true;
    }
}
