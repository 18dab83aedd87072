package com.voicemaster.sync.core.store;

/**
 * Raised by store implementations when the durable layer cannot complete an operation
 * (connection loss, timeout, constraint violation).
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
