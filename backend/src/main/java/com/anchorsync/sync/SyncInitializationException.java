package com.anchorsync.sync;

/**
 * Thrown when the sync engine cannot establish its reference tip at startup.
 */
public class SyncInitializationException extends RuntimeException {

    public SyncInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
