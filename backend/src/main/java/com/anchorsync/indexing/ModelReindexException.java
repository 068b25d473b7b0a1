package com.anchorsync.indexing;

/**
 * Thrown when indexing is requested for a model that was indexed before and then stopped: its data may have
 * missed updates in between.
 */
public class ModelReindexException extends RuntimeException {

    public ModelReindexException(String model) {
        super("Cannot re-index model " + model + ", data may not be up-to-date");
    }
}
