package com.anchorsync.indexing;

/**
 * Readiness of a model's historical sync, as seen by the index layer.
 */
public interface SyncQueryApi {

    /**
     * @return true when no historical sync job covering the model is outstanding
     */
    boolean syncComplete(String model);
}
