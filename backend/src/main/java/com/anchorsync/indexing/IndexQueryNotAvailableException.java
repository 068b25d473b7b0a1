package com.anchorsync.indexing;

/**
 * Thrown when a model is indexed but its historical sync has not finished, so its data is not yet authoritative.
 */
public class IndexQueryNotAvailableException extends RuntimeException {

    private final String model;

    public IndexQueryNotAvailableException(String model) {
        super("Index for model " + model + " is not available for queries until its historical sync completes");
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
