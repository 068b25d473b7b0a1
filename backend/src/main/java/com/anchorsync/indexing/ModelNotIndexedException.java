package com.anchorsync.indexing;

public class ModelNotIndexedException extends RuntimeException {

    public ModelNotIndexedException(String model) {
        super("Model " + model + " is not indexed on this node");
    }
}
