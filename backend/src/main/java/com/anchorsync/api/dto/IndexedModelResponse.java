package com.anchorsync.api.dto;

public record IndexedModelResponse(String model, boolean syncComplete, int outstandingHistoricalSyncs) {
}
