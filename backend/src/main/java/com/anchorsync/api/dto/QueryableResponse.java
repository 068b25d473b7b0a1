package com.anchorsync.api.dto;

public record QueryableResponse(String model, boolean queryable) {
}
