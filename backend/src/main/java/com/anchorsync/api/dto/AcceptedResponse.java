package com.anchorsync.api.dto;

/**
 * 202 body for admin requests whose work continues asynchronously. {@code jobId} is set for queued rebuilds.
 */
public record AcceptedResponse(String message, String jobId) {

    public static AcceptedResponse of(String message) {
        return new AcceptedResponse(message, null);
    }
}
