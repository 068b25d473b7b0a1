package com.anchorsync.domain;

/**
 * Minimal block identity used for sync progress and reorg detection.
 */
public record BlockHeader(long number, String hash, String parentHash) {
}
