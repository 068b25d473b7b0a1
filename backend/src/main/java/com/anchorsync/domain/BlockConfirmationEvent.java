package com.anchorsync.domain;

/**
 * A block that reached the configured confirmation depth. When {@code reorganized} is set the chain was rewritten
 * below this block and {@code expectedParentHash} carries the new canonical parent hash.
 */
public record BlockConfirmationEvent(BlockHeader block, boolean reorganized, String expectedParentHash) {

    public static BlockConfirmationEvent confirmed(BlockHeader block) {
        return new BlockConfirmationEvent(block, false, null);
    }

    public static BlockConfirmationEvent reorganized(BlockHeader block, String expectedParentHash) {
        return new BlockConfirmationEvent(block, true, expectedParentHash);
    }
}
