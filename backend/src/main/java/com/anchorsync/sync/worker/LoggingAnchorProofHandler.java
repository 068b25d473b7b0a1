package com.anchorsync.sync.worker;

import com.anchorsync.domain.AnchorProof;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fallback handler used when the host application registers none: records each proof at debug level.
 */
@Slf4j
public class LoggingAnchorProofHandler implements AnchorProofHandler {

    @Override
    public void handle(AnchorProof proof, List<String> models) {
        log.debug("Anchor proof in block {} tx {} for {} model(s)", proof.blockNumber(), proof.transactionHash(), models.size());
    }
}
