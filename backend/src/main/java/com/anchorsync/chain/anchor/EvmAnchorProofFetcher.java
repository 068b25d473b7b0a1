package com.anchorsync.chain.anchor;

import com.anchorsync.chain.RpcException;
import com.anchorsync.chain.evm.EvmJsonRpcExecutor;
import com.anchorsync.domain.AnchorProof;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads anchor commitments as eth_getLogs entries of the anchor contract. Logs flagged {@code removed} belong to an
 * orphaned block and are skipped.
 */
public class EvmAnchorProofFetcher implements AnchorProofFetcher {

    private static final String METHOD = "eth_getLogs";

    private final EvmJsonRpcExecutor executor;
    private final String contractAddress;
    private final String eventTopic;

    public EvmAnchorProofFetcher(EvmJsonRpcExecutor executor, String contractAddress, String eventTopic) {
        this.executor = executor;
        this.contractAddress = contractAddress;
        this.eventTopic = eventTopic;
    }

    @Override
    public List<AnchorProof> fetch(long fromBlock, long toBlock) {
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalStateException("anchorsync.chain.anchor-contract-address is not configured");
        }
        if (fromBlock > toBlock) {
            return List.of();
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("fromBlock", EvmJsonRpcExecutor.toQuantity(fromBlock));
        filter.put("toBlock", EvmJsonRpcExecutor.toQuantity(toBlock));
        filter.put("address", contractAddress);
        if (eventTopic != null && !eventTopic.isBlank()) {
            filter.put("topics", List.of(eventTopic));
        }
        JsonNode logs = executor.call(METHOD, List.of(filter));
        if (!logs.isArray()) {
            throw new RpcException(METHOD + " returned non-array result");
        }
        List<AnchorProof> proofs = new ArrayList<>();
        for (JsonNode entry : logs) {
            if (entry.path("removed").asBoolean(false)) {
                continue;
            }
            proofs.add(new AnchorProof(
                    EvmJsonRpcExecutor.parseQuantity(METHOD, entry.path("blockNumber").asText(null)),
                    entry.path("blockHash").asText(null),
                    entry.path("transactionHash").asText(null),
                    entry.path("data").asText(null)));
        }
        return proofs;
    }
}
