package com.anchorsync.chain.evm;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.NetworkInfo;
import com.anchorsync.chain.RpcException;
import com.anchorsync.config.CaffeineConfig;
import com.anchorsync.domain.BlockHeader;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;

import java.util.List;

/**
 * {@link ChainProvider} over EVM JSON-RPC. Lookups by hash are immutable and cached.
 */
@RequiredArgsConstructor
public class EvmChainProvider implements ChainProvider {

    private final EvmJsonRpcExecutor executor;

    @Override
    public BlockHeader getBlock(long offsetFromHead) {
        if (offsetFromHead > 0) {
            throw new IllegalArgumentException("Offset from head must not be positive: " + offsetFromHead);
        }
        long head = getBlockNumber();
        return getBlockByNumber(Math.max(0, head + offsetFromHead));
    }

    @Override
    public BlockHeader getBlockByNumber(long number) {
        JsonNode block = executor.call("eth_getBlockByNumber", List.of(EvmJsonRpcExecutor.toQuantity(number), false));
        return toHeader("eth_getBlockByNumber", block);
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.BLOCK_BY_HASH_CACHE, key = "#hash")
    public BlockHeader getBlockByHash(String hash) {
        JsonNode block = executor.call("eth_getBlockByHash", List.of(hash, false));
        return toHeader("eth_getBlockByHash", block);
    }

    @Override
    public long getBlockNumber() {
        JsonNode result = executor.call("eth_blockNumber", List.of());
        return EvmJsonRpcExecutor.parseQuantity("eth_blockNumber", result.asText(null));
    }

    @Override
    public NetworkInfo getNetwork() {
        JsonNode result = executor.call("eth_chainId", List.of());
        return new NetworkInfo(EvmJsonRpcExecutor.parseQuantity("eth_chainId", result.asText(null)));
    }

    private static BlockHeader toHeader(String method, JsonNode block) {
        if (block == null || block.isMissingNode() || block.isNull()) {
            throw new RpcException(method + " returned no block");
        }
        long number = EvmJsonRpcExecutor.parseQuantity(method, block.path("number").asText(null));
        String hash = block.path("hash").asText(null);
        String parentHash = block.path("parentHash").asText(null);
        if (hash == null) {
            throw new RpcException(method + " returned block without hash");
        }
        return new BlockHeader(number, hash, parentHash);
    }
}
