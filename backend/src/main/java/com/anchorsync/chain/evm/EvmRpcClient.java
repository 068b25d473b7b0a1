package com.anchorsync.chain.evm;

import reactor.core.publisher.Mono;

/**
 * Single JSON-RPC call against one endpoint. Retries and rotation are handled by {@link EvmJsonRpcExecutor}.
 */
public interface EvmRpcClient {

    /**
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByNumber"
     * @param params      positional params
     * @return raw JSON response body; errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
