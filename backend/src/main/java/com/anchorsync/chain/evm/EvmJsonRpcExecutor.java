package com.anchorsync.chain.evm;

import com.anchorsync.chain.RpcEndpointRotator;
import com.anchorsync.chain.RpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a JSON-RPC call against the rotated endpoints under the shared rate limiter, retrying with backoff,
 * and returns the {@code result} node. JSON-RPC {@code error} responses count as failed attempts.
 */
@Slf4j
public class EvmJsonRpcExecutor {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public EvmJsonRpcExecutor(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                              ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    public JsonNode call(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry of " + method, e);
                }
            }
            String endpoint = rotator.nextEndpoint();
            try {
                return parseResult(method, callOnce(endpoint, method, params));
            } catch (RpcException e) {
                lastException = e;
                log.warn("{} failed on {} (attempt {}/{}): {}", method, endpoint, attempt + 1,
                        rotator.getMaxAttempts(), e.getMessage());
            }
        }
        String msg = method + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    private String callOnce(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String body = rpcClient.call(endpoint, method, params).block();
        if (body == null) {
            throw new RpcException(method + " returned empty body");
        }
        return body;
    }

    private JsonNode parseResult(String method, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    /** Parses a 0x-prefixed hex quantity. */
    public static long parseQuantity(String method, String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new RpcException(method + " invalid quantity: " + hex);
        }
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException(method + " invalid quantity: " + hex, e);
        }
    }

    public static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }
}
