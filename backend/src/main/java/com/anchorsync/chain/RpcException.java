package com.anchorsync.chain;

/**
 * Thrown when a chain RPC call fails (HTTP, JSON-RPC error or malformed result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
