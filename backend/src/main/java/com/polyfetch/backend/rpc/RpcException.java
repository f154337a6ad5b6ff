package com.polyfetch.backend.rpc;

import com.polyfetch.common.TransportException;

/**
 * Thrown when an RPC call fails (HTTP, connection or JSON-RPC error other than an unknown account).
 */
public class RpcException extends TransportException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
