package com.proxy.tunnel.exception;

/**
 * Base type for failures of a single CONNECT tunnel. Tunnels are one-shot: none of these
 * are retried.
 */
public class TunnelException extends Exception {

    private static final long serialVersionUID = 1L;

    public TunnelException(String message) {
        super(message);
    }

    public TunnelException(String message, Throwable cause) {
        super(message, cause);
    }
}
