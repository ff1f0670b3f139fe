package com.proxy.tunnel.exception;

/**
 * Writing the CONNECT response onto the hijacked connection failed.
 */
public class TunnelResponseException extends TunnelException {

    private static final long serialVersionUID = 1L;

    public TunnelResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
