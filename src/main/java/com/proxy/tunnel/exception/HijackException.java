package com.proxy.tunnel.exception;

/**
 * Thrown when the raw connection cannot be taken over from the response, either because it
 * was already hijacked or because the normal response path already committed it.
 */
public class HijackException extends TunnelException {

    private static final long serialVersionUID = 1L;

    public HijackException(String message) {
        super(message);
    }
}
