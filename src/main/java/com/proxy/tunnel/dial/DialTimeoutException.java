package com.proxy.tunnel.dial;

import java.net.SocketTimeoutException;

/**
 * The dial did not complete before its context expired or was cancelled.
 */
public class DialTimeoutException extends SocketTimeoutException {

    private static final long serialVersionUID = 1L;

    public DialTimeoutException(String message) {
        super(message);
    }
}
