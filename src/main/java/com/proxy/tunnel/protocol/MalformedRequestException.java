package com.proxy.tunnel.protocol;

import java.io.IOException;

/**
 * The bytes received are not a request head this proxy can handle.
 */
public class MalformedRequestException extends IOException {

    private static final long serialVersionUID = 1L;

    public MalformedRequestException(String message) {
        super(message);
    }
}
