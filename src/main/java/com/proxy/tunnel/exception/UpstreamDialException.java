package com.proxy.tunnel.exception;

import com.proxy.tunnel.protocol.Redaction;
import lombok.Getter;

import java.net.SocketTimeoutException;

/**
 * Thrown when the upstream destination of a tunnel cannot be reached.
 *
 * <p>
 * The message keeps the underlying network failure as hidden detail (see {@link Redaction}),
 * so it can be logged in full while {@link #getPublicMessage()} is safe to send to the client
 * in a {@code 502 Bad Gateway} body.
 */
@Getter
public class UpstreamDialException extends TunnelException {

    private static final long serialVersionUID = 1L;

    private final String address;

    public UpstreamDialException(String address, Throwable cause) {
        super(describe(address, cause) + Redaction.hide(": " + cause), cause);
        this.address = address;
    }

    /**
     * The message with all hidden diagnostic detail removed.
     */
    public String getPublicMessage() {
        return Redaction.clean(getMessage());
    }

    private static String describe(String address, Throwable cause) {
        if (cause instanceof SocketTimeoutException) {
            return "Timed out connecting to " + address;
        }
        return "Unable to reach " + address;
    }
}
