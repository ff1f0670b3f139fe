package com.proxy.tunnel.protocol;

import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.exception.HijackException;
import org.springframework.util.MultiValueMap;

/**
 * The server side of an HTTP exchange that can hand over its raw connection.
 */
public interface TunnelResponse {

    /**
     * Headers to include in whatever response is eventually written.
     */
    MultiValueMap<String, String> getHeaders();

    /**
     * Takes over the underlying connection. Succeeds at most once, and never after the regular
     * response path has started. The caller becomes responsible for closing the connection.
     *
     * @throws HijackException if the connection was already hijacked or the response committed
     */
    Connection hijack() throws HijackException;
}
