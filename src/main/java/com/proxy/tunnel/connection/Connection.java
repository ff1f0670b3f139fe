package com.proxy.tunnel.connection;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;

/**
 * A raw duplex byte stream, either a hijacked client connection or a dialed upstream one.
 */
public interface Connection extends Closeable {

    InputStream getInputStream() throws IOException;

    OutputStream getOutputStream() throws IOException;

    /**
     * Stops reading: pending and future reads report end of stream.
     */
    void shutdownInput() throws IOException;

    /**
     * Sends end of stream to the peer while leaving the read side open.
     */
    void shutdownOutput() throws IOException;

    SocketAddress getRemoteAddress();

    boolean isClosed();
}
