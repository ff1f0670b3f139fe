package com.proxy.tunnel.relay;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.io.IOException;

/**
 * Outcome of both relay directions; a {@code null} error means the direction ended cleanly.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class RelayResult {

    private final IOException errorAToB;
    private final IOException errorBToA;
    private final long bytesAToB;
    private final long bytesBToA;

    public RelayResult(IOException errorAToB, IOException errorBToA) {
        this(errorAToB, errorBToA, 0, 0);
    }
}
