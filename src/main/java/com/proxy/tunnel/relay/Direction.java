package com.proxy.tunnel.relay;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two halves of a tunnel, named by where the bytes go.
 */
@Getter
@RequiredArgsConstructor
public enum Direction {
    TO_UPSTREAM("upstream"),
    TO_DOWNSTREAM("downstream");

    private final String target;
}
