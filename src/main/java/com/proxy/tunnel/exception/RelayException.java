package com.proxy.tunnel.exception;

import com.proxy.tunnel.relay.Direction;
import lombok.Getter;

import java.io.IOException;

/**
 * A relay direction ended with an error that is not ordinary connection teardown.
 */
@Getter
public class RelayException extends TunnelException {

    private static final long serialVersionUID = 1L;

    private final Direction direction;

    public RelayException(Direction direction, IOException cause) {
        super("Error piping data to " + direction.getTarget() + ": " + cause.getMessage(), cause);
        this.direction = direction;
    }
}
