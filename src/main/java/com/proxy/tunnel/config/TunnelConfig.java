package com.proxy.tunnel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "proxy.tunnel")
public class TunnelConfig {
    private String listenHost = "0.0.0.0";
    private int listenPort = 8080;
    /** Zero disables idle timeouts. */
    private Duration idleTimeout = Duration.ZERO;
    /** Send 200 only after the upstream is connected, so dial failures can be reported as 502. */
    private boolean okWaitsForUpstream = false;
    /** Deadline for everything up to and including the upstream dial. */
    private Duration dialTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestHeadTimeout = Duration.ofSeconds(30);
    private int bufferSize = 32768;
    /** Greater than zero enables buffer pooling with that many idle buffers kept. */
    private int bufferPoolCapacity = 0;
}
