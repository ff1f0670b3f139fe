package com.proxy.tunnel.config;

import com.proxy.tunnel.buffer.BufferSource;
import com.proxy.tunnel.buffer.DefaultBufferSource;
import com.proxy.tunnel.buffer.PooledBufferSource;
import com.proxy.tunnel.dial.Dialer;
import com.proxy.tunnel.dial.TcpDialer;
import com.proxy.tunnel.processor.ConnectInterceptor;
import com.proxy.tunnel.processor.Interceptor;
import com.proxy.tunnel.relay.BidiRelay;
import com.proxy.tunnel.relay.StreamRelay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@RequiredArgsConstructor
@Configuration
public class TunnelBeans {

    private final TunnelConfig tunnelConfig;

    @Bean
    public BufferSource bufferSource() {
        if (tunnelConfig.getBufferPoolCapacity() > 0) {
            return new PooledBufferSource(tunnelConfig.getBufferSize(), tunnelConfig.getBufferPoolCapacity());
        }
        if (tunnelConfig.getBufferSize() != DefaultBufferSource.DEFAULT_BUFFER_SIZE) {
            log.warn("proxy.tunnel.buffer-size={} only applies when buffer pooling is enabled; using {} byte buffers",
                    tunnelConfig.getBufferSize(), DefaultBufferSource.DEFAULT_BUFFER_SIZE);
        }
        return new DefaultBufferSource();
    }

    @Bean
    public Dialer dialer() {
        return new TcpDialer(tunnelConfig.getConnectTimeout());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService relayExecutor() {
        return Executors.newCachedThreadPool(namedThreads("Tunnel-Relay-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService idleTimer() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("Tunnel-Idle-Timer-"));
    }

    @Bean
    public BidiRelay bidiRelay(@Qualifier("relayExecutor") ExecutorService relayExecutor) {
        return new StreamRelay(relayExecutor);
    }

    @Bean
    public Interceptor connectInterceptor(BufferSource bufferSource, Dialer dialer, BidiRelay bidiRelay) {
        log.info("CONNECT interceptor: idleTimeout={}, okWaitsForUpstream={}, bufferSource={}",
                tunnelConfig.getIdleTimeout(), tunnelConfig.isOkWaitsForUpstream(), bufferSource.getClass().getSimpleName());
        return new ConnectInterceptor(tunnelConfig.getIdleTimeout(), bufferSource, tunnelConfig.isOkWaitsForUpstream(),
                dialer, bidiRelay);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
