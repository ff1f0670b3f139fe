package com.proxy.tunnel.context;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline for the work done on behalf of one CONNECT request.
 *
 * <p>
 * Only the upstream dial observes the context. Once bytes are being relayed, a tunnel ends
 * when one of its connections is closed, not when its context is cancelled.
 */
@Slf4j
public final class TunnelContext {

    private final Instant deadline;
    private final Clock clock;
    private final TunnelContext parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();

    private TunnelContext(TunnelContext parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A context without deadline that is only done once cancelled.
     */
    public static TunnelContext background() {
        return new TunnelContext(null, null, Clock.systemUTC());
    }

    public static TunnelContext withTimeout(Duration timeout) {
        return background().childWithTimeout(timeout);
    }

    /**
     * Derives a context that is cancelled with this one and expires after {@code timeout},
     * or at this context's deadline if that comes first.
     */
    public TunnelContext childWithTimeout(Duration timeout) {
        Instant childDeadline = clock.instant().plus(timeout);
        if (deadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }
        TunnelContext child = new TunnelContext(this, childDeadline, clock);
        onCancel(child::cancel);
        return child;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : cancelListeners) {
                if (cancelListeners.remove(listener)) {
                    runListener(listener);
                }
            }
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancel listener failed: {}", e.getMessage(), e);
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative. Empty when there is no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately if already cancelled.
     *
     * @return a handle that unregisters the callback
     */
    public Runnable onCancel(Runnable listener) {
        cancelListeners.add(listener);
        if (isCancelled() && cancelListeners.remove(listener)) {
            runListener(listener);
        }
        return () -> cancelListeners.remove(listener);
    }
}
