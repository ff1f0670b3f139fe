package com.proxy.tunnel.relay;

import com.proxy.tunnel.connection.Connection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking relay: one direction runs on the executor, the other on the calling thread.
 *
 * <p>
 * Whichever direction finishes first, by end of stream or by error, ends the whole relay: it
 * half-closes its destination and shuts down input on it, which stops the opposite direction.
 * Whatever the stopped direction reports afterwards is a consequence of that and is not
 * returned as an error. Bytes still in flight in the stopped direction are dropped.
 */
@Slf4j
@RequiredArgsConstructor
public class StreamRelay implements BidiRelay {

    private final ExecutorService executor;

    @Override
    public RelayResult relay(Connection a, Connection b, byte[] bufA, byte[] bufB) {
        AtomicBoolean stopped = new AtomicBoolean(false);
        Future<Outcome> aToB = executor.submit(() -> pipe(a, b, bufA, stopped));
        Outcome bToA = pipe(b, a, bufB, stopped);
        Outcome aToBOutcome = await(aToB, a, b);
        return new RelayResult(aToBOutcome.error, bToA.error, aToBOutcome.bytes, bToA.bytes);
    }

    private Outcome pipe(Connection src, Connection dst, byte[] buffer, AtomicBoolean stopped) {
        long total = 0;
        IOException failure = null;
        try {
            InputStream in = src.getInputStream();
            OutputStream out = dst.getOutputStream();
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
                out.flush();
                total += n;
                log.trace("Relayed {} bytes {} -> {}", n, src.getRemoteAddress(), dst.getRemoteAddress());
            }
        } catch (IOException e) {
            failure = e;
        }

        if (stopped.compareAndSet(false, true)) {
            // first to finish, cleanly or not: end of stream to the peer and stop the opposite direction
            shutdown(dst, true);
            shutdown(dst, false);
            return new Outcome(failure, total);
        }
        if (failure != null) {
            log.trace("Ignoring error after peer direction finished: {}", failure.getMessage());
        }
        shutdown(dst, true);
        return new Outcome(null, total);
    }

    private Outcome await(Future<Outcome> future, Connection a, Connection b) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(a, false);
            shutdown(b, false);
            return new Outcome(new InterruptedIOException("Relay interrupted"), 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            IOException failure = cause instanceof IOException io ? io : new IOException(cause);
            return new Outcome(failure, 0);
        }
    }

    private static void shutdown(Connection connection, boolean output) {
        try {
            if (output) {
                connection.shutdownOutput();
            } else {
                connection.shutdownInput();
            }
        } catch (IOException e) {
            log.trace("Error shutting down {} of {}: {}", output ? "output" : "input", connection, e.getMessage());
        }
    }

    private static final class Outcome {
        private final IOException error;
        private final long bytes;

        private Outcome(IOException error, long bytes) {
            this.error = error;
            this.bytes = bytes;
        }
    }
}
