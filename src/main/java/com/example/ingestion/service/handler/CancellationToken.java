package com.example.ingestion.service.handler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal passed to every long running call.
 * <p>
 * Cancelling a token cancels all of its children. Blocking helpers on the
 * token ({@link #sleep(Duration)}, {@link #await(Future, Duration)}) return
 * early with a {@link CancellationException} once it is cancelled.
 * <p>
 * Cancellation is never an ordinary failure: code that observes it re-raises
 * it unchanged.
 */
public final class CancellationToken {

    private static final long POLL_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final CancellationToken parent;
    private volatile String reason;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * A token that is cancelled together with this one but can also be cancelled on its own.
     */
    public CancellationToken newChild() {
        var child = new CancellationToken(this);
        children.add(child);
        if (isCancellationRequested()) {
            child.cancel(reason);
        }
        return child;
    }

    /**
     * Detach a child token from its parent once the work it guarded is done.
     */
    public void release() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public void cancel(String reason) {
        synchronized (this) {
            if (cancelled.getCount() == 0) {
                return;
            }
            this.reason = reason;
            cancelled.countDown();
        }
        for (var child : children) {
            child.cancel(reason);
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException(reason);
        }
    }

    /**
     * Sleep that ends early, with a {@link CancellationException}, when the token is cancelled.
     */
    public void sleep(Duration duration) {
        throwIfCancellationRequested();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CancellationException(reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while sleeping");
        }
    }

    /**
     * Wait for a future for at most {@code timeout}, checking the token in between.
     * The future is left running when this method throws; the caller decides whether to cancel it.
     *
     * @throws TimeoutException      when the timeout elapses first
     * @throws ExecutionException    when the future failed
     * @throws CancellationException when the token is cancelled or the waiting thread is interrupted
     */
    public <T> T await(Future<T> future, Duration timeout) throws ExecutionException, TimeoutException {
        var deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (!future.isDone()) {
                throwIfCancellationRequested();
                var remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new TimeoutException("Timed out after " + timeout.toSeconds() + "s");
                }
                cancelled.await(Math.min(remaining, POLL_INTERVAL_NANOS), TimeUnit.NANOSECONDS);
            }
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting");
        }
    }
}
