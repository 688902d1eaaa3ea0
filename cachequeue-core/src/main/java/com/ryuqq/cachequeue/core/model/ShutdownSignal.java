package com.ryuqq.cachequeue.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot completion signal handed to a backend at construction.
 *
 * <p>{@code run()} waits on it, {@code shutdown()} fires it. Because the signal is an
 * explicit object rather than process-wide state, several backends can share one signal
 * (one shutdown stops them all) or each get their own.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>{@link #signal()} takes effect exactly once; later calls are no-ops</li>
 *   <li>Callbacks registered after the signal fired run immediately on the registering thread</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public final class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicBoolean signaled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new ArrayList<>();

    /**
     * Registers an action to run when the signal fires.
     *
     * @param callback action (not null)
     * @throws IllegalArgumentException if callback is null
     */
    public void onSignal(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        synchronized (callbacks) {
            if (!signaled.get()) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * Fires the signal, releasing every waiter and running every callback.
     *
     * <p>If callbacks throw, all of them still run; the first failure is rethrown with the
     * rest attached as suppressed exceptions.</p>
     *
     * @return true if this call fired the signal, false if it had already fired
     */
    public boolean signal() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (!signaled.compareAndSet(false, true)) {
                return false;
            }
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        latch.countDown();

        RuntimeException failure = null;
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    /**
     * @return true once {@link #signal()} has been called
     */
    public boolean isSignaled() {
        return signaled.get();
    }

    /**
     * Blocks until the signal fires.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Blocks until the signal fires or the timeout elapses.
     *
     * @param timeout maximum wait
     * @return true if the signal fired
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
