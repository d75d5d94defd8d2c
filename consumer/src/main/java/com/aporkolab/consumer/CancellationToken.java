package com.aporkolab.consumer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between the caller, the dispatcher and
 * message handlers. Cancelling is idempotent and cannot be undone.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private final List<Registration> links = new ArrayList<>();
    private boolean detached;

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it drops the callback
     * if it has not run yet.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token that becomes cancelled as soon as any of {@code parents} is. It stays
     * registered with the parents until it is cancelled or {@link #detach() detached}.
     */
    public static CancellationToken anyOf(CancellationToken... parents) {
        CancellationToken linked = new CancellationToken();
        for (CancellationToken parent : parents) {
            linked.link(parent.onCancel(linked::cancel));
        }
        return linked;
    }

    /**
     * Stops following the parents given to {@link #anyOf}. The token keeps its current
     * state; a token that is not cancelled yet will no longer become cancelled through them.
     */
    public void detach() {
        List<Registration> toClose;
        synchronized (links) {
            detached = true;
            toClose = new ArrayList<>(links);
            links.clear();
        }
        toClose.forEach(Registration::close);
    }

    private void link(Registration registration) {
        synchronized (links) {
            if (!detached) {
                links.add(registration);
                return;
            }
        }
        registration.close();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (latch.getCount() == 0) {
                return;
            }
            latch.countDown();
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
        detach();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if cancelled, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Runs {@code callback} once on cancellation, or immediately if already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (latch.getCount() != 0) {
                callbacks.add(callback);
                return () -> removeCallback(callback);
            }
        }
        callback.run();
        return () -> { };
    }

    private void removeCallback(Runnable callback) {
        synchronized (callbacks) {
            callbacks.removeIf(registered -> registered == callback);
        }
    }

    int registeredCallbacks() {
        synchronized (callbacks) {
            return callbacks.size();
        }
    }
}
