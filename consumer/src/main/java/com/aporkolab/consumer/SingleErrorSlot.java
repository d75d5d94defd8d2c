package com.aporkolab.consumer;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.aporkolab.consumer.exception.ConsumerException;

/**
 * Holds at most one error: the first one offered wins, later ones are dropped.
 */
final class SingleErrorSlot implements ErrorChannel {

    private final AtomicReference<ConsumerException> slot = new AtomicReference<>();
    private final CountDownLatch filled = new CountDownLatch(1);

    boolean offer(ConsumerException error) {
        if (slot.compareAndSet(null, error)) {
            filled.countDown();
            return true;
        }
        return false;
    }

    @Override
    public Optional<ConsumerException> poll() {
        return Optional.ofNullable(slot.get());
    }

    @Override
    public Optional<ConsumerException> poll(Duration timeout) throws InterruptedException {
        filled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return poll();
    }
}
