package com.aporkolab.consumer.bulkhead;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Semaphore bounding how many message workers run at once.
 *
 * Unlike a rejecting bulkhead, {@link #acquire(BooleanSupplier)} waits for a free
 * slot for as long as it takes, re-checking the cancellation condition every
 * poll interval. Every successful acquire must be paired with one {@link #release()}.
 */
public class WorkerBulkhead {

    private final String name;
    private final int maxConcurrentCalls;
    private final Duration pollInterval;
    private final Semaphore semaphore;
    private final AtomicInteger currentCalls = new AtomicInteger(0);
    private final AtomicInteger peakCalls = new AtomicInteger(0);
    private final AtomicLong cancelledAcquisitions = new AtomicLong(0);

    WorkerBulkhead(Builder builder) {
        this.name = builder.name;
        this.maxConcurrentCalls = builder.maxConcurrentCalls;
        this.pollInterval = builder.pollInterval;
        this.semaphore = new Semaphore(maxConcurrentCalls, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Blocks until a slot is free or {@code cancelled} reports true.
     *
     * @return true if a slot was taken, false if the wait was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean acquire(BooleanSupplier cancelled) throws InterruptedException {
        while (!cancelled.getAsBoolean()) {
            if (semaphore.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                int now = currentCalls.incrementAndGet();
                peakCalls.accumulateAndGet(now, Math::max);
                return true;
            }
        }
        cancelledAcquisitions.incrementAndGet();
        return false;
    }

    public void release() {
        if (currentCalls.getAndUpdate(c -> c > 0 ? c - 1 : 0) == 0) {
            throw new IllegalStateException("Bulkhead '" + name + "' released more often than acquired");
        }
        semaphore.release();
    }

    public Metrics getMetrics() {
        return new Metrics(
                semaphore.availablePermits(),
                maxConcurrentCalls,
                currentCalls.get(),
                peakCalls.get(),
                cancelledAcquisitions.get());
    }

    public String getName() {
        return name;
    }

    public record Metrics(
            int availableConcurrentCalls,
            int maxAllowedConcurrentCalls,
            int currentConcurrentCalls,
            int peakConcurrentCalls,
            long cancelledAcquisitions
    ) {}

    public static class Builder {
        private String name = "default";
        private int maxConcurrentCalls = 1;
        private Duration pollInterval = Duration.ofMillis(100);

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public WorkerBulkhead build() {
            Objects.requireNonNull(name, "name");
            if (maxConcurrentCalls < 1) {
                throw new IllegalArgumentException("maxConcurrentCalls must be >= 1, was " + maxConcurrentCalls);
            }
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            return new WorkerBulkhead(this);
        }
    }
}
