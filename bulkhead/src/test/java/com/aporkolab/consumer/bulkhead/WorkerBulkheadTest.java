package com.aporkolab.consumer.bulkhead;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkerBulkheadTest {

    private static WorkerBulkhead bulkhead(int max) {
        return WorkerBulkhead.builder()
                .name("test")
                .maxConcurrentCalls(max)
                .pollInterval(Duration.ofMillis(10))
                .build();
    }

    @Nested
    @DisplayName("Acquire and release")
    class AcquireAndRelease {

        @Test
        @DisplayName("should hand out slots up to the limit")
        void shouldHandOutSlotsUpToLimit() throws Exception {
            WorkerBulkhead bulkhead = bulkhead(2);

            assertTrue(bulkhead.acquire(() -> false));
            assertTrue(bulkhead.acquire(() -> false));

            WorkerBulkhead.Metrics metrics = bulkhead.getMetrics();
            assertEquals(0, metrics.availableConcurrentCalls());
            assertEquals(2, metrics.currentConcurrentCalls());
            assertEquals(2, metrics.maxAllowedConcurrentCalls());
        }

        @Test
        @DisplayName("should block until a slot is released")
        void shouldBlockUntilReleased() throws Exception {
            WorkerBulkhead bulkhead = bulkhead(1);
            assertTrue(bulkhead.acquire(() -> false));

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Boolean> waiting = executor.submit(() -> bulkhead.acquire(() -> false));

                Thread.sleep(50);
                assertFalse(waiting.isDone());

                bulkhead.release();
                assertTrue(waiting.get(1, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should give up when cancelled while waiting")
        void shouldGiveUpWhenCancelled() throws Exception {
            WorkerBulkhead bulkhead = bulkhead(1);
            assertTrue(bulkhead.acquire(() -> false));
            AtomicBoolean cancelled = new AtomicBoolean(false);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Boolean> waiting = executor.submit(() -> bulkhead.acquire(cancelled::get));
                Thread.sleep(30);
                cancelled.set(true);

                assertFalse(waiting.get(1, TimeUnit.SECONDS));
                assertEquals(1, bulkhead.getMetrics().cancelledAcquisitions());
                assertEquals(1, bulkhead.getMetrics().currentConcurrentCalls());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should not acquire when already cancelled")
        void shouldNotAcquireWhenAlreadyCancelled() throws Exception {
            WorkerBulkhead bulkhead = bulkhead(3);

            assertFalse(bulkhead.acquire(() -> true));
            assertEquals(3, bulkhead.getMetrics().availableConcurrentCalls());
        }

        @Test
        @DisplayName("should reject unmatched release")
        void shouldRejectUnmatchedRelease() {
            WorkerBulkhead bulkhead = bulkhead(1);

            assertThrows(IllegalStateException.class, bulkhead::release);
            assertEquals(1, bulkhead.getMetrics().availableConcurrentCalls());
        }
    }

    @Test
    @DisplayName("should never exceed the limit under contention")
    void shouldNeverExceedLimitUnderContention() throws Exception {
        WorkerBulkhead bulkhead = bulkhead(3);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(20);

        ExecutorService executor = Executors.newFixedThreadPool(10);
        try {
            for (int i = 0; i < 20; i++) {
                executor.submit(() -> {
                    try {
                        if (bulkhead.acquire(() -> false)) {
                            try {
                                maxSeen.accumulateAndGet(running.incrementAndGet(), Math::max);
                                Thread.sleep(10);
                            } finally {
                                running.decrementAndGet();
                                bulkhead.release();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(maxSeen.get() <= 3);
        assertTrue(bulkhead.getMetrics().peakConcurrentCalls() <= 3);
        assertEquals(3, bulkhead.getMetrics().availableConcurrentCalls());
    }

    @Test
    @DisplayName("should validate configuration")
    void shouldValidateConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkerBulkhead.builder().maxConcurrentCalls(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> WorkerBulkhead.builder().pollInterval(Duration.ZERO).build());
    }
}
