package com.aporkolab.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.broker.DeliveryStream;
import com.aporkolab.consumer.bulkhead.WorkerBulkhead;
import com.aporkolab.consumer.exception.DeliveryStreamClosedException;
import com.aporkolab.consumer.logging.CorrelationContext;

/**
 * The loop behind one consume call: takes deliveries off the stream and hands them
 * to the processor until the token is cancelled or the stream closes.
 *
 * In worker mode each delivery first takes a bulkhead slot, so no more than the
 * bulkhead's capacity are processed at once. Otherwise deliveries are processed
 * inline, one at a time.
 */
final class DeliveryDispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final String consumerName;
    private final String queue;
    private final boolean autoAck;
    private final DeliveryStream stream;
    private final CancellationToken token;
    private final MessageHandler handler;
    private final MessageProcessor processor;
    private final WorkerBulkhead bulkhead;
    private final ExecutorService workers;
    private final TaskTracker tracker;
    private final SingleErrorSlot errors;
    private final Runnable onExit;
    private final Runnable onRelease;
    // the dispatcher itself plus every worker still running for this consume call
    private final AtomicInteger activeTasks = new AtomicInteger(1);

    private DeliveryDispatcher(Builder builder) {
        this.consumerName = builder.consumerName;
        this.queue = builder.queue;
        this.autoAck = builder.autoAck;
        this.stream = builder.stream;
        this.token = builder.token;
        this.handler = builder.handler;
        this.processor = builder.processor;
        this.bulkhead = builder.bulkhead;
        this.workers = builder.workers;
        this.tracker = builder.tracker;
        this.errors = builder.errors;
        this.onExit = builder.onExit;
        this.onRelease = builder.onRelease;
    }

    static Builder builder() {
        return new Builder();
    }

    @Override
    public void run() {
        try (CorrelationContext ctx = CorrelationContext.create().withConsumer(consumerName).withQueue(queue)) {
            log.info("Consumer {} dispatching from {}{}", consumerName, queue,
                    bulkhead == null ? "" : " with up to " + bulkhead.getMetrics().maxAllowedConcurrentCalls()
                            + " concurrent workers");
            loop();
        } catch (RuntimeException e) {
            log.error("Consumer {} dispatcher for {} failed", consumerName, queue, e);
        } finally {
            stream.cancel();
            log.info("Consumer {} stopped dispatching from {}", consumerName, queue);
            onExit.run();
            finishTask();
            tracker.arrive();
        }
    }

    private void loop() {
        while (!token.isCancelled()) {
            Delivery delivery;
            try {
                delivery = stream.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (delivery == null) {
                if (stream.isClosed()) {
                    if (!token.isCancelled()) {
                        log.error("Delivery stream for consumer {} on {} closed unexpectedly", consumerName, queue);
                        errors.offer(new DeliveryStreamClosedException(consumerName, queue));
                    }
                    return;
                }
                continue;
            }

            if (token.isCancelled()) {
                requeue(delivery);
                return;
            }
            if (!dispatch(delivery)) {
                return;
            }
        }
    }

    private boolean dispatch(Delivery delivery) {
        if (bulkhead == null) {
            processor.processBasic(token, queue, handler, delivery);
            return true;
        }

        boolean acquired;
        try {
            acquired = bulkhead.acquire(token::isCancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            requeue(delivery);
            return false;
        }

        tracker.register();
        activeTasks.incrementAndGet();
        try {
            workers.execute(CorrelationContext.wrap(() -> {
                try {
                    processor.processWithRetry(token, queue, handler, delivery);
                } finally {
                    bulkhead.release();
                    finishTask();
                    tracker.arrive();
                }
            }));
        } catch (RejectedExecutionException e) {
            bulkhead.release();
            finishTask();
            tracker.arrive();
            log.error("Worker pool of consumer {} rejected delivery {}", consumerName, delivery.getDeliveryTag());
            requeue(delivery);
            return false;
        }
        return true;
    }

    private void finishTask() {
        if (activeTasks.decrementAndGet() == 0) {
            onRelease.run();
        }
    }

    private void requeue(Delivery delivery) {
        if (autoAck) {
            return;
        }
        try {
            delivery.nack(true);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to requeue undispatched delivery {} on {}: {}",
                    delivery.getDeliveryTag(), queue, e.getMessage());
        }
    }

    static final class Builder {
        private String consumerName;
        private String queue;
        private boolean autoAck;
        private DeliveryStream stream;
        private CancellationToken token;
        private MessageHandler handler;
        private MessageProcessor processor;
        private WorkerBulkhead bulkhead;
        private ExecutorService workers;
        private TaskTracker tracker;
        private SingleErrorSlot errors;
        private Runnable onExit = () -> { };
        private Runnable onRelease = () -> { };

        Builder consumerName(String consumerName) {
            this.consumerName = consumerName;
            return this;
        }

        Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        Builder autoAck(boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        Builder stream(DeliveryStream stream) {
            this.stream = stream;
            return this;
        }

        Builder token(CancellationToken token) {
            this.token = token;
            return this;
        }

        Builder handler(MessageHandler handler) {
            this.handler = handler;
            return this;
        }

        Builder processor(MessageProcessor processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Enables worker mode. Without it deliveries are processed on the dispatcher thread.
         */
        Builder workers(WorkerBulkhead bulkhead, ExecutorService workers) {
            this.bulkhead = bulkhead;
            this.workers = workers;
            return this;
        }

        Builder tracker(TaskTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        Builder errors(SingleErrorSlot errors) {
            this.errors = errors;
            return this;
        }

        Builder onExit(Runnable onExit) {
            this.onExit = onExit;
            return this;
        }

        /**
         * Runs once the dispatcher and every worker it started have finished.
         */
        Builder onRelease(Runnable onRelease) {
            this.onRelease = onRelease;
            return this;
        }

        DeliveryDispatcher build() {
            return new DeliveryDispatcher(this);
        }
    }
}
