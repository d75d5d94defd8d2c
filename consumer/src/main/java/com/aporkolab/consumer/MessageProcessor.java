package com.aporkolab.consumer;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.dlq.DeadLetterPublisher;
import com.aporkolab.consumer.dlq.DlqConfig;
import com.aporkolab.consumer.dlq.RetryHeaders;
import com.aporkolab.consumer.logging.CorrelationContext;

/**
 * Runs a handler for one delivery and settles the delivery based on the outcome.
 *
 * Nothing here throws: handler failures feed the retry policy, broker failures
 * while settling are logged.
 */
final class MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final ConsumerConfig config;
    private final DeadLetterPublisher publisher;
    private final ConsumerListener listener;

    MessageProcessor(ConsumerConfig config, DeadLetterPublisher publisher, ConsumerListener listener) {
        this.config = config;
        this.publisher = publisher;
        this.listener = new GuardedListener(listener);
    }

    /**
     * Success acks, failure nacks with requeue. Nothing is settled in auto-ack mode.
     */
    void processBasic(CancellationToken token, String queue, MessageHandler handler, Delivery delivery) {
        try (CorrelationContext ctx = contextFor(queue, delivery, RetryHeaders.retryCount(delivery.getHeaders()))) {
            Exception failure = invoke(token, queue, handler, delivery);
            if (config.isAutoAck()) {
                return;
            }
            if (failure == null) {
                ack(queue, delivery, MessageOutcome.ACKED);
            } else {
                log.warn("Handler failed for delivery {} on {}, requeueing: {}",
                        delivery.getDeliveryTag(), queue, failure.getMessage());
                requeue(queue, delivery);
            }
        }
    }

    /**
     * Applies the retry and dead-letter policy. Below the retry limit the message is
     * republished with an incremented {@code x-retry-count} after the backoff delay,
     * above it a stamped copy goes to the dead-letter exchange. Whenever the broker
     * rejects a publish, or the backoff wait is cancelled, the original is requeued.
     */
    void processWithRetry(CancellationToken token, String queue, MessageHandler handler, Delivery delivery) {
        int retries = RetryHeaders.retryCount(delivery.getHeaders());
        try (CorrelationContext ctx = contextFor(queue, delivery, retries)) {
            Exception failure = invoke(token, queue, handler, delivery);
            if (config.isAutoAck()) {
                return;
            }
            if (failure == null) {
                ack(queue, delivery, MessageOutcome.ACKED);
                return;
            }

            DlqConfig dlq = config.getDlq();
            if (!dlq.isEnabled()) {
                log.warn("Handler failed for delivery {} on {}, requeueing: {}",
                        delivery.getDeliveryTag(), queue, failure.getMessage());
                requeue(queue, delivery);
                return;
            }

            // retries can be Integer.MAX_VALUE, so compare in long
            if ((long) retries + 1 > dlq.getMaxRetries()) {
                log.warn("Handler failed for delivery {} on {} after {} retries, dead-lettering: {}",
                        delivery.getDeliveryTag(), queue, retries, failure.getMessage());
                deadLetter(queue, delivery, retries);
            } else {
                retry(token, queue, delivery, retries, retries + 1, failure);
            }
        }
    }

    private Exception invoke(CancellationToken token, String queue, MessageHandler handler, Delivery delivery) {
        listener.onHandlerStarted(config.getName(), queue);
        long start = System.nanoTime();
        Exception failure = null;
        try {
            handler.handle(token, delivery.getBody());
        } catch (Exception e) {
            failure = e;
            log.debug("Handler threw for delivery {}", delivery.getDeliveryTag(), e);
        }
        listener.onHandlerCompleted(config.getName(), queue, Duration.ofNanos(System.nanoTime() - start), failure);
        return failure;
    }

    private void retry(CancellationToken token, String queue, Delivery delivery,
                       int retries, int nextRetry, Exception failure) {
        DlqConfig dlq = config.getDlq();
        Duration delay = dlq.calculateBackoff(retries);
        log.warn("Handler failed for delivery {} on {}, retry {}/{} in {}ms: {}",
                delivery.getDeliveryTag(), queue, nextRetry, dlq.getMaxRetries(), delay.toMillis(),
                failure.getMessage());
        listener.onRetryScheduled(config.getName(), queue, nextRetry, delay);

        if (cancelledDuring(token, delay)) {
            log.info("Backoff for delivery {} on {} cancelled, requeueing", delivery.getDeliveryTag(), queue);
            requeue(queue, delivery);
            return;
        }

        try {
            publisher.republish(delivery, queue, nextRetry);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to republish delivery {} to {} for retry {}, requeueing: {}",
                    delivery.getDeliveryTag(), queue, nextRetry, e.getMessage());
            requeue(queue, delivery);
            return;
        }
        ack(queue, delivery, MessageOutcome.RETRIED);
    }

    private void deadLetter(String queue, Delivery delivery, int retries) {
        try {
            publisher.deadLetter(delivery, retries);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to dead-letter delivery {} from {}, requeueing: {}",
                    delivery.getDeliveryTag(), queue, e.getMessage());
            requeue(queue, delivery);
            return;
        }
        ack(queue, delivery, MessageOutcome.DEAD_LETTERED);
    }

    private static boolean cancelledDuring(CancellationToken token, Duration delay) {
        if (token.isCancelled()) {
            return true;
        }
        if (delay.isZero()) {
            return false;
        }
        try {
            return token.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void ack(String queue, Delivery delivery, MessageOutcome outcome) {
        try {
            delivery.ack();
            log.debug("Acked delivery {} on {} ({})", delivery.getDeliveryTag(), queue, outcome.tag());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to ack delivery {} on {}: {}", delivery.getDeliveryTag(), queue, e.getMessage());
        }
        listener.onOutcome(config.getName(), queue, outcome);
    }

    private void requeue(String queue, Delivery delivery) {
        try {
            delivery.nack(true);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to nack delivery {} on {}: {}", delivery.getDeliveryTag(), queue, e.getMessage());
        }
        listener.onOutcome(config.getName(), queue, MessageOutcome.REQUEUED);
    }

    private CorrelationContext contextFor(String queue, Delivery delivery, int retries) {
        return CorrelationContext.continueOrCreate(delivery.getCorrelationId())
                .withConsumer(config.getName())
                .withQueue(queue)
                .withDeliveryTag(delivery.getDeliveryTag())
                .withRetryCount(retries);
    }

    /**
     * Keeps a misbehaving listener from disturbing message settlement.
     */
    private static final class GuardedListener implements ConsumerListener {

        private final ConsumerListener delegate;

        GuardedListener(ConsumerListener delegate) {
            this.delegate = delegate == null ? ConsumerListener.NOOP : delegate;
        }

        @Override
        public void onHandlerStarted(String consumer, String queue) {
            try {
                delegate.onHandlerStarted(consumer, queue);
            } catch (RuntimeException e) {
                log.warn("Consumer listener failed in onHandlerStarted: {}", e.getMessage());
            }
        }

        @Override
        public void onHandlerCompleted(String consumer, String queue, Duration duration, Throwable failure) {
            try {
                delegate.onHandlerCompleted(consumer, queue, duration, failure);
            } catch (RuntimeException e) {
                log.warn("Consumer listener failed in onHandlerCompleted: {}", e.getMessage());
            }
        }

        @Override
        public void onRetryScheduled(String consumer, String queue, int attempt, Duration delay) {
            try {
                delegate.onRetryScheduled(consumer, queue, attempt, delay);
            } catch (RuntimeException e) {
                log.warn("Consumer listener failed in onRetryScheduled: {}", e.getMessage());
            }
        }

        @Override
        public void onOutcome(String consumer, String queue, MessageOutcome outcome) {
            try {
                delegate.onOutcome(consumer, queue, outcome);
            } catch (RuntimeException e) {
                log.warn("Consumer listener failed in onOutcome: {}", e.getMessage());
            }
        }
    }
}
