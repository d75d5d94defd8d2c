package com.aporkolab.consumer;

import java.util.Optional;

import com.aporkolab.consumer.exception.ConsumerAlreadyRunningException;
import com.aporkolab.consumer.exception.ConsumerException;
import com.aporkolab.consumer.exception.ConsumerSetupException;

/**
 * Consumes one queue at a time, acknowledging each message according to its
 * handler's outcome.
 *
 * A consumer runs until the supplied token is cancelled, {@link #stop()} is
 * called, or the broker closes the delivery stream. Once stopped it cannot be
 * restarted.
 */
public interface Consumer extends AutoCloseable {

    /**
     * Starts consuming {@code queueName}, processing messages one at a time on the
     * dispatcher thread. Success acks, failure nacks with requeue.
     *
     * @throws ConsumerAlreadyRunningException if this consumer is already consuming
     * @throws ConsumerSetupException if the broker rejects the subscription
     * @throws IllegalStateException if the consumer has been stopped
     */
    void consume(CancellationToken token, String queueName, MessageHandler handler);

    /**
     * Starts consuming {@code queueName} with up to prefetch-count concurrent
     * handlers and the configured retry and dead-letter policy.
     *
     * @throws ConsumerAlreadyRunningException if this consumer is already consuming
     * @throws ConsumerSetupException if QoS, dead-letter topology or subscription fails
     * @throws IllegalStateException if the consumer has been stopped
     */
    void consumeWithDlq(CancellationToken token, String queueName, MessageHandler handler);

    /**
     * Blocks until the dispatcher and all workers have finished, then returns the
     * first asynchronous error, if any.
     */
    Optional<ConsumerException> await() throws InterruptedException;

    /**
     * Signals the consumer to stop. Idempotent and non-blocking.
     */
    void stop();

    ErrorChannel errors();

    boolean isRunning();

    ConsumerState getState();

    /**
     * Stops and waits for all consumer threads to finish.
     */
    @Override
    void close();
}
