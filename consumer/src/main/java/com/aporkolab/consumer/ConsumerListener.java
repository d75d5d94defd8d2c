package com.aporkolab.consumer;

import java.time.Duration;

/**
 * Callbacks for observing message processing, for example to record metrics.
 *
 * Calls happen on worker threads and must not block. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface ConsumerListener {

    ConsumerListener NOOP = new ConsumerListener() {};

    default void onHandlerStarted(String consumer, String queue) {}

    /**
     * @param failure the handler's exception, or null on success
     */
    default void onHandlerCompleted(String consumer, String queue, Duration duration, Throwable failure) {}

    default void onRetryScheduled(String consumer, String queue, int attempt, Duration delay) {}

    default void onOutcome(String consumer, String queue, MessageOutcome outcome) {}
}
