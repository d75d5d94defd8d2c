package com.aporkolab.consumer.broker;

import java.time.Duration;

/**
 * Pull-side view of a broker subscription.
 */
public interface DeliveryStream {

    String getConsumerTag();

    /**
     * Waits up to {@code timeout} for the next delivery.
     *
     * @return the next delivery, or {@code null} if none arrived in time
     */
    Delivery poll(Duration timeout) throws InterruptedException;

    /**
     * True once the broker has ended the subscription (consumer cancelled, channel
     * or connection shut down). No further deliveries will arrive.
     */
    boolean isClosed();

    /**
     * Ends the subscription and hands back deliveries that were buffered but never
     * taken. Best-effort: failures are logged, never thrown.
     */
    void cancel();
}
