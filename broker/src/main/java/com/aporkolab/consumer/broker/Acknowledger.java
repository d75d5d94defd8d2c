package com.aporkolab.consumer.broker;

import java.io.IOException;

/**
 * Settles deliveries on the channel they arrived on.
 */
public interface Acknowledger {

    void ack(long deliveryTag) throws IOException;

    void nack(long deliveryTag, boolean requeue) throws IOException;
}
