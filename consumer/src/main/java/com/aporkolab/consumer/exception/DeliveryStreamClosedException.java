package com.aporkolab.consumer.exception;

/**
 * The broker stopped delivering while the consumer was still running, for example
 * because the queue was deleted or the channel shut down.
 */
public class DeliveryStreamClosedException extends ConsumerException {

    public static final String CODE = "DELIVERY_STREAM_CLOSED";

    public DeliveryStreamClosedException(String consumerName, String queue) {
        super(CODE, String.format("Delivery stream for consumer '%s' on queue '%s' closed unexpectedly",
                consumerName, queue));
        with("consumer", consumerName);
        with("queue", queue);
    }
}
