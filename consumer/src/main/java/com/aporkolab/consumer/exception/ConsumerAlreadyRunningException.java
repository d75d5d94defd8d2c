package com.aporkolab.consumer.exception;

/**
 * A consume call was made while the consumer was already consuming.
 */
public class ConsumerAlreadyRunningException extends ConsumerException {

    public static final String CODE = "CONSUMER_ALREADY_RUNNING";

    public ConsumerAlreadyRunningException(String consumerName) {
        super(CODE, String.format("Consumer '%s' is already running", consumerName));
        with("consumer", consumerName);
    }
}
