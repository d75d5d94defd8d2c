package com.aporkolab.consumer.exception;

/**
 * Starting consumption failed: QoS, dead-letter topology or registration with the broker.
 */
public class ConsumerSetupException extends ConsumerException {

    public static final String CODE = "CONSUMER_SETUP_FAILED";

    public ConsumerSetupException(String consumerName, String queue, String step, Throwable cause) {
        super(CODE,
                String.format("Consumer '%s' failed to %s for queue '%s': %s",
                        consumerName, step, queue, cause.getMessage()),
                cause);
        with("consumer", consumerName);
        with("queue", queue);
        with("step", step);
    }

    public static ConsumerSetupException qos(String consumerName, String queue, Throwable cause) {
        return new ConsumerSetupException(consumerName, queue, "set QoS", cause);
    }

    public static ConsumerSetupException dlqTopology(String consumerName, String queue, Throwable cause) {
        return new ConsumerSetupException(consumerName, queue, "declare dead-letter topology", cause);
    }

    public static ConsumerSetupException registration(String consumerName, String queue, Throwable cause) {
        return new ConsumerSetupException(consumerName, queue, "register consumer", cause);
    }
}
