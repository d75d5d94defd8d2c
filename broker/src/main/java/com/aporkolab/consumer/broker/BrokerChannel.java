package com.aporkolab.consumer.broker;

import java.io.IOException;

/**
 * The slice of a broker channel the consumer engine depends on.
 *
 * One instance is shared by a dispatcher and all of its workers, so implementations
 * must accept concurrent publish, ack and nack calls.
 */
public interface BrokerChannel {

    /**
     * Starts a delivery stream on the given queue.
     *
     * @param consumerName consumer tag to register; blank lets the broker generate one
     * @throws IOException if the broker refuses the subscription (e.g. unknown queue)
     */
    DeliveryStream consume(String queue, String consumerName, boolean autoAck,
                           boolean exclusive, boolean noLocal) throws IOException;

    /**
     * Limits the number of unacknowledged deliveries pushed to this channel.
     */
    void qos(int prefetchCount) throws IOException;

    void declareExchange(String name, String type, boolean durable, boolean autoDelete) throws IOException;

    void declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive) throws IOException;

    void bindQueue(String queue, String exchange, String routingKey) throws IOException;

    /**
     * Publishes a message. An empty exchange name targets the default exchange,
     * which routes by queue name.
     */
    void publish(String exchange, String routingKey, OutboundMessage message) throws IOException;
}
