package com.aporkolab.consumer.broker.rabbit;

import java.io.IOException;
import java.util.HashMap;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.Acknowledger;
import com.aporkolab.consumer.broker.BrokerChannel;
import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.broker.DeliveryStream;
import com.aporkolab.consumer.broker.OutboundMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * {@link BrokerChannel} backed by a single RabbitMQ {@link Channel}.
 *
 * The RabbitMQ client does not allow interleaved publishes on one channel from
 * several threads, so publish, ack and nack are serialised with a lock. Declarations
 * happen before consumption starts and are not locked.
 */
public class RabbitBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private final Channel channel;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Acknowledger acknowledger = new ChannelAcknowledger();

    public RabbitBrokerChannel(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public DeliveryStream consume(String queue, String consumerName, boolean autoAck,
                                  boolean exclusive, boolean noLocal) throws IOException {
        RabbitDeliveryStream stream = new RabbitDeliveryStream(channel, acknowledger, autoAck);
        String tag = channel.basicConsume(
                queue,
                autoAck,
                consumerName == null ? "" : consumerName,
                noLocal,
                exclusive,
                null,
                stream);
        log.info("Subscribed to queue {} with consumer tag {}", queue, tag);
        return stream;
    }

    @Override
    public void qos(int prefetchCount) throws IOException {
        channel.basicQos(prefetchCount);
    }

    @Override
    public void declareExchange(String name, String type, boolean durable, boolean autoDelete) throws IOException {
        channel.exchangeDeclare(name, type, durable, autoDelete, false, null);
    }

    @Override
    public void declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive) throws IOException {
        channel.queueDeclare(name, durable, exclusive, autoDelete, null);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        channel.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message) throws IOException {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(message.contentType())
                .priority(message.priority())
                .deliveryMode(message.persistent() ? Delivery.PERSISTENT_DELIVERY_MODE : null)
                .correlationId(message.correlationId())
                .messageId(message.messageId())
                .headers(new HashMap<>(message.headers()))
                .build();

        writeLock.lock();
        try {
            channel.basicPublish(exchange, routingKey, false, properties, message.body());
        } finally {
            writeLock.unlock();
        }
    }

    public Channel getChannel() {
        return channel;
    }

    private class ChannelAcknowledger implements Acknowledger {

        @Override
        public void ack(long deliveryTag) throws IOException {
            writeLock.lock();
            try {
                channel.basicAck(deliveryTag, false);
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void nack(long deliveryTag, boolean requeue) throws IOException {
            writeLock.lock();
            try {
                channel.basicNack(deliveryTag, false, requeue);
            } finally {
                writeLock.unlock();
            }
        }
    }
}
