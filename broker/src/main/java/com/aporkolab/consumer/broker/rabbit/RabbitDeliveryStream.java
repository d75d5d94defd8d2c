package com.aporkolab.consumer.broker.rabbit;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.Acknowledger;
import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.broker.DeliveryStream;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Bridges the RabbitMQ push callbacks into a pull-style {@link DeliveryStream}.
 *
 * The client's dispatch thread only enqueues; all processing happens on whoever
 * polls. The buffer never holds more than the channel's prefetch window.
 * Deliveries pushed after {@link #cancel()} are requeued on arrival.
 */
class RabbitDeliveryStream extends DefaultConsumer implements DeliveryStream {

    private static final Logger log = LoggerFactory.getLogger(RabbitDeliveryStream.class);

    private final Acknowledger acknowledger;
    private final boolean autoAck;
    private final BlockingQueue<Delivery> buffer = new LinkedBlockingQueue<>();
    // guards cancelled against buffer so nothing is enqueued after the final drain
    private final Object drainLock = new Object();
    private boolean cancelled;
    private volatile boolean closed;

    RabbitDeliveryStream(Channel channel, Acknowledger acknowledger, boolean autoAck) {
        super(channel);
        this.acknowledger = acknowledger;
        this.autoAck = autoAck;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope,
                               AMQP.BasicProperties properties, byte[] body) {
        Delivery delivery = Delivery.builder()
                .deliveryTag(envelope.getDeliveryTag())
                .exchange(envelope.getExchange())
                .routingKey(envelope.getRoutingKey())
                .redelivered(envelope.isRedeliver())
                .body(body)
                .headers(properties.getHeaders())
                .contentType(properties.getContentType())
                .priority(properties.getPriority())
                .deliveryMode(properties.getDeliveryMode())
                .correlationId(properties.getCorrelationId())
                .messageId(properties.getMessageId())
                .acknowledger(acknowledger)
                .build();
        synchronized (drainLock) {
            if (!cancelled) {
                buffer.offer(delivery);
                return;
            }
        }
        if (autoAck) {
            log.debug("Dropping delivery {} pushed after cancel in auto-ack mode", delivery.getDeliveryTag());
            return;
        }
        requeue(delivery);
        log.debug("Requeued delivery {} pushed after cancel", delivery.getDeliveryTag());
    }

    @Override
    public void handleCancel(String consumerTag) {
        log.warn("Consumer {} cancelled by broker", consumerTag);
        closed = true;
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        log.debug("Consumer {} cancelled", consumerTag);
        closed = true;
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        if (!sig.isInitiatedByApplication()) {
            log.warn("Channel shut down under consumer {}: {}", consumerTag, sig.getMessage());
        }
        closed = true;
    }

    @Override
    public Delivery poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void cancel() {
        String tag = getConsumerTag();
        if (!closed && tag != null && getChannel().isOpen()) {
            try {
                getChannel().basicCancel(tag);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to cancel consumer {}: {}", tag, e.getMessage());
            }
        }
        closed = true;

        List<Delivery> leftovers = new ArrayList<>();
        synchronized (drainLock) {
            cancelled = true;
            buffer.drainTo(leftovers);
        }
        if (autoAck || leftovers.isEmpty()) {
            return;
        }
        for (Delivery delivery : leftovers) {
            requeue(delivery);
        }
        log.info("Requeued {} undispatched deliveries for consumer {}", leftovers.size(), tag);
    }

    private void requeue(Delivery delivery) {
        try {
            delivery.nack(true);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to requeue undispatched delivery {}: {}",
                    delivery.getDeliveryTag(), e.getMessage());
        }
    }
}
