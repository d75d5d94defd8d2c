package com.aporkolab.consumer.dlq;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.BrokerChannel;
import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.broker.OutboundMessage;

/**
 * Publishes failed deliveries either back to their queue for another attempt or
 * to the dead-letter exchange.
 *
 * The caller settles the original delivery; this class only publishes.
 */
public class DeadLetterPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterPublisher.class);

    /** The AMQP default exchange routes by queue name. */
    public static final String DEFAULT_EXCHANGE = "";

    private final BrokerChannel channel;
    private final DlqConfig config;
    private final Clock clock;

    public DeadLetterPublisher(BrokerChannel channel, DlqConfig config) {
        this(channel, config, Clock.systemUTC());
    }

    public DeadLetterPublisher(BrokerChannel channel, DlqConfig config, Clock clock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Republishes the delivery to {@code queueName} through the default exchange
     * with {@code x-retry-count} set to {@code nextRetry}.
     */
    public void republish(Delivery delivery, String queueName, int nextRetry) throws IOException {
        OutboundMessage message = new OutboundMessage(
                delivery.getBody(),
                RetryHeaders.withRetryCount(delivery.getHeaders(), nextRetry),
                delivery.getContentType(),
                delivery.getPriority(),
                delivery.isPersistent(),
                delivery.getCorrelationId(),
                delivery.getMessageId());

        channel.publish(DEFAULT_EXCHANGE, queueName, message);
        log.debug("Republished delivery {} to {} as retry {}", delivery.getDeliveryTag(), queueName, nextRetry);
    }

    /**
     * Publishes the delivery to the dead-letter exchange, stamped with where it came
     * from, when it failed and how many retries it had.
     */
    public void deadLetter(Delivery delivery, int retries) throws IOException {
        OutboundMessage message = new OutboundMessage(
                delivery.getBody(),
                RetryHeaders.deadLettered(delivery.getHeaders(), delivery.getExchange(),
                        delivery.getRoutingKey(), clock.instant(), retries),
                delivery.getContentType(),
                null,
                delivery.isPersistent(),
                delivery.getCorrelationId(),
                delivery.getMessageId());

        channel.publish(config.getDlxExchange(), config.getDlxRoutingKey(), message);
        log.warn("Delivery {} from {}/{} routed to dead-letter queue {} after {} retries",
                delivery.getDeliveryTag(), delivery.getExchange(), delivery.getRoutingKey(),
                config.getDlxRoutingKey(), retries);
    }

    public DlqConfig getConfig() {
        return config;
    }
}
