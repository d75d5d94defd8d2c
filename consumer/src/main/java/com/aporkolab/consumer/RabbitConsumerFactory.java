package com.aporkolab.consumer;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.rabbit.RabbitBrokerChannel;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * Creates consumers on a shared RabbitMQ connection, each on its own channel.
 * Closing a consumer closes the channel it was given.
 */
public class RabbitConsumerFactory {

    private static final Logger log = LoggerFactory.getLogger(RabbitConsumerFactory.class);

    private final Connection connection;
    private final ConsumerConfig defaultConfig;
    private final ConsumerListener listener;

    public RabbitConsumerFactory(Connection connection, ConsumerConfig defaultConfig) {
        this(connection, defaultConfig, ConsumerListener.NOOP);
    }

    public RabbitConsumerFactory(Connection connection, ConsumerConfig defaultConfig, ConsumerListener listener) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.listener = listener == null ? ConsumerListener.NOOP : listener;
    }

    public Consumer create() throws IOException {
        return create(defaultConfig);
    }

    public Consumer create(ConsumerConfig config) throws IOException {
        Channel channel = connection.createChannel();
        if (channel == null) {
            throw new IOException("No channel available on connection " + connection);
        }
        log.debug("Opened channel {} for consumer {}", channel.getChannelNumber(), config.getName());
        return new RabbitMqConsumer(new RabbitBrokerChannel(channel), config, listener, channel);
    }

    public ConsumerConfig getDefaultConfig() {
        return defaultConfig;
    }
}
