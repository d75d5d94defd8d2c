package com.aporkolab.consumer.dlq;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.BrokerChannel;

/**
 * Declares the dead-letter exchange and queue and binds them. Safe to repeat.
 */
public class DlqTopology {

    private static final Logger log = LoggerFactory.getLogger(DlqTopology.class);
    static final String EXCHANGE_TYPE = "direct";

    private final DlqConfig config;

    public DlqTopology(DlqConfig config) {
        this.config = config;
    }

    public void ensure(BrokerChannel channel) throws IOException {
        String exchange = config.getDlxExchange();
        String queue = config.getDlxRoutingKey();

        channel.declareExchange(exchange, EXCHANGE_TYPE, true, false);
        channel.declareQueue(queue, true, false, false);
        channel.bindQueue(queue, exchange, queue);

        log.info("Dead-letter topology ready: exchange={} queue={}", exchange, queue);
    }
}
