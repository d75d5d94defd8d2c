package com.aporkolab.consumer.broker;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A message to publish: body plus the AMQP properties the consumer engine carries over.
 */
public record OutboundMessage(
        byte[] body,
        Map<String, Object> headers,
        String contentType,
        Integer priority,
        boolean persistent,
        String correlationId,
        String messageId
) {

    public OutboundMessage {
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(headers));
    }
}
