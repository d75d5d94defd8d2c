package com.aporkolab.consumer.logging;

import java.util.Map;
import java.util.UUID;

import org.slf4j.MDC;

/**
 * Manages the logging context of a single delivery via MDC (Mapped Diagnostic Context).
 *
 * Every log line written while a handler runs carries the consumer name, the queue,
 * the delivery tag, the retry count and the message correlation id. The context is
 * carried from the dispatcher thread into worker threads with {@link #wrap(Runnable)}.
 *
 * Usage:
 * <pre>
 * try (var ctx = CorrelationContext.continueOrCreate(properties.getCorrelationId())
 *         .withConsumer("orders-consumer")
 *         .withQueue("orders")) {
 *     log.info("Processing message"); // Logs include correlationId, consumer, queue
 * }
 * </pre>
 */
public class CorrelationContext implements AutoCloseable {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String CONSUMER_KEY = "consumer";
    public static final String QUEUE_KEY = "queue";
    public static final String DELIVERY_TAG_KEY = "deliveryTag";
    public static final String RETRY_COUNT_KEY = "retryCount";

    private final Map<String, String> previousContext;

    private CorrelationContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Creates a new context with a generated correlation ID.
     */
    public static CorrelationContext create() {
        return create(generateId());
    }

    /**
     * Creates a new context with the specified correlation ID.
     */
    public static CorrelationContext create(String correlationId) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return new CorrelationContext(previous);
    }

    /**
     * Continues the correlation ID carried by a message, or creates one if absent.
     */
    public static CorrelationContext continueOrCreate(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return create();
        }
        return create(correlationId);
    }

    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public CorrelationContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public CorrelationContext withConsumer(String consumerName) {
        return with(CONSUMER_KEY, consumerName);
    }

    public CorrelationContext withQueue(String queueName) {
        return with(QUEUE_KEY, queueName);
    }

    public CorrelationContext withDeliveryTag(long deliveryTag) {
        return with(DELIVERY_TAG_KEY, Long.toString(deliveryTag));
    }

    public CorrelationContext withRetryCount(int retryCount) {
        return with(RETRY_COUNT_KEY, Integer.toString(retryCount));
    }

    /**
     * Wraps a Runnable so it runs with the MDC of the calling thread.
     */
    public static Runnable wrap(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
