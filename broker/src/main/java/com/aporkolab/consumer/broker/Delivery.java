package com.aporkolab.consumer.broker;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message received from the broker together with the means to settle it.
 *
 * Headers are exposed read-only. Numeric header values may arrive as any integer
 * width depending on the publisher, so readers should go through {@link Number}.
 * Whether a second ack/nack of the same delivery is harmless is up to the broker.
 */
public final class Delivery {

    /** AMQP delivery mode marking a message as persistent. */
    public static final int PERSISTENT_DELIVERY_MODE = 2;

    private final long deliveryTag;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;
    private final byte[] body;
    private final Map<String, Object> headers;
    private final String contentType;
    private final Integer priority;
    private final Integer deliveryMode;
    private final String correlationId;
    private final String messageId;
    private final Acknowledger acknowledger;

    private Delivery(Builder builder) {
        this.deliveryTag = builder.deliveryTag;
        this.exchange = builder.exchange == null ? "" : builder.exchange;
        this.routingKey = builder.routingKey == null ? "" : builder.routingKey;
        this.redelivered = builder.redelivered;
        this.body = builder.body == null ? new byte[0] : builder.body;
        this.headers = builder.headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(builder.headers));
        this.contentType = builder.contentType;
        this.priority = builder.priority;
        this.deliveryMode = builder.deliveryMode;
        this.correlationId = builder.correlationId;
        this.messageId = builder.messageId;
        this.acknowledger = Objects.requireNonNull(builder.acknowledger, "acknowledger");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Positively acknowledges this delivery only (never "multiple").
     */
    public void ack() throws IOException {
        acknowledger.ack(deliveryTag);
    }

    /**
     * Negatively acknowledges this delivery only.
     */
    public void nack(boolean requeue) throws IOException {
        acknowledger.nack(deliveryTag, requeue);
    }

    public boolean isPersistent() {
        return deliveryMode != null && deliveryMode == PERSISTENT_DELIVERY_MODE;
    }

    public long getDeliveryTag() { return deliveryTag; }
    public String getExchange() { return exchange; }
    public String getRoutingKey() { return routingKey; }
    public boolean isRedelivered() { return redelivered; }
    public byte[] getBody() { return body; }
    public Map<String, Object> getHeaders() { return headers; }
    public String getContentType() { return contentType; }
    public Integer getPriority() { return priority; }
    public Integer getDeliveryMode() { return deliveryMode; }
    public String getCorrelationId() { return correlationId; }
    public String getMessageId() { return messageId; }

    @Override
    public String toString() {
        return "Delivery{tag=" + deliveryTag + ", exchange='" + exchange + "', routingKey='" + routingKey
                + "', redelivered=" + redelivered + ", bytes=" + body.length + "}";
    }

    public static class Builder {
        private long deliveryTag;
        private String exchange;
        private String routingKey;
        private boolean redelivered;
        private byte[] body;
        private Map<String, Object> headers;
        private String contentType;
        private Integer priority;
        private Integer deliveryMode;
        private String correlationId;
        private String messageId;
        private Acknowledger acknowledger;

        public Builder deliveryTag(long deliveryTag) {
            this.deliveryTag = deliveryTag;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder redelivered(boolean redelivered) {
            this.redelivered = redelivered;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder deliveryMode(Integer deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder acknowledger(Acknowledger acknowledger) {
            this.acknowledger = acknowledger;
            return this;
        }

        public Delivery build() {
            return new Delivery(this);
        }
    }
}
