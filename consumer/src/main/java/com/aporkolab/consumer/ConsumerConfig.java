package com.aporkolab.consumer;

import java.util.Objects;

import com.aporkolab.consumer.dlq.DlqConfig;

/**
 * Immutable consumer settings. Build with {@link #builder()}.
 *
 * A prefetch count of zero or less means {@link #DEFAULT_PREFETCH_COUNT}. The
 * effective prefetch also caps how many messages are processed concurrently.
 */
public final class ConsumerConfig {

    public static final int DEFAULT_PREFETCH_COUNT = 5;
    public static final String DEFAULT_NAME = "default_consumer";

    private final String name;
    private final boolean autoAck;
    private final boolean exclusive;
    private final boolean noLocal;
    private final int prefetchCount;
    private final DlqConfig dlq;

    private ConsumerConfig(Builder builder) {
        this.name = builder.name;
        this.autoAck = builder.autoAck;
        this.exclusive = builder.exclusive;
        this.noLocal = builder.noLocal;
        this.prefetchCount = builder.prefetchCount;
        this.dlq = builder.dlq;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConsumerConfig defaults() {
        return builder().build();
    }

    public int effectivePrefetchCount() {
        return prefetchCount > 0 ? prefetchCount : DEFAULT_PREFETCH_COUNT;
    }

    public String getName() { return name; }
    public boolean isAutoAck() { return autoAck; }
    public boolean isExclusive() { return exclusive; }
    public boolean isNoLocal() { return noLocal; }
    public int getPrefetchCount() { return prefetchCount; }
    public DlqConfig getDlq() { return dlq; }

    @Override
    public String toString() {
        return "ConsumerConfig{name='" + name + "', autoAck=" + autoAck + ", exclusive=" + exclusive
                + ", noLocal=" + noLocal + ", prefetchCount=" + prefetchCount + ", dlq=" + dlq + "}";
    }

    public static class Builder {
        private String name = DEFAULT_NAME;
        private boolean autoAck;
        private boolean exclusive;
        private boolean noLocal;
        private int prefetchCount;
        private DlqConfig dlq = DlqConfig.disabled();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder autoAck(boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder noLocal(boolean noLocal) {
            this.noLocal = noLocal;
            return this;
        }

        public Builder prefetchCount(int prefetchCount) {
            this.prefetchCount = prefetchCount;
            return this;
        }

        public Builder dlq(DlqConfig dlq) {
            this.dlq = dlq;
            return this;
        }

        public ConsumerConfig build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(dlq, "dlq");
            return new ConsumerConfig(this);
        }
    }
}
