package com.aporkolab.consumer.dlq;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and dead-letter policy for a consumer.
 *
 * When enabled, a failing message is republished to its queue until it has been
 * retried {@code maxRetries} times, then routed to {@code dlxExchange} with
 * {@code dlxRoutingKey}. The routing key doubles as the dead-letter queue name.
 */
public final class DlqConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
    public static final String DEFAULT_DLX_EXCHANGE = "dlx";
    public static final String DEFAULT_DLX_ROUTING_KEY = "dlq";

    // 2^30 is the largest multiplier that still fits an int shift
    static final int MAX_BACKOFF_EXPONENT = 30;

    private final boolean enabled;
    private final int maxRetries;
    private final Duration retryDelay;
    private final String dlxExchange;
    private final String dlxRoutingKey;
    private final boolean useExponentialBackoff;

    private DlqConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.dlxExchange = builder.dlxExchange;
        this.dlxRoutingKey = builder.dlxRoutingKey;
        this.useExponentialBackoff = builder.useExponentialBackoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Enabled, 3 retries, 5 second exponential backoff, exchange {@code dlx}, queue {@code dlq}.
     */
    public static DlqConfig defaults() {
        return builder().build();
    }

    public static DlqConfig disabled() {
        return builder().enabled(false).build();
    }

    /**
     * Delay before the retry that follows {@code attempt} previous retries.
     * Exponential mode doubles per attempt, with the attempt clamped to [0, 30].
     */
    public Duration calculateBackoff(int attempt) {
        if (!useExponentialBackoff) {
            return retryDelay;
        }
        int exponent = Math.max(0, Math.min(attempt, MAX_BACKOFF_EXPONENT));
        try {
            return retryDelay.multipliedBy(1L << exponent);
        } catch (ArithmeticException e) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
    }

    public Builder toBuilder() {
        return builder()
                .enabled(enabled)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .dlxExchange(dlxExchange)
                .dlxRoutingKey(dlxRoutingKey)
                .useExponentialBackoff(useExponentialBackoff);
    }

    public boolean isEnabled() { return enabled; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public String getDlxExchange() { return dlxExchange; }
    public String getDlxRoutingKey() { return dlxRoutingKey; }
    public boolean isUseExponentialBackoff() { return useExponentialBackoff; }

    @Override
    public String toString() {
        return "DlqConfig{enabled=" + enabled + ", maxRetries=" + maxRetries + ", retryDelay=" + retryDelay
                + ", dlxExchange='" + dlxExchange + "', dlxRoutingKey='" + dlxRoutingKey
                + "', exponential=" + useExponentialBackoff + "}";
    }

    public static class Builder {
        private boolean enabled = true;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private String dlxExchange = DEFAULT_DLX_EXCHANGE;
        private String dlxRoutingKey = DEFAULT_DLX_ROUTING_KEY;
        private boolean useExponentialBackoff = true;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder dlxExchange(String dlxExchange) {
            this.dlxExchange = dlxExchange;
            return this;
        }

        public Builder dlxRoutingKey(String dlxRoutingKey) {
            this.dlxRoutingKey = dlxRoutingKey;
            return this;
        }

        public Builder useExponentialBackoff(boolean useExponentialBackoff) {
            this.useExponentialBackoff = useExponentialBackoff;
            return this;
        }

        public DlqConfig build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
            }
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative, was " + retryDelay);
            }
            if (enabled) {
                if (dlxExchange == null || dlxExchange.isBlank()) {
                    throw new IllegalArgumentException("dlxExchange is required when the DLQ is enabled");
                }
                if (dlxRoutingKey == null || dlxRoutingKey.isBlank()) {
                    throw new IllegalArgumentException("dlxRoutingKey is required when the DLQ is enabled");
                }
            }
            return new DlqConfig(this);
        }
    }
}
