package com.aporkolab.consumer.spring.autoconfigure;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.consumer.ConsumerConfig;
import com.aporkolab.consumer.dlq.DlqConfig;

/**
 * Configuration properties for the reliable consumer.
 *
 * Example application.yml:
 * <pre>
 * consumer:
 *   enabled: true
 *   name: orders-consumer
 *   prefetch-count: 10
 *   dlq:
 *     enabled: true
 *     max-retries: 3
 *     retry-delay: 5s
 *     dlx-exchange: dlx
 *     dlx-routing-key: orders.dlq
 *     use-exponential-backoff: true
 *   metrics:
 *     enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "consumer")
public class ConsumerProperties {

    private boolean enabled = true;
    private String name = ConsumerConfig.DEFAULT_NAME;
    private boolean autoAck = false;
    private boolean exclusive = false;
    private boolean noLocal = false;
    private int prefetchCount = ConsumerConfig.DEFAULT_PREFETCH_COUNT;
    private DlqProperties dlq = new DlqProperties();
    private MetricsProperties metrics = new MetricsProperties();

    public ConsumerConfig toConsumerConfig() {
        return ConsumerConfig.builder()
                .name(name)
                .autoAck(autoAck)
                .exclusive(exclusive)
                .noLocal(noLocal)
                .prefetchCount(prefetchCount)
                .dlq(dlq.toDlqConfig())
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isAutoAck() {
        return autoAck;
    }

    public void setAutoAck(boolean autoAck) {
        this.autoAck = autoAck;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public void setExclusive(boolean exclusive) {
        this.exclusive = exclusive;
    }

    public boolean isNoLocal() {
        return noLocal;
    }

    public void setNoLocal(boolean noLocal) {
        this.noLocal = noLocal;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    public void setPrefetchCount(int prefetchCount) {
        this.prefetchCount = prefetchCount;
    }

    public DlqProperties getDlq() {
        return dlq;
    }

    public void setDlq(DlqProperties dlq) {
        this.dlq = dlq;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    public static class DlqProperties {
        private boolean enabled = false;
        private int maxRetries = DlqConfig.DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DlqConfig.DEFAULT_RETRY_DELAY;
        private String dlxExchange = DlqConfig.DEFAULT_DLX_EXCHANGE;
        private String dlxRoutingKey = DlqConfig.DEFAULT_DLX_ROUTING_KEY;
        private boolean useExponentialBackoff = true;

        public DlqConfig toDlqConfig() {
            return DlqConfig.builder()
                    .enabled(enabled)
                    .maxRetries(maxRetries)
                    .retryDelay(retryDelay)
                    .dlxExchange(dlxExchange)
                    .dlxRoutingKey(dlxRoutingKey)
                    .useExponentialBackoff(useExponentialBackoff)
                    .build();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public String getDlxExchange() {
            return dlxExchange;
        }

        public void setDlxExchange(String dlxExchange) {
            this.dlxExchange = dlxExchange;
        }

        public String getDlxRoutingKey() {
            return dlxRoutingKey;
        }

        public void setDlxRoutingKey(String dlxRoutingKey) {
            this.dlxRoutingKey = dlxRoutingKey;
        }

        public boolean isUseExponentialBackoff() {
            return useExponentialBackoff;
        }

        public void setUseExponentialBackoff(boolean useExponentialBackoff) {
            this.useExponentialBackoff = useExponentialBackoff;
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
