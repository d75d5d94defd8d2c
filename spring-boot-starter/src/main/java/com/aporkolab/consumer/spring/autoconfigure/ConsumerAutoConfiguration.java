package com.aporkolab.consumer.spring.autoconfigure;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.aporkolab.consumer.ConsumerConfig;
import com.aporkolab.consumer.ConsumerListener;
import com.aporkolab.consumer.RabbitConsumerFactory;
import com.aporkolab.consumer.metrics.ConsumerMetrics;
import com.rabbitmq.client.Connection;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot Auto-Configuration for the reliable consumer.
 *
 * Automatically configures:
 * - ConsumerConfig from consumer.* properties
 * - RabbitConsumerFactory when a RabbitMQ Connection bean exists
 * - ConsumerMetrics when a MeterRegistry bean exists
 *
 * Disable with: consumer.enabled=false
 */
@AutoConfiguration
@EnableConfigurationProperties(ConsumerProperties.class)
@ConditionalOnProperty(prefix = "consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConsumerConfig consumerConfig(ConsumerProperties properties) {
        return properties.toConsumerConfig();
    }

    @Bean
    @ConditionalOnBean(Connection.class)
    @ConditionalOnMissingBean
    public RabbitConsumerFactory rabbitConsumerFactory(Connection connection, ConsumerConfig consumerConfig,
                                                       ObjectProvider<ConsumerListener> listeners) {
        return new RabbitConsumerFactory(connection, consumerConfig,
                listeners.getIfUnique(() -> ConsumerListener.NOOP));
    }

    // ==================== METRICS ====================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "consumer.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ConsumerMetrics consumerMetrics(MeterRegistry registry) {
            return new ConsumerMetrics(registry);
        }
    }
}
