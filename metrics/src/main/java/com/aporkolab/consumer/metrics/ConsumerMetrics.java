package com.aporkolab.consumer.metrics;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.aporkolab.consumer.ConsumerListener;
import com.aporkolab.consumer.MessageOutcome;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer metrics for message consumption, fed through {@link ConsumerListener}.
 *
 * Provides the following metrics, tagged with consumer and queue:
 * - consumer_messages_total: settled messages by result (acked, retried, dead_lettered, requeued)
 * - consumer_handler_failures_total: handler invocations that threw
 * - consumer_handler_duration: handler execution time
 * - consumer_retry_attempts: scheduled retries by attempt number
 * - consumer_in_flight: handlers currently running
 */
public class ConsumerMetrics implements ConsumerListener {

    private static final String METRIC_PREFIX = "consumer";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final ConcurrentMap<Tags, AtomicInteger> inFlight = new ConcurrentHashMap<>();

    public ConsumerMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public ConsumerMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;
    }

    @Override
    public void onHandlerStarted(String consumer, String queue) {
        inFlightFor(tags(consumer, queue)).incrementAndGet();
    }

    @Override
    public void onHandlerCompleted(String consumer, String queue, Duration duration, Throwable failure) {
        Tags tags = tags(consumer, queue);
        inFlightFor(tags).decrementAndGet();

        Timer.builder(METRIC_PREFIX + "_handler_duration")
                .description("Time spent in message handlers")
                .tags(tags.and("outcome", failure == null ? "success" : "failure"))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);

        if (failure != null) {
            Counter.builder(METRIC_PREFIX + "_handler_failures_total")
                    .description("Handler invocations that threw")
                    .tags(tags.and("exception", failure.getClass().getSimpleName()))
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void onRetryScheduled(String consumer, String queue, int attempt, Duration delay) {
        Counter.builder(METRIC_PREFIX + "_retry_attempts")
                .description("Retries scheduled by attempt number")
                .tags(tags(consumer, queue).and("attempt", String.valueOf(attempt)))
                .register(registry)
                .increment();
    }

    @Override
    public void onOutcome(String consumer, String queue, MessageOutcome outcome) {
        Counter.builder(METRIC_PREFIX + "_messages_total")
                .description("Messages settled by the consumer")
                .tags(tags(consumer, queue).and("result", outcome.tag()))
                .register(registry)
                .increment();
    }

    /**
     * Total settled messages with the given result across all consumers and queues.
     */
    public double getMessageCount(MessageOutcome outcome) {
        return registry.find(METRIC_PREFIX + "_messages_total")
                .tag("result", outcome.tag())
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public int getInFlight(String consumer, String queue) {
        AtomicInteger gauge = inFlight.get(tags(consumer, queue));
        return gauge == null ? 0 : gauge.get();
    }

    private AtomicInteger inFlightFor(Tags tags) {
        return inFlight.computeIfAbsent(tags, t -> {
            AtomicInteger counter = new AtomicInteger(0);
            Gauge.builder(METRIC_PREFIX + "_in_flight", counter, AtomicInteger::get)
                    .description("Message handlers currently running")
                    .tags(t)
                    .register(registry);
            return counter;
        });
    }

    private Tags tags(String consumer, String queue) {
        return baseTags.and("consumer", consumer, "queue", queue);
    }
}
