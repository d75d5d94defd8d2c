package com.aporkolab.consumer;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.consumer.broker.BrokerChannel;
import com.aporkolab.consumer.broker.DeliveryStream;
import com.aporkolab.consumer.bulkhead.WorkerBulkhead;
import com.aporkolab.consumer.dlq.DeadLetterPublisher;
import com.aporkolab.consumer.dlq.DlqConfig;
import com.aporkolab.consumer.dlq.DlqTopology;
import com.aporkolab.consumer.exception.ConsumerAlreadyRunningException;
import com.aporkolab.consumer.exception.ConsumerException;
import com.aporkolab.consumer.exception.ConsumerSetupException;

/**
 * {@link Consumer} over a {@link BrokerChannel}.
 *
 * Each consume call starts one dispatcher thread. {@link #consumeWithDlq} fans
 * deliveries out to a cached pool of daemon workers, bounded by a bulkhead sized
 * to the effective prefetch count. The consumer's own stop signal and the
 * caller's token are merged, so either one cancels handlers and backoff waits.
 */
public class RabbitMqConsumer implements Consumer {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqConsumer.class);

    private final BrokerChannel channel;
    private final ConsumerConfig config;
    private final ConsumerListener listener;
    private final AutoCloseable ownedResource;

    private final ReentrantLock lock = new ReentrantLock();
    private final CancellationToken stopSignal = CancellationToken.create();
    private final SingleErrorSlot errors = new SingleErrorSlot();
    private final TaskTracker tracker = new TaskTracker();
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private boolean running;
    private ConsumerState state = ConsumerState.IDLE;

    public RabbitMqConsumer(BrokerChannel channel, ConsumerConfig config) {
        this(channel, config, ConsumerListener.NOOP);
    }

    public RabbitMqConsumer(BrokerChannel channel, ConsumerConfig config, ConsumerListener listener) {
        this(channel, config, listener, null);
    }

    RabbitMqConsumer(BrokerChannel channel, ConsumerConfig config, ConsumerListener listener,
                     AutoCloseable ownedResource) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener == null ? ConsumerListener.NOOP : listener;
        this.ownedResource = ownedResource;
        this.workers = Executors.newCachedThreadPool(workerThreadFactory(config.getName()));
    }

    @Override
    public void consume(CancellationToken token, String queueName, MessageHandler handler) {
        start(token, queueName, handler, false);
    }

    @Override
    public void consumeWithDlq(CancellationToken token, String queueName, MessageHandler handler) {
        start(token, queueName, handler, true);
    }

    private void start(CancellationToken token, String queueName, MessageHandler handler, boolean withDlq) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(handler, "handler");

        lock.lock();
        try {
            if (stopSignal.isCancelled()) {
                throw new IllegalStateException("Consumer '" + config.getName() + "' has been stopped");
            }
            if (running) {
                throw new ConsumerAlreadyRunningException(config.getName());
            }
            running = true;
            state = ConsumerState.RUNNING;
        } finally {
            lock.unlock();
        }

        DeliveryStream stream;
        try {
            stream = subscribe(queueName, withDlq);
        } catch (ConsumerSetupException e) {
            log.error("Consumer {} could not start on {}: {}", config.getName(), queueName, e.getMessage());
            markIdle();
            throw e;
        }

        CancellationToken runToken = CancellationToken.anyOf(token, stopSignal);
        DeliveryDispatcher.Builder dispatcher = DeliveryDispatcher.builder()
                .consumerName(config.getName())
                .queue(queueName)
                .autoAck(config.isAutoAck())
                .stream(stream)
                .token(runToken)
                .handler(handler)
                .tracker(tracker)
                .errors(errors)
                .onExit(this::markIdle)
                .onRelease(runToken::detach);

        if (withDlq) {
            int capacity = Math.max(config.effectivePrefetchCount(), 1);
            WorkerBulkhead bulkhead = WorkerBulkhead.builder()
                    .name(config.getName())
                    .maxConcurrentCalls(capacity)
                    .pollInterval(DeliveryDispatcher.POLL_INTERVAL)
                    .build();
            DeadLetterPublisher publisher = new DeadLetterPublisher(channel, config.getDlq());
            dispatcher.processor(new MessageProcessor(config, publisher, listener))
                    .workers(bulkhead, workers);
        } else {
            dispatcher.processor(new MessageProcessor(config, null, listener));
        }

        tracker.register();
        Thread thread = new Thread(dispatcher.build(), "consumer-" + config.getName() + "-dispatcher");
        thread.start();
        log.info("Consumer {} started on {}", config.getName(), queueName);
    }

    private DeliveryStream subscribe(String queueName, boolean withDlq) {
        String name = config.getName();
        if (withDlq) {
            try {
                channel.qos(config.effectivePrefetchCount());
            } catch (IOException | RuntimeException e) {
                throw ConsumerSetupException.qos(name, queueName, e);
            }
            DlqConfig dlq = config.getDlq();
            if (dlq.isEnabled()) {
                try {
                    new DlqTopology(dlq).ensure(channel);
                } catch (IOException | RuntimeException e) {
                    throw ConsumerSetupException.dlqTopology(name, queueName, e);
                }
            }
        }
        try {
            return channel.consume(queueName, name, config.isAutoAck(), config.isExclusive(), config.isNoLocal());
        } catch (IOException | RuntimeException e) {
            throw ConsumerSetupException.registration(name, queueName, e);
        }
    }

    private void markIdle() {
        lock.lock();
        try {
            running = false;
            state = stopSignal.isCancelled() ? ConsumerState.STOPPED : ConsumerState.IDLE;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ConsumerException> await() throws InterruptedException {
        tracker.awaitIdle();
        return errors.poll();
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            if (stopSignal.isCancelled()) {
                return;
            }
            state = running ? ConsumerState.STOPPING : ConsumerState.STOPPED;
        } finally {
            lock.unlock();
        }
        stopSignal.cancel();
        log.info("Consumer {} stop requested", config.getName());
    }

    @Override
    public ErrorChannel errors() {
        return errors;
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConsumerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public ConsumerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        stop();
        try {
            tracker.awaitIdle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for consumer {} to finish", config.getName());
        }
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdown();
        if (ownedResource != null) {
            try {
                ownedResource.close();
            } catch (Exception e) {
                log.warn("Failed to release resources of consumer {}: {}", config.getName(), e.getMessage());
            }
        }
        log.info("Consumer {} closed", config.getName());
    }

    private static ThreadFactory workerThreadFactory(String consumerName) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "consumer-" + consumerName + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
