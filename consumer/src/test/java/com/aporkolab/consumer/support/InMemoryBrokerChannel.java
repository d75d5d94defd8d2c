package com.aporkolab.consumer.support;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import com.aporkolab.consumer.broker.Acknowledger;
import com.aporkolab.consumer.broker.BrokerChannel;
import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.broker.DeliveryStream;
import com.aporkolab.consumer.broker.OutboundMessage;

/**
 * Broker stand-in for engine tests. Publishing to the default exchange enqueues
 * into the queue named by the routing key; everything else is only recorded.
 */
public class InMemoryBrokerChannel implements BrokerChannel, Acknowledger {

    public record Published(String exchange, String routingKey, OutboundMessage message) {}

    public record Subscription(String queue, String consumerName, boolean autoAck, boolean exclusive,
                               boolean noLocal) {}

    private final Map<String, BlockingQueue<Delivery>> queues = new ConcurrentHashMap<>();
    private final AtomicLong tags = new AtomicLong();

    private final List<Published> published = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<FakeStream> streams = new CopyOnWriteArrayList<>();
    private final List<String> declarations = new CopyOnWriteArrayList<>();
    private final List<Long> acked = new CopyOnWriteArrayList<>();
    private final List<Long> requeued = new CopyOnWriteArrayList<>();
    private final List<Long> rejected = new CopyOnWriteArrayList<>();
    private volatile Integer prefetch;

    private volatile IOException consumeFailure;
    private volatile IOException qosFailure;
    private volatile IOException declareFailure;
    private volatile IOException publishFailure;

    public long enqueue(String queue, byte[] body) {
        return enqueue(queue, body, Map.of(), null);
    }

    public long enqueue(String queue, byte[] body, Map<String, Object> headers, String correlationId) {
        long tag = tags.incrementAndGet();
        queueFor(queue).add(Delivery.builder()
                .deliveryTag(tag)
                .exchange("orders-exchange")
                .routingKey(queue)
                .body(body)
                .headers(headers)
                .contentType("application/json")
                .deliveryMode(Delivery.PERSISTENT_DELIVERY_MODE)
                .correlationId(correlationId)
                .acknowledger(this)
                .build());
        return tag;
    }

    @Override
    public DeliveryStream consume(String queue, String consumerName, boolean autoAck,
                                  boolean exclusive, boolean noLocal) throws IOException {
        if (consumeFailure != null) {
            throw consumeFailure;
        }
        subscriptions.add(new Subscription(queue, consumerName, autoAck, exclusive, noLocal));
        FakeStream stream = new FakeStream(queueFor(queue));
        streams.add(stream);
        return stream;
    }

    @Override
    public void qos(int prefetchCount) throws IOException {
        if (qosFailure != null) {
            throw qosFailure;
        }
        prefetch = prefetchCount;
    }

    @Override
    public void declareExchange(String name, String type, boolean durable, boolean autoDelete) throws IOException {
        if (declareFailure != null) {
            throw declareFailure;
        }
        declarations.add("exchange:" + name + ":" + type + ":durable=" + durable);
    }

    @Override
    public void declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive) throws IOException {
        declarations.add("queue:" + name + ":durable=" + durable);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        declarations.add("bind:" + queue + "->" + exchange + ":" + routingKey);
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message) throws IOException {
        if (publishFailure != null) {
            throw publishFailure;
        }
        published.add(new Published(exchange, routingKey, message));
        if (exchange.isEmpty()) {
            long tag = tags.incrementAndGet();
            queueFor(routingKey).add(Delivery.builder()
                    .deliveryTag(tag)
                    .exchange(exchange)
                    .routingKey(routingKey)
                    .body(message.body())
                    .headers(message.headers())
                    .contentType(message.contentType())
                    .priority(message.priority())
                    .deliveryMode(message.persistent() ? Delivery.PERSISTENT_DELIVERY_MODE : null)
                    .correlationId(message.correlationId())
                    .messageId(message.messageId())
                    .acknowledger(this)
                    .build());
        }
    }

    @Override
    public void ack(long deliveryTag) {
        acked.add(deliveryTag);
    }

    @Override
    public void nack(long deliveryTag, boolean requeue) {
        (requeue ? requeued : rejected).add(deliveryTag);
    }

    /** Simulates the broker cancelling every active subscription. */
    public void closeStreamsFromBroker() {
        streams.forEach(s -> s.closed = true);
    }

    public List<Published> publishedTo(String exchange) {
        return published.stream().filter(p -> p.exchange().equals(exchange)).collect(Collectors.toList());
    }

    public int pending(String queue) {
        return queueFor(queue).size();
    }

    private BlockingQueue<Delivery> queueFor(String queue) {
        return queues.computeIfAbsent(queue, q -> new LinkedBlockingQueue<>());
    }

    public List<Published> getPublished() { return published; }
    public List<Subscription> getSubscriptions() { return subscriptions; }
    public List<String> getDeclarations() { return declarations; }
    public List<Long> getAcked() { return acked; }
    public List<Long> getRequeued() { return requeued; }
    public List<Long> getRejected() { return rejected; }
    public Integer getPrefetch() { return prefetch; }
    public int getCancelledStreams() { return (int) streams.stream().filter(s -> s.cancelled).count(); }

    public void failConsume(IOException e) { this.consumeFailure = e; }
    public void failQos(IOException e) { this.qosFailure = e; }
    public void failDeclare(IOException e) { this.declareFailure = e; }
    public void failPublish(IOException e) { this.publishFailure = e; }

    private static final class FakeStream implements DeliveryStream {

        private final BlockingQueue<Delivery> source;
        private volatile boolean closed;
        private volatile boolean cancelled;

        FakeStream(BlockingQueue<Delivery> source) {
            this.source = source;
        }

        @Override
        public String getConsumerTag() {
            return "fake-" + System.identityHashCode(this);
        }

        @Override
        public Delivery poll(Duration timeout) throws InterruptedException {
            if (closed) {
                return null;
            }
            return source.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void cancel() {
            cancelled = true;
            closed = true;
        }
    }
}
