package com.sandy.aiot.rack.control.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-process broker. Publishing never calls a listener directly: every matching delivery
 * is queued onto the broker's own delivery thread, like a network client callback.
 */
@Slf4j
public class InMemoryMessageTransport implements MessageTransport {

    private record Subscription(String filter, MessageListener listener) {}

    private static final AtomicInteger INSTANCE_SEQ = new AtomicInteger();

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor;
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile Predicate<String> dropFilter = topic -> false;
    private volatile boolean closed;

    public InMemoryMessageTransport() {
        int seq = INSTANCE_SEQ.incrementAndGet();
        this.deliveryExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "transport-delivery-" + seq);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void publish(String topic, String payload) {
        if (closed) {
            throw new TransportException("Transport closed, cannot publish to " + topic);
        }
        published.incrementAndGet();
        if (dropFilter.test(topic)) {
            dropped.incrementAndGet();
            log.debug("Message dropped by filter topic={} payload={}", topic, payload);
            return;
        }
        for (Subscription sub : subscriptions) {
            if (!TopicFilter.matches(sub.filter(), topic)) continue;
            try {
                deliveryExecutor.execute(() -> deliver(sub, topic, payload));
            } catch (RejectedExecutionException e) {
                throw new TransportException("Transport closed while publishing to " + topic, e);
            }
        }
    }

    private void deliver(Subscription sub, String topic, String payload) {
        try {
            sub.listener().onMessage(topic, payload);
        } catch (Exception e) {
            log.warn("Listener failed filter={} topic={} error={}:{}", sub.filter(), topic, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    @Override
    public void subscribe(String topicFilter, MessageListener listener) {
        subscriptions.add(new Subscription(topicFilter, listener));
        log.info("In-memory subscription registered filter={}", topicFilter);
    }

    /**
     * Simulates message loss: publishes to topics matching the predicate are silently
     * discarded. Pass {@code topic -> false} to restore delivery.
     */
    public void setDropFilter(Predicate<String> dropFilter) {
        this.dropFilter = dropFilter == null ? topic -> false : dropFilter;
    }

    public long publishedCount() {
        return published.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        subscriptions.clear();
    }
}
