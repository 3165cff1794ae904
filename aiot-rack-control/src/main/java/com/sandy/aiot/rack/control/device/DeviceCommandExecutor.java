package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.tools.PayloadParser;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.tools.TopicScheme.Channel;
import com.sandy.aiot.rack.control.tools.TopicScheme.ParsedTopic;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Device-resident command handling for one rack. The transport callback only parses and
 * offers onto a bounded queue; a single worker thread drains it, drives the actuator and
 * publishes the ack with the value the hardware reached.
 */
@Slf4j
public class DeviceCommandExecutor {

    private final String rackId;
    private final MessageTransport transport;
    private final TopicScheme topics;
    private final ActuatorDriver driver;
    private final OverflowPolicy overflowPolicy;
    private final BlockingQueue<DeviceCommand> queue;

    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong applied = new AtomicLong();
    private volatile Thread worker;
    private volatile boolean running;

    public DeviceCommandExecutor(String rackId, MessageTransport transport, TopicScheme topics,
                                 ActuatorDriver driver, int queueCapacity, OverflowPolicy overflowPolicy) {
        if (queueCapacity < 1) throw new IllegalArgumentException("queue capacity must be at least 1");
        this.rackId = Objects.requireNonNull(rackId, "rackId");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.overflowPolicy = overflowPolicy == null ? OverflowPolicy.DROP_OLDEST : overflowPolicy;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    /**
     * Transport delivery callback. Never blocks: malformed commands and overflow are
     * logged and dropped.
     */
    public void onCommandMessage(String topic, String payload) {
        Optional<ParsedTopic> parsed = topics.parse(topic);
        if (parsed.isEmpty() || parsed.get().channel() != Channel.COMMAND || !rackId.equals(parsed.get().rackId())) {
            log.warn("Device {} ignoring topic={}", rackId, topic);
            return;
        }
        Optional<Actuator> actuator = Actuator.fromSegment(parsed.get().segment());
        OptionalInt value = PayloadParser.parseInteger(payload);
        if (actuator.isEmpty() || value.isEmpty()) {
            log.warn("Device {} malformed command dropped topic={} payload={}", rackId, topic, payload);
            return;
        }
        enqueue(new DeviceCommand(actuator.get(), value.getAsInt()));
    }

    /**
     * @return false when the command itself was discarded
     */
    public boolean enqueue(DeviceCommand command) {
        if (queue.offer(command)) {
            return true;
        }
        dropped.incrementAndGet();
        if (overflowPolicy == OverflowPolicy.DROP_NEWEST) {
            log.error("QueueOverflow rackId={} capacity={} dropped newest command={}", rackId, capacityOf(), command);
            return false;
        }
        DeviceCommand evicted = queue.poll();
        log.error("QueueOverflow rackId={} capacity={} dropped oldest command={}", rackId, capacityOf(), evicted);
        if (!queue.offer(command)) {
            // worker did not free a slot and another producer took the one we made
            dropped.incrementAndGet();
            log.error("QueueOverflow rackId={} dropped newest command={} after eviction", rackId, command);
            return false;
        }
        return true;
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        Thread t = new Thread(this::runLoop, "device-" + rackId);
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("Device executor started rackId={} capacity={} overflowPolicy={}", rackId, capacityOf(), overflowPolicy);
    }

    public synchronized void stop() {
        running = false;
        Thread t = worker;
        worker = null;
        if (t == null) return;
        t.interrupt();
        try {
            t.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Device executor stopped rackId={} pending={}", rackId, queue.size());
    }

    private void runLoop() {
        while (running) {
            DeviceCommand command;
            try {
                command = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            process(command);
        }
    }

    /** Applies one command and publishes its ack. Visible for tests that drive the device synchronously. */
    void process(DeviceCommand command) {
        int achieved;
        try {
            achieved = driver.apply(command.actuator(), command.value());
        } catch (RuntimeException e) {
            log.error("Actuator failed rackId={} command={} error={}", rackId, command, e.getMessage());
            return;
        }
        applied.incrementAndGet();
        String ackTopic = topics.ackTopic(rackId, command.actuator());
        try {
            transport.publish(ackTopic, PayloadParser.encode(achieved));
            log.debug("Ack published rackId={} topic={} achieved={}", rackId, ackTopic, achieved);
        } catch (RuntimeException e) {
            log.warn("Ack publish failed rackId={} topic={} error={}", rackId, ackTopic, e.getMessage());
        }
    }

    private int capacityOf() {
        return queue.size() + queue.remainingCapacity();
    }

    public String rackId() {
        return rackId;
    }

    public ActuatorDriver driver() {
        return driver;
    }

    public int queuedCount() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long appliedCount() {
        return applied.get();
    }
}
