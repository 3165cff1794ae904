package com.sandy.aiot.rack.control.service.impl;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.AlarmState;
import com.sandy.aiot.rack.control.model.CommandHandle;
import com.sandy.aiot.rack.control.model.CommandKey;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.CommandResultSink;
import com.sandy.aiot.rack.control.model.IssueResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.PendingCommand;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.service.CommandDispatcher;
import com.sandy.aiot.rack.control.service.CommandResolutionListener;
import com.sandy.aiot.rack.control.tools.PayloadParser;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending-command table and rack store behind a single lock. The issuing path, the ack
 * path (transport thread) and the expiry sweep (scheduler thread) all go through it.
 * Sinks, listeners and transport publishes always run after the lock is released.
 * Racks are created by telemetry or a matched ack, never by issuing a command.
 */
@Service
@Slf4j
public class AckTrackingCommandDispatcher implements CommandDispatcher {

    private final MessageTransport transport;
    private final TopicScheme topics;
    private final Clock clock;
    private final Duration timeout;
    private final List<CommandResolutionListener> listeners;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CommandKey, PendingCommand> pending = new HashMap<>();
    private final Map<String, MutableRack> racks = new HashMap<>();

    public AckTrackingCommandDispatcher(MessageTransport transport,
                                        TopicScheme topics,
                                        Clock clock,
                                        @Value("${rack.command.timeout-ms:5000}") long timeoutMs,
                                        List<CommandResolutionListener> listeners) {
        if (timeoutMs <= 0) throw new IllegalArgumentException("rack.command.timeout-ms must be positive");
        this.transport = transport;
        this.topics = topics;
        this.clock = clock;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        log.info("Command dispatcher ready timeoutMs={} listeners={}", timeoutMs, this.listeners.size());
    }

    @Override
    public IssueResult issue(String rackId, Actuator actuator, int desiredValue, CommandResultSink sink) {
        Objects.requireNonNull(rackId, "rackId");
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(sink, "sink");
        if (!actuator.accepts(desiredValue)) {
            throw new IllegalArgumentException("Value " + desiredValue + " out of range for " + actuator);
        }
        String topic = topics.commandTopic(rackId, actuator);
        CommandKey key = new CommandKey(rackId, actuator);
        Instant now = clock.instant();
        PendingCommand overdue = null;
        PendingCommand command;
        lock.lock();
        try {
            PendingCommand existing = pending.get(key);
            if (existing != null) {
                if (!existing.isExpiredAt(now)) {
                    log.debug("Command rejected key={} desired={} blockedBy={}", key, desiredValue, existing.getCommandId());
                    return IssueResult.rejected(existing.getCommandId(),
                            "Command " + existing.getCommandId() + " for " + key + " still awaiting acknowledgment");
                }
                // overdue but not yet swept: expire it now so the new command can take the slot
                pending.remove(key);
                existing.expire(now);
                overdue = existing;
            }
            command = new PendingCommand(UUID.randomUUID().toString(), rackId, actuator, desiredValue,
                    now, now.plus(timeout), sink);
            pending.put(key, command);
        } finally {
            lock.unlock();
        }
        if (overdue != null) {
            log.info("Command expired id={} key={} desired={} (superseded after deadline)", overdue.getCommandId(), key, overdue.getDesiredValue());
            deliver(overdue);
        }
        publish(topic, command);
        return IssueResult.accepted(command.toHandle());
    }

    private void publish(String topic, PendingCommand command) {
        try {
            transport.publish(topic, PayloadParser.encode(command.getDesiredValue()));
            log.info("Command sent id={} topic={} desired={} deadline={}", command.getCommandId(), topic, command.getDesiredValue(), command.getDeadline());
        } catch (Exception e) {
            // stays pending; a lost publish resolves through expiry like any lost message
            log.warn("Command publish failed id={} topic={} error={}:{}", command.getCommandId(), topic, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    @Override
    public boolean onAckReceived(String rackId, Actuator actuator, int achievedValue) {
        if (rackId == null || actuator == null) return false;
        CommandKey key = new CommandKey(rackId, actuator);
        Instant now = clock.instant();
        int value = actuator.clamp(achievedValue);
        PendingCommand command;
        boolean acknowledged;
        lock.lock();
        try {
            command = pending.get(key);
            if (command == null) {
                log.info("Unmatched ack discarded key={} achieved={}", key, achievedValue);
                return false;
            }
            pending.remove(key);
            if (command.isExpiredAt(now)) {
                command.expire(now);
                acknowledged = false;
            } else {
                command.acknowledge(value, now);
                racks.computeIfAbsent(rackId, MutableRack::new).applyConfirmed(actuator, value, now);
                acknowledged = true;
            }
        } finally {
            lock.unlock();
        }
        if (acknowledged) {
            if (value != command.getDesiredValue()) {
                log.warn("Command acknowledged with different value id={} key={} desired={} achieved={}",
                        command.getCommandId(), key, command.getDesiredValue(), value);
            } else {
                log.info("Command acknowledged id={} key={} achieved={} latencyMs={}",
                        command.getCommandId(), key, value, Duration.between(command.getIssuedAt(), now).toMillis());
            }
        } else {
            log.info("Late ack after deadline, command expired id={} key={} achieved={}", command.getCommandId(), key, value);
        }
        deliver(command);
        return acknowledged;
    }

    @Scheduled(fixedRateString = "${rack.command.sweep-interval-ms:500}")
    public void scheduledSweep() {
        sweepExpired(clock.instant());
    }

    @Override
    public int sweepExpired(Instant now) {
        List<PendingCommand> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<PendingCommand> it = pending.values().iterator();
            while (it.hasNext()) {
                PendingCommand command = it.next();
                if (command.isExpiredAt(now)) {
                    it.remove();
                    command.expire(now);
                    expired.add(command);
                }
            }
        } finally {
            lock.unlock();
        }
        for (PendingCommand command : expired) {
            log.warn("Command expired id={} key={} desired={} issuedAt={} deadline={}",
                    command.getCommandId(), command.key(), command.getDesiredValue(), command.getIssuedAt(), command.getDeadline());
            deliver(command);
        }
        return expired.size();
    }

    private void deliver(PendingCommand command) {
        CommandResult result = command.toResult();
        try {
            command.getResultSink().onResult(result);
        } catch (Exception e) {
            log.error("Result sink failed id={} key={} error={}:{}", command.getCommandId(), command.key(), e.getClass().getSimpleName(), e.getMessage(), e);
        }
        for (CommandResolutionListener listener : listeners) {
            try {
                listener.onResolved(result);
            } catch (Exception e) {
                log.error("Resolution listener {} failed id={} error={}", listener.getClass().getSimpleName(), command.getCommandId(), e.getMessage());
            }
        }
    }

    @Override
    public void recordTelemetry(String rackId, Metric metric, double value, Instant at) {
        lock.lock();
        try {
            racks.computeIfAbsent(rackId, MutableRack::new).applyReading(metric, value, at);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordDoorStatus(String rackId, boolean doorOpen, Instant at) {
        lock.lock();
        try {
            MutableRack rack = racks.computeIfAbsent(rackId, MutableRack::new);
            rack.doorOpen = doorOpen;
            rack.lastTelemetryAt = at;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordLocation(String rackId, double latitude, double longitude, Instant at) {
        lock.lock();
        try {
            MutableRack rack = racks.computeIfAbsent(rackId, MutableRack::new);
            rack.latitude = latitude;
            rack.longitude = longitude;
            rack.lastTelemetryAt = at;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RackSnapshot> rack(String rackId) {
        lock.lock();
        try {
            MutableRack rack = racks.get(rackId);
            return rack == null ? Optional.empty() : Optional.of(rack.snapshot());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<RackSnapshot> racks() {
        List<RackSnapshot> result = new ArrayList<>();
        lock.lock();
        try {
            for (MutableRack rack : racks.values()) {
                result.add(rack.snapshot());
            }
        } finally {
            lock.unlock();
        }
        result.sort(Comparator.comparing(RackSnapshot::rackId));
        return result;
    }

    @Override
    public List<CommandHandle> pendingCommands() {
        List<CommandHandle> result = new ArrayList<>();
        lock.lock();
        try {
            for (PendingCommand command : pending.values()) {
                result.add(command.toHandle());
            }
        } finally {
            lock.unlock();
        }
        result.sort(Comparator.comparing(CommandHandle::issuedAt));
        return result;
    }

    /** Rack state owned by the dispatcher; only touched with the lock held. */
    private static final class MutableRack {
        private final String rackId;
        private Double temperature;
        private Double humidity;
        private boolean doorOpen;
        private boolean ventilationOn;
        private AlarmState alarmState = AlarmState.OFF;
        private boolean breakInLatched;
        private Double latitude;
        private Double longitude;
        private Instant lastTelemetryAt;
        private Instant lastAckAt;

        private MutableRack(String rackId) {
            this.rackId = rackId;
        }

        void applyConfirmed(Actuator actuator, int value, Instant at) {
            switch (actuator) {
                case DOOR -> doorOpen = value == 1;
                case VENTILATION -> ventilationOn = value == 1;
                case ALARM -> {
                    alarmState = AlarmState.fromCode(value);
                    // only an operator-confirmed OFF releases a break-in
                    if (alarmState == AlarmState.BREAK_IN) breakInLatched = true;
                    if (alarmState == AlarmState.OFF) breakInLatched = false;
                }
            }
            lastAckAt = at;
        }

        void applyReading(Metric metric, double value, Instant at) {
            switch (metric) {
                case TEMPERATURE -> temperature = value;
                case HUMIDITY -> humidity = value;
            }
            lastTelemetryAt = at;
        }

        RackSnapshot snapshot() {
            return new RackSnapshot(rackId, temperature, humidity, doorOpen, ventilationOn, alarmState,
                    breakInLatched, latitude, longitude, lastTelemetryAt, lastAckAt);
        }
    }
}
