package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.tools.TopicScheme.ParsedTopic;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hosts simulated rack devices in-process: one command executor with its own queue and
 * worker per configured rack, all fed from a single command subscription.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "rack.simulator.enabled", havingValue = "true")
public class SimulatedDeviceFleet {

    private final MessageTransport transport;
    private final TopicScheme topics;
    private final List<String> rackIds;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;

    private final Map<String, DeviceCommandExecutor> executors = new LinkedHashMap<>();

    public SimulatedDeviceFleet(MessageTransport transport,
                                TopicScheme topics,
                                @Value("${rack.simulator.rack-ids:R1,R2,R3}") List<String> rackIds,
                                @Value("${rack.device.queue-capacity:16}") int queueCapacity,
                                @Value("${rack.device.overflow-policy:DROP_OLDEST}") OverflowPolicy overflowPolicy) {
        this.transport = transport;
        this.topics = topics;
        this.rackIds = rackIds.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
        this.queueCapacity = queueCapacity;
        this.overflowPolicy = overflowPolicy;
    }

    @PostConstruct
    public void start() {
        for (String rackId : rackIds) {
            // validates the id against the topic rules before anything is wired
            topics.commandTopic(rackId, Actuator.DOOR);
            DeviceCommandExecutor executor = new DeviceCommandExecutor(rackId, transport, topics,
                    new SimulatedActuatorDriver(rackId), queueCapacity, overflowPolicy);
            executors.put(rackId, executor);
            executor.start();
        }
        transport.subscribe(topics.allCommandsFilter(), this::route);
        log.info("Simulated device fleet started racks={} queueCapacity={} overflowPolicy={}", rackIds, queueCapacity, overflowPolicy);
    }

    @PreDestroy
    public void stop() {
        executors.values().forEach(DeviceCommandExecutor::stop);
    }

    private void route(String topic, String payload) {
        Optional<ParsedTopic> parsed = topics.parse(topic);
        DeviceCommandExecutor executor = parsed.map(p -> executors.get(p.rackId())).orElse(null);
        if (executor == null) {
            log.debug("No simulated device for topic={}", topic);
            return;
        }
        executor.onCommandMessage(topic, payload);
    }

    public Optional<DeviceCommandExecutor> executor(String rackId) {
        return Optional.ofNullable(executors.get(rackId));
    }

    public Optional<SimulatedActuatorDriver> driver(String rackId) {
        return executor(rackId).map(e -> (SimulatedActuatorDriver) e.driver());
    }

    public List<String> rackIds() {
        return new ArrayList<>(rackIds);
    }
}
