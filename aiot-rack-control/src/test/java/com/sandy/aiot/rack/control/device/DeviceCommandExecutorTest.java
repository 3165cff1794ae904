package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.MutableClock;
import com.sandy.aiot.rack.control.RecordingTransport;
import com.sandy.aiot.rack.control.RecordingTransport.Published;
import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.CommandOutcome;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.service.impl.AckTrackingCommandDispatcher;
import com.sandy.aiot.rack.control.tools.PayloadParser;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class DeviceCommandExecutorTest {

    final TopicScheme topics = new TopicScheme("racks");
    RecordingTransport transport;
    SimulatedActuatorDriver driver;
    DeviceCommandExecutor executor;

    @BeforeEach
    void setup() {
        transport = new RecordingTransport();
        driver = new SimulatedActuatorDriver("R1");
    }

    @AfterEach
    void tearDown() {
        if (executor != null) executor.stop();
    }

    private DeviceCommandExecutor newExecutor(int capacity, OverflowPolicy policy) {
        executor = new DeviceCommandExecutor("R1", transport, topics, driver, capacity, policy);
        return executor;
    }

    private List<String> ackTopics() {
        return transport.published().stream().map(Published::topic).filter(t -> t.contains("/ack/")).toList();
    }

    @Test
    void dropOldestKeepsNewestCommands() {
        newExecutor(2, OverflowPolicy.DROP_OLDEST);
        executor.onCommandMessage("racks/R1/command/door", "1");
        executor.onCommandMessage("racks/R1/command/ventilation", "1");
        executor.onCommandMessage("racks/R1/command/buzzer", "2");
        assertEquals(2, executor.queuedCount());
        assertEquals(1, executor.droppedCount());

        executor.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> ackTopics().size() == 2);
        assertEquals(List.of("racks/R1/ack/ventilation", "racks/R1/ack/buzzer"), ackTopics());
        assertEquals(0, driver.currentValue(Actuator.DOOR));
        assertEquals(2, driver.currentValue(Actuator.ALARM));
    }

    @Test
    void dropNewestKeepsQueuedCommands() {
        newExecutor(2, OverflowPolicy.DROP_NEWEST);
        assertTrue(executor.enqueue(new DeviceCommand(Actuator.DOOR, 1)));
        assertTrue(executor.enqueue(new DeviceCommand(Actuator.VENTILATION, 1)));
        assertFalse(executor.enqueue(new DeviceCommand(Actuator.ALARM, 3)));
        assertEquals(1, executor.droppedCount());

        executor.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> ackTopics().size() == 2);
        assertEquals(List.of("racks/R1/ack/door", "racks/R1/ack/ventilation"), ackTopics());
        assertEquals(0, driver.currentValue(Actuator.ALARM));
    }

    @Test
    void malformedCommandsAreDropped() {
        newExecutor(4, OverflowPolicy.DROP_OLDEST);
        executor.onCommandMessage("racks/R1/command/door", "open-please");
        executor.onCommandMessage("racks/R1/command/fan", "1");
        executor.onCommandMessage("racks/R2/command/door", "1");
        executor.onCommandMessage("racks/R1/ack/door", "1");
        executor.onCommandMessage("racks/R1/command/door", "");
        assertEquals(0, executor.queuedCount());
        assertEquals(0, executor.droppedCount(), "Malformed input is not an overflow");
    }

    @Test
    void valuesAreClampedAndAckedWithAchievedValue() {
        newExecutor(4, OverflowPolicy.DROP_OLDEST);
        executor.process(new DeviceCommand(Actuator.ALARM, 9));
        executor.process(new DeviceCommand(Actuator.VENTILATION, -4));
        assertEquals(List.of(
                new Published("racks/R1/ack/buzzer", "3"),
                new Published("racks/R1/ack/ventilation", "0")), transport.published());
    }

    @Test
    void reapplyingCurrentValueOnlyRepublishesAck() {
        newExecutor(4, OverflowPolicy.DROP_OLDEST);
        executor.process(new DeviceCommand(Actuator.DOOR, 1));
        executor.process(new DeviceCommand(Actuator.DOOR, 1));
        assertEquals(1, driver.changeCount());
        assertEquals(2, transport.publishedTo("racks/R1/ack/door").size());
        assertEquals(2, executor.appliedCount());
    }

    @Test
    void silentDriverSendsNoAck() {
        newExecutor(4, OverflowPolicy.DROP_OLDEST);
        driver.setResponsive(false);
        executor.process(new DeviceCommand(Actuator.DOOR, 1));
        assertTrue(transport.published().isEmpty());
        assertEquals(0, driver.currentValue(Actuator.DOOR));
    }

    @Test
    void droppedCommandTimesOutOnController() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        AckTrackingCommandDispatcher dispatcher = new AckTrackingCommandDispatcher(transport, topics, clock, 5000, List.of());
        transport.subscribe(topics.allAcksFilter(), (topic, payload) -> topics.parse(topic).ifPresent(p ->
                dispatcher.onAckReceived(p.rackId(), Actuator.fromSegment(p.segment()).orElseThrow(),
                        PayloadParser.parseInteger(payload).getAsInt())));
        newExecutor(1, OverflowPolicy.DROP_NEWEST);
        transport.subscribe(topics.allCommandsFilter(), executor::onCommandMessage);

        Map<Actuator, CommandResult> results = new ConcurrentHashMap<>();
        dispatcher.issue("R1", Actuator.DOOR, 1, r -> results.put(r.actuator(), r));
        dispatcher.issue("R1", Actuator.VENTILATION, 1, r -> results.put(r.actuator(), r));
        assertEquals(1, executor.droppedCount());

        executor.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> results.containsKey(Actuator.DOOR));
        assertEquals(CommandOutcome.ACKNOWLEDGED, results.get(Actuator.DOOR).outcome());
        assertTrue(dispatcher.rack("R1").orElseThrow().doorOpen());

        clock.advanceMillis(5000);
        dispatcher.sweepExpired(clock.instant());
        assertEquals(CommandOutcome.EXPIRED, results.get(Actuator.VENTILATION).outcome());
        assertFalse(dispatcher.rack("R1").orElseThrow().ventilationOn());
    }
}
