package com.sandy.aiot.rack.control;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.AlarmState;
import com.sandy.aiot.rack.control.model.CommandOutcome;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.IssueResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.service.CommandRejectedException;
import com.sandy.aiot.rack.control.service.impl.AckTrackingCommandDispatcher;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AckTrackingCommandDispatcherTest {

    static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    MutableClock clock;
    RecordingTransport transport;
    List<CommandResult> audited;
    AckTrackingCommandDispatcher dispatcher;

    @BeforeEach
    void setup() {
        clock = new MutableClock(T0);
        transport = new RecordingTransport();
        audited = Collections.synchronizedList(new ArrayList<>());
        dispatcher = new AckTrackingCommandDispatcher(transport, new TopicScheme("racks"), clock, 5000, List.of(audited::add));
    }

    @Test
    void acceptedCommandIsPublishedAndPending() {
        IssueResult r = dispatcher.issue("R1", Actuator.VENTILATION, 1, res -> { });
        assertTrue(r.accepted());
        assertNotNull(r.handle().commandId());
        assertEquals(T0.plusMillis(5000), r.handle().deadline());
        assertEquals(List.of(new RecordingTransport.Published("racks/R1/command/ventilation", "1")), transport.published());
        assertEquals(1, dispatcher.pendingCommands().size());
        assertTrue(dispatcher.rack("R1").isEmpty(), "Issuing alone does not create a rack");
    }

    @Test
    void secondCommandForBusyKeyIsRejected() {
        IssueResult first = dispatcher.issue("R1", Actuator.VENTILATION, 1, res -> { });
        IssueResult second = dispatcher.issue("R1", Actuator.VENTILATION, 0, res -> { });
        assertFalse(second.accepted());
        assertEquals(first.handle().commandId(), second.blockingCommandId());
        assertNotNull(second.reason());
        assertEquals(1, transport.published().size(), "Rejected command must not be published");
        assertEquals(1, dispatcher.pendingCommands().size());

        IssueResult otherActuator = dispatcher.issue("R1", Actuator.DOOR, 1, res -> { });
        IssueResult otherRack = dispatcher.issue("R2", Actuator.VENTILATION, 1, res -> { });
        assertTrue(otherActuator.accepted());
        assertTrue(otherRack.accepted());
        assertEquals(3, dispatcher.pendingCommands().size());
    }

    @Test
    void ackResolvesCommandAndUpdatesRack() {
        List<CommandResult> results = new ArrayList<>();
        IssueResult r = dispatcher.issue("R1", Actuator.VENTILATION, 1, results::add);
        clock.advanceMillis(1200);

        assertTrue(dispatcher.onAckReceived("R1", Actuator.VENTILATION, 1));

        assertEquals(1, results.size());
        CommandResult res = results.get(0);
        assertEquals(CommandOutcome.ACKNOWLEDGED, res.outcome());
        assertEquals(r.handle().commandId(), res.commandId());
        assertEquals(1, res.achievedValue());
        assertEquals(1200, res.latencyMs());
        RackSnapshot rack = dispatcher.rack("R1").orElseThrow();
        assertTrue(rack.ventilationOn());
        assertEquals(T0.plusMillis(1200), rack.lastAckAt());
        assertTrue(dispatcher.pendingCommands().isEmpty());
        assertEquals(1, audited.size());
    }

    @Test
    void unmatchedAckIsDiscarded() {
        assertFalse(dispatcher.onAckReceived("R9", Actuator.DOOR, 1));
        assertTrue(dispatcher.rack("R9").isEmpty(), "Unmatched ack must not create or change a rack");

        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.DOOR, 1, results::add);
        assertTrue(dispatcher.onAckReceived("R1", Actuator.DOOR, 1));
        // duplicate delivery of the same ack
        assertFalse(dispatcher.onAckReceived("R1", Actuator.DOOR, 0));
        assertEquals(1, results.size());
        assertTrue(dispatcher.rack("R1").orElseThrow().doorOpen());
    }

    @Test
    void commandWithoutAckExpiresAtDeadline() {
        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.VENTILATION, 1, results::add);

        clock.advanceMillis(4999);
        assertEquals(0, dispatcher.sweepExpired(clock.instant()));
        assertTrue(results.isEmpty());

        clock.advanceMillis(1);
        assertEquals(1, dispatcher.sweepExpired(clock.instant()));
        assertEquals(1, results.size());
        assertEquals(CommandOutcome.EXPIRED, results.get(0).outcome());
        assertNull(results.get(0).achievedValue());
        assertEquals(T0.plusMillis(5000), results.get(0).resolvedAt());
        assertFalse(dispatcher.rack("R1").map(RackSnapshot::ventilationOn).orElse(false));

        // key is free again
        assertTrue(dispatcher.issue("R1", Actuator.VENTILATION, 1, res -> { }).accepted());
    }

    @Test
    void noAckForSixSecondsExpiresOnceAndFreesKey() {
        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.DOOR, 1, results::add);
        for (int i = 1; i <= 12; i++) {
            clock.advanceMillis(500);
            dispatcher.sweepExpired(clock.instant());
        }
        assertEquals(1, results.size());
        assertEquals(CommandOutcome.EXPIRED, results.get(0).outcome());
        assertEquals(T0.plusMillis(5000), results.get(0).resolvedAt());
        assertTrue(dispatcher.pendingCommands().isEmpty());
        assertFalse(dispatcher.rack("R1").map(RackSnapshot::doorOpen).orElse(false));
    }

    @Test
    void expiryIsDeterministicForSameClockSequence() {
        List<CommandOutcome> run1 = runScript();
        setup();
        List<CommandOutcome> run2 = runScript();
        assertEquals(run1, run2);
        assertEquals(List.of(CommandOutcome.EXPIRED, CommandOutcome.ACKNOWLEDGED, CommandOutcome.EXPIRED), run1);
    }

    private List<CommandOutcome> runScript() {
        List<CommandOutcome> outcomes = new ArrayList<>();
        dispatcher.issue("R1", Actuator.DOOR, 1, r -> outcomes.add(r.outcome()));
        clock.advanceMillis(2000);
        dispatcher.issue("R1", Actuator.VENTILATION, 1, r -> outcomes.add(r.outcome()));
        dispatcher.issue("R2", Actuator.ALARM, 3, r -> outcomes.add(r.outcome()));
        clock.advanceMillis(3000);
        dispatcher.sweepExpired(clock.instant());
        dispatcher.onAckReceived("R1", Actuator.VENTILATION, 1);
        clock.advanceMillis(2000);
        dispatcher.sweepExpired(clock.instant());
        return outcomes;
    }

    @Test
    void lateAckAfterDeadlineResolvesExpired() {
        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.VENTILATION, 1, results::add);
        clock.advanceMillis(5300);

        assertFalse(dispatcher.onAckReceived("R1", Actuator.VENTILATION, 1));

        assertEquals(1, results.size());
        assertEquals(CommandOutcome.EXPIRED, results.get(0).outcome());
        assertFalse(dispatcher.rack("R1").map(RackSnapshot::ventilationOn).orElse(false), "Late ack must not touch the rack");
        assertEquals(0, dispatcher.sweepExpired(clock.instant()));
    }

    @Test
    void overdueCommandIsExpiredWhenKeyIsReissued() {
        List<CommandResult> results = new ArrayList<>();
        IssueResult first = dispatcher.issue("R1", Actuator.DOOR, 1, results::add);
        clock.advanceMillis(5000);

        IssueResult second = dispatcher.issue("R1", Actuator.DOOR, 1, results::add);

        assertTrue(second.accepted());
        assertEquals(1, results.size());
        assertEquals(first.handle().commandId(), results.get(0).commandId());
        assertEquals(CommandOutcome.EXPIRED, results.get(0).outcome());
        assertEquals(1, dispatcher.pendingCommands().size());
        assertEquals(second.handle().commandId(), dispatcher.pendingCommands().get(0).commandId());
    }

    @Test
    void alarmAckIsClampedAndMapped() {
        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.ALARM, 3, results::add);
        assertTrue(dispatcher.onAckReceived("R1", Actuator.ALARM, 7));
        assertEquals(3, results.get(0).achievedValue());
        assertEquals(AlarmState.OVERHEAT, dispatcher.rack("R1").orElseThrow().alarmState());

        dispatcher.issue("R1", Actuator.ALARM, 0, results::add);
        dispatcher.onAckReceived("R1", Actuator.ALARM, 0);
        assertEquals(AlarmState.OFF, dispatcher.rack("R1").orElseThrow().alarmState());
    }

    @Test
    void breakInStaysLatchedUnderOverheatUntilAlarmConfirmedOff() {
        dispatcher.issue("R1", Actuator.ALARM, 2, r -> { });
        dispatcher.onAckReceived("R1", Actuator.ALARM, 2);
        assertTrue(dispatcher.rack("R1").orElseThrow().breakInLatched());

        dispatcher.issue("R1", Actuator.ALARM, 3, r -> { });
        dispatcher.onAckReceived("R1", Actuator.ALARM, 3);
        RackSnapshot overheat = dispatcher.rack("R1").orElseThrow();
        assertEquals(AlarmState.OVERHEAT, overheat.alarmState());
        assertTrue(overheat.breakInLatched());

        dispatcher.issue("R1", Actuator.ALARM, 0, r -> { });
        dispatcher.onAckReceived("R1", Actuator.ALARM, 0);
        assertFalse(dispatcher.rack("R1").orElseThrow().breakInLatched());
    }

    @Test
    void commandToUnknownRackLeavesNoRackBehind() {
        dispatcher.issue("R1-TYPO", Actuator.DOOR, 1, r -> { });
        clock.advanceMillis(5000);
        assertEquals(1, dispatcher.sweepExpired(clock.instant()));
        assertTrue(dispatcher.racks().isEmpty());

        dispatcher.recordTelemetry("R1", Metric.TEMPERATURE, 24.0, clock.instant());
        assertEquals(List.of("R1"), dispatcher.racks().stream().map(RackSnapshot::rackId).toList());
    }

    @Test
    void outOfRangeValueIsRefused() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.issue("R1", Actuator.DOOR, 2, r -> { }));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.issue("R1", Actuator.ALARM, -1, r -> { }));
        assertTrue(dispatcher.pendingCommands().isEmpty());
        assertTrue(transport.published().isEmpty());
    }

    @Test
    void failedPublishStaysPendingUntilExpiry() {
        transport.setFailing(true);
        List<CommandResult> results = new ArrayList<>();
        IssueResult r = dispatcher.issue("R1", Actuator.VENTILATION, 1, results::add);
        assertTrue(r.accepted());
        assertEquals(1, dispatcher.pendingCommands().size());

        clock.advanceMillis(5000);
        dispatcher.sweepExpired(clock.instant());
        assertEquals(CommandOutcome.EXPIRED, results.get(0).outcome());
    }

    @Test
    void throwingSinkDoesNotAffectOtherCommands() {
        List<CommandResult> results = new ArrayList<>();
        dispatcher.issue("R1", Actuator.DOOR, 1, r -> { throw new IllegalStateException("boom"); });
        dispatcher.issue("R2", Actuator.DOOR, 1, results::add);
        clock.advanceMillis(5000);

        assertEquals(2, dispatcher.sweepExpired(clock.instant()));
        assertEquals(1, results.size());
        assertEquals(2, audited.size(), "Listeners still see the result of the failing sink");
        assertTrue(dispatcher.pendingCommands().isEmpty());
    }

    @Test
    void futureVariantCompletesAndRejectsSynchronously() throws Exception {
        CompletableFuture<CommandResult> f = dispatcher.issue("R1", Actuator.DOOR, 1);
        CommandRejectedException ex = assertThrows(CommandRejectedException.class, () -> dispatcher.issue("R1", Actuator.DOOR, 0));
        assertNotNull(ex.getBlockingCommandId());
        assertFalse(f.isDone());

        dispatcher.onAckReceived("R1", Actuator.DOOR, 1);
        CommandResult res = f.get(1, TimeUnit.SECONDS);
        assertTrue(res.isAcknowledged());
    }

    @Test
    void telemetryWritesAreVisibleInSnapshots() {
        dispatcher.recordTelemetry("R2", Metric.TEMPERATURE, 31.5, T0);
        dispatcher.recordTelemetry("R2", Metric.HUMIDITY, 55.0, T0);
        dispatcher.recordDoorStatus("R1", true, T0);
        dispatcher.recordLocation("R1", -3.73, -38.52, T0);

        List<RackSnapshot> racks = dispatcher.racks();
        assertEquals(List.of("R1", "R2"), racks.stream().map(RackSnapshot::rackId).toList());
        RackSnapshot r2 = dispatcher.rack("R2").orElseThrow();
        assertEquals(31.5, r2.temperature());
        assertEquals(55.0, r2.humidity());
        RackSnapshot r1 = dispatcher.rack("R1").orElseThrow();
        assertTrue(r1.doorOpen());
        assertEquals(-3.73, r1.latitude());
        assertNull(r1.temperature());
    }

    @Test
    void concurrentAckAndSweepResolveEachCommandExactlyOnce() throws Exception {
        int racks = 200;
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        for (int i = 0; i < racks; i++) {
            String id = "R" + i;
            calls.put(id, new AtomicInteger());
            dispatcher.issue(id, Actuator.VENTILATION, 1, r -> calls.get(r.rackId()).incrementAndGet());
        }
        // acks read the clock just before the deadline, sweeps use the deadline itself
        clock.advance(Duration.ofMillis(4999));
        Instant sweepAt = T0.plusMillis(5000);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<java.util.concurrent.Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int offset = t;
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < racks; i++) {
                    dispatcher.onAckReceived("R" + ((i + offset * 37) % racks), Actuator.VENTILATION, 1);
                }
                return null;
            }));
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < 20; i++) {
                    dispatcher.sweepExpired(sweepAt);
                }
                return null;
            }));
        }
        go.countDown();
        for (java.util.concurrent.Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        calls.forEach((id, c) -> assertEquals(1, c.get(), "rack " + id));
        assertTrue(dispatcher.pendingCommands().isEmpty());
        assertEquals(racks, audited.size());
    }
}
