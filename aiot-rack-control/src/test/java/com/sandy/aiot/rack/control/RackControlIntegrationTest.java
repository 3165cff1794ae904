package com.sandy.aiot.rack.control;

import com.sandy.aiot.rack.control.device.SimulatedDeviceFleet;
import com.sandy.aiot.rack.control.entity.CommandLog;
import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.AlarmState;
import com.sandy.aiot.rack.control.model.CommandOutcome;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.repository.CommandLogRepository;
import com.sandy.aiot.rack.control.service.CommandDispatcher;
import com.sandy.aiot.rack.control.service.RackControlService;
import com.sandy.aiot.rack.control.service.TrendEstimatorService;
import com.sandy.aiot.rack.control.service.impl.RackAutomationService;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RackControlIntegrationTest {

    @Autowired RackControlService rackControlService;
    @Autowired CommandDispatcher dispatcher;
    @Autowired CommandLogRepository commandLogRepository;
    @Autowired SimulatedDeviceFleet fleet;
    @Autowired MessageTransport transport;
    @Autowired TopicScheme topics;
    @Autowired RackAutomationService automationService;
    @Autowired TrendEstimatorService trendEstimator;

    @Test
    void manualCommandIsAcknowledgedEndToEnd() throws Exception {
        CommandResult result = rackControlService.openDoor("R1").get(3, TimeUnit.SECONDS);

        assertEquals(CommandOutcome.ACKNOWLEDGED, result.outcome());
        assertEquals(1, result.achievedValue());
        assertTrue(dispatcher.rack("R1").orElseThrow().doorOpen());
        await().atMost(Duration.ofSeconds(2)).until(() -> commandLogRepository.findByCommandId(result.commandId()).isPresent());
        CommandLog row = commandLogRepository.findByCommandId(result.commandId()).orElseThrow();
        assertEquals("R1", row.getRackId());
        assertEquals(CommandOutcome.ACKNOWLEDGED, row.getOutcome());
    }

    @Test
    void silentDeviceCommandExpires() throws Exception {
        fleet.driver("R2").orElseThrow().setResponsive(false);
        try {
            CommandResult result = rackControlService.turnOnVentilation("R2").get(3, TimeUnit.SECONDS);

            assertEquals(CommandOutcome.EXPIRED, result.outcome());
            assertNull(result.achievedValue());
            assertTrue(result.latencyMs() >= 800, "resolved no earlier than the timeout");
            assertFalse(dispatcher.rack("R2").map(RackSnapshot::ventilationOn).orElse(false));
            await().atMost(Duration.ofSeconds(2)).until(() -> commandLogRepository.findByCommandId(result.commandId()).isPresent());
            assertEquals(CommandOutcome.EXPIRED, commandLogRepository.findByCommandId(result.commandId()).orElseThrow().getOutcome());
        } finally {
            fleet.driver("R2").orElseThrow().setResponsive(true);
        }
    }

    @Test
    void overheatTelemetryDrivesAlarmAndVentilation() {
        transport.publish(topics.environmentTopic("R1", Metric.HUMIDITY), "50.0");
        transport.publish(topics.environmentTopic("R1", Metric.TEMPERATURE), "46.5");
        await().atMost(Duration.ofSeconds(2)).until(() ->
                dispatcher.rack("R1").map(RackSnapshot::temperature).filter(t -> t == 46.5).isPresent());
        assertTrue(trendEstimator.sampleCount("R1", Metric.TEMPERATURE) >= 1);

        await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(100)).until(() -> {
            automationService.evaluateRack("R1");
            RackSnapshot r = dispatcher.rack("R1").orElseThrow();
            return r.alarmState() == AlarmState.OVERHEAT && r.ventilationOn();
        });
        assertEquals(3, fleet.driver("R1").orElseThrow().currentValue(Actuator.ALARM));
    }

    @Test
    void locationAndDoorStatusAreIngested() {
        transport.publish(topics.locationTopic("R2"), "{\"latitude\":-3.7319,\"longitude\":-38.5267}");
        transport.publish(topics.statusTopic("R2"), "1");
        await().atMost(Duration.ofSeconds(2)).until(() -> dispatcher.rack("R2").map(RackSnapshot::latitude).isPresent()
                && dispatcher.rack("R2").orElseThrow().doorOpen());
        assertEquals(-38.5267, dispatcher.rack("R2").orElseThrow().longitude());

        transport.publish(topics.statusTopic("R2"), "0");
        await().atMost(Duration.ofSeconds(2)).until(() -> !dispatcher.rack("R2").orElseThrow().doorOpen());
    }
}
