package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.tools.PayloadParser;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Publishes synthetic environment readings, door status and a fixed location for every
 * simulated rack. Temperature follows a bounded random walk that cools while ventilation
 * is on; now and then a heat anomaly ramps it up over several ticks.
 *
 * <p>Each door also opens by itself on a randomized schedule and closes again after a
 * randomized duration. While it is open the readings drift toward the outside air. A door
 * opened by command gets the same close deadline; one closed by command restarts the
 * schedule.</p>
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "rack.simulator.enabled", havingValue = "true")
public class RackTelemetrySimulator {

    private static final double BASE_LATITUDE = -3.7319;
    private static final double BASE_LONGITUDE = -38.5267;
    private static final double DOOR_PULL = 0.3;

    private final MessageTransport transport;
    private final TopicScheme topics;
    private final SimulatedDeviceFleet fleet;
    private final Clock clock;
    private final Random random;
    private final boolean telemetryEnabled;
    private final double anomalyProbability;
    private final boolean doorScheduleEnabled;
    private final double doorIntervalMinSeconds;
    private final double doorIntervalMaxSeconds;
    private final double doorOpenMinSeconds;
    private final double doorOpenMaxSeconds;
    private final double outsideTemperature;
    private final double outsideHumidity;

    private final Map<String, RackState> states = new HashMap<>();

    public RackTelemetrySimulator(MessageTransport transport,
                                  TopicScheme topics,
                                  SimulatedDeviceFleet fleet,
                                  Clock clock,
                                  @Value("${rack.simulator.seed:0}") long seed,
                                  @Value("${rack.simulator.telemetry-enabled:true}") boolean telemetryEnabled,
                                  @Value("${rack.simulator.anomaly-probability:0.07}") double anomalyProbability,
                                  @Value("${rack.simulator.door-schedule-enabled:true}") boolean doorScheduleEnabled,
                                  @Value("${rack.simulator.door-interval-min-seconds:840}") double doorIntervalMinSeconds,
                                  @Value("${rack.simulator.door-interval-max-seconds:960}") double doorIntervalMaxSeconds,
                                  @Value("${rack.simulator.door-open-min-seconds:45}") double doorOpenMinSeconds,
                                  @Value("${rack.simulator.door-open-max-seconds:150}") double doorOpenMaxSeconds,
                                  @Value("${rack.simulator.outside-temperature:18.0}") double outsideTemperature,
                                  @Value("${rack.simulator.outside-humidity:47.0}") double outsideHumidity) {
        if (doorIntervalMinSeconds <= 0 || doorIntervalMaxSeconds < doorIntervalMinSeconds) {
            throw new IllegalArgumentException("rack.simulator.door-interval-* must satisfy 0 < min <= max");
        }
        if (doorOpenMinSeconds <= 0 || doorOpenMaxSeconds < doorOpenMinSeconds) {
            throw new IllegalArgumentException("rack.simulator.door-open-* must satisfy 0 < min <= max");
        }
        this.transport = transport;
        this.topics = topics;
        this.fleet = fleet;
        this.clock = clock;
        this.random = seed == 0 ? new Random() : new Random(seed);
        this.telemetryEnabled = telemetryEnabled;
        this.anomalyProbability = anomalyProbability;
        this.doorScheduleEnabled = doorScheduleEnabled;
        this.doorIntervalMinSeconds = doorIntervalMinSeconds;
        this.doorIntervalMaxSeconds = doorIntervalMaxSeconds;
        this.doorOpenMinSeconds = doorOpenMinSeconds;
        this.doorOpenMaxSeconds = doorOpenMaxSeconds;
        this.outsideTemperature = outsideTemperature;
        this.outsideHumidity = outsideHumidity;
    }

    @Scheduled(fixedDelayString = "${rack.simulator.telemetry-interval-ms:2000}")
    public void scheduledPublish() {
        if (!telemetryEnabled) return;
        try { publishOnce(); } catch (Exception e) { log.error("Telemetry simulation failed: {}", e.getMessage(), e); }
    }

    /**
     * One round of readings for every simulated rack. Public entry point for tests / manual trigger.
     */
    public synchronized void publishOnce() {
        Instant now = clock.instant();
        int index = 0;
        for (String rackId : fleet.rackIds()) {
            int slot = index++;
            SimulatedActuatorDriver driver = fleet.driver(rackId).orElse(null);
            if (driver == null) continue;
            RackState state = states.computeIfAbsent(rackId, id -> newState(slot, now));
            if (!state.locationPublished) {
                transport.publish(topics.locationTopic(rackId), String.format(Locale.ROOT,
                        "{\"latitude\":%.6f,\"longitude\":%.6f}", state.latitude, state.longitude));
                state.locationPublished = true;
                log.info("Simulated location published rackId={} lat={} lon={}", rackId, state.latitude, state.longitude);
            }
            boolean doorOpen = advanceDoor(rackId, state, driver, now);
            boolean ventilationOn = driver.currentValue(Actuator.VENTILATION) == 1;
            step(rackId, state, ventilationOn, doorOpen);
            transport.publish(topics.environmentTopic(rackId, Metric.TEMPERATURE), String.format(Locale.ROOT, "%.2f", state.temperature));
            transport.publish(topics.environmentTopic(rackId, Metric.HUMIDITY), String.format(Locale.ROOT, "%.2f", state.humidity));
            transport.publish(topics.statusTopic(rackId), PayloadParser.encode(doorOpen));
        }
    }

    private RackState newState(int slot, Instant now) {
        RackState s = new RackState();
        s.temperature = 22.0 + random.nextDouble() * 8.0;
        s.humidity = 40.0 + random.nextDouble() * 20.0;
        s.latitude = BASE_LATITUDE + slot * 0.0125;
        s.longitude = BASE_LONGITUDE + slot * 0.0094;
        s.nextDoorOpenAt = now.plus(randomDuration(doorIntervalMinSeconds, doorIntervalMaxSeconds));
        return s;
    }

    /**
     * Moves the door along its schedule and returns whether it is open after this tick.
     */
    private boolean advanceDoor(String rackId, RackState s, SimulatedActuatorDriver driver, Instant now) {
        boolean open = driver.currentValue(Actuator.DOOR) == 1;
        if (!doorScheduleEnabled) return open;
        if (open) {
            if (s.doorOpenUntil == null) {
                // opened by command
                s.doorOpenUntil = now.plus(randomDuration(doorOpenMinSeconds, doorOpenMaxSeconds));
                log.info("Simulated door opened by command rackId={} closesAt={}", rackId, s.doorOpenUntil);
                return true;
            }
            if (now.isBefore(s.doorOpenUntil)) return true;
            driver.moveLocally(Actuator.DOOR, 0);
            s.doorOpenUntil = null;
            s.nextDoorOpenAt = now.plus(randomDuration(doorIntervalMinSeconds, doorIntervalMaxSeconds));
            log.info("Simulated door closed automatically rackId={} nextOpenAt={}", rackId, s.nextDoorOpenAt);
            return false;
        }
        if (s.doorOpenUntil != null) {
            // closed by command before its deadline
            s.doorOpenUntil = null;
            s.nextDoorOpenAt = now.plus(randomDuration(doorIntervalMinSeconds, doorIntervalMaxSeconds));
            return false;
        }
        if (now.isBefore(s.nextDoorOpenAt)) return false;
        driver.moveLocally(Actuator.DOOR, 1);
        s.doorOpenUntil = now.plus(randomDuration(doorOpenMinSeconds, doorOpenMaxSeconds));
        log.info("Simulated scheduled door opening rackId={} closesAt={}", rackId, s.doorOpenUntil);
        return true;
    }

    private void step(String rackId, RackState s, boolean ventilationOn, boolean doorOpen) {
        if (s.anomalyTicksLeft == 0 && random.nextDouble() < anomalyProbability) {
            s.anomalyTicksLeft = 5 + random.nextInt(6);
            s.anomalyPeak = s.temperature + 10.0 + random.nextDouble() * 12.0;
            log.info("Simulated heat anomaly rackId={} from={} peak={}", rackId, String.format(Locale.ROOT, "%.2f", s.temperature),
                    String.format(Locale.ROOT, "%.2f", s.anomalyPeak));
        }
        if (s.anomalyTicksLeft > 0) {
            s.temperature += (s.anomalyPeak - s.temperature) / s.anomalyTicksLeft;
            s.anomalyTicksLeft--;
        } else if (doorOpen) {
            s.temperature += (outsideTemperature + 2.0 - s.temperature) * DOOR_PULL + random.nextGaussian() * 0.4;
        } else {
            double drift = ventilationOn ? -0.8 : 0.15;
            s.temperature += drift + random.nextGaussian() * 0.4;
        }
        s.temperature = clamp(s.temperature, 15.0, 60.0);
        if (doorOpen) {
            s.humidity += (outsideHumidity - s.humidity) * DOOR_PULL + random.nextGaussian() * 1.0;
        } else {
            s.humidity += (ventilationOn ? -0.6 : 0.1) + random.nextGaussian() * 1.0;
        }
        s.humidity = clamp(s.humidity, 20.0, 95.0);
    }

    private Duration randomDuration(double minSeconds, double maxSeconds) {
        double seconds = minSeconds + random.nextDouble() * (maxSeconds - minSeconds);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class RackState {
        double temperature;
        double humidity;
        double latitude;
        double longitude;
        boolean locationPublished;
        int anomalyTicksLeft;
        double anomalyPeak;
        Instant nextDoorOpenAt;
        Instant doorOpenUntil;
    }
}
