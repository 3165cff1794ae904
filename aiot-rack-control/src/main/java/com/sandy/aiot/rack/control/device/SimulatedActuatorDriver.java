package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * In-memory stand-in for rack hardware. Values are clamped to what the actuator can
 * hold (door and ventilation 0/1, buzzer 0..3). A silent driver fails every apply, so the
 * device never acks and the controller's timeout path can be exercised.
 */
@Slf4j
public class SimulatedActuatorDriver implements ActuatorDriver {

    private final String rackId;
    private final Map<Actuator, Integer> values = new EnumMap<>(Actuator.class);
    private volatile boolean responsive = true;
    private int changes;

    public SimulatedActuatorDriver(String rackId) {
        this.rackId = rackId;
        for (Actuator a : Actuator.values()) {
            values.put(a, 0);
        }
    }

    @Override
    public int apply(Actuator actuator, int value) {
        if (!responsive) {
            throw new IllegalStateException("actuator " + actuator + " not responding on rack " + rackId);
        }
        int target = actuator.clamp(value);
        synchronized (this) {
            int current = values.get(actuator);
            if (current == target) {
                log.debug("Rack {} {} already at {}", rackId, actuator, target);
                return current;
            }
            values.put(actuator, target);
            changes++;
        }
        log.info("Rack {} {} -> {}{}", rackId, actuator, target, target != value ? " (clamped from " + value + ")" : "");
        return target;
    }

    @Override
    public synchronized int currentValue(Actuator actuator) {
        return values.get(actuator);
    }

    /** Number of applies that actually changed an actuator. */
    public synchronized int changeCount() {
        return changes;
    }

    /**
     * A change made at the rack itself rather than through a command, e.g. someone opening
     * the door. No ack is published for it.
     */
    public synchronized void moveLocally(Actuator actuator, int value) {
        int target = actuator.clamp(value);
        values.put(actuator, target);
        log.info("Rack {} {} moved locally to {}", rackId, actuator, target);
    }

        public void setResponsive(boolean responsive) {
        this.responsive = responsive;
    }
}
