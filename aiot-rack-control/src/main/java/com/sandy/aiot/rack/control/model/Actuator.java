package com.sandy.aiot.rack.control.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Controllable outputs of a rack. The topic segment is the name the rack firmware
 * subscribes to; the alarm is driven through the buzzer.
 */
public enum Actuator {
    DOOR("door", 0, 1),
    VENTILATION("ventilation", 0, 1),
    ALARM("buzzer", 0, 3);

    private final String segment;
    private final int minValue;
    private final int maxValue;

    Actuator(String segment, int minValue, int maxValue) {
        this.segment = segment;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public String segment() {
        return segment;
    }

    public boolean accepts(int value) {
        return value >= minValue && value <= maxValue;
    }

    public int clamp(int value) {
        return Math.max(minValue, Math.min(maxValue, value));
    }

    /** Resolves a topic segment or enum name, case-insensitive. "alarm" is accepted for the buzzer. */
    public static Optional<Actuator> fromSegment(String segment) {
        if (segment == null) return Optional.empty();
        String s = segment.trim().toLowerCase();
        if (s.equals("alarm")) return Optional.of(ALARM);
        return Arrays.stream(values())
                .filter(a -> a.segment.equals(s) || a.name().equalsIgnoreCase(s))
                .findFirst();
    }
}
