package com.sandy.aiot.rack.control.model;

import java.util.Arrays;
import java.util.Optional;

public enum Metric {
    TEMPERATURE("temperature"),
    HUMIDITY("humidity");

    private final String segment;

    Metric(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    public static Optional<Metric> fromSegment(String segment) {
        if (segment == null) return Optional.empty();
        String s = segment.trim();
        return Arrays.stream(values())
                .filter(m -> m.segment.equalsIgnoreCase(s) || m.name().equalsIgnoreCase(s))
                .findFirst();
    }
}
