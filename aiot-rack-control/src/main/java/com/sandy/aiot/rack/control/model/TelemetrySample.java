package com.sandy.aiot.rack.control.model;

import java.time.Instant;

public record TelemetrySample(String rackId, Metric metric, double value, Instant timestamp) {
}
