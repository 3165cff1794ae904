package com.sandy.aiot.rack.control.config;

import com.sandy.aiot.rack.control.model.Metric;

import java.util.Objects;

/**
 * Everything the decision engine reads besides the rack itself. Loaded once at startup.
 *
 * @param trendPreemptionEnabled   start ventilation early on a fast temperature rise
 * @param risingRatePerMinute      temperature slope (units per minute) that counts as a fast rise
 */
public record DecisionThresholds(ThresholdConfig temperature,
                                 ThresholdConfig humidity,
                                 boolean trendPreemptionEnabled,
                                 double risingRatePerMinute) {

    public DecisionThresholds {
        Objects.requireNonNull(temperature, "temperature");
        Objects.requireNonNull(humidity, "humidity");
        if (trendPreemptionEnabled && !(risingRatePerMinute > 0)) {
            throw new IllegalArgumentException("risingRatePerMinute must be positive when trend preemption is enabled");
        }
    }

    public ThresholdConfig forMetric(Metric metric) {
        return switch (metric) {
            case TEMPERATURE -> temperature;
            case HUMIDITY -> humidity;
        };
    }

    public static DecisionThresholds of(ThresholdConfig temperature, ThresholdConfig humidity) {
        return new DecisionThresholds(temperature, humidity, false, 0.0);
    }
}
