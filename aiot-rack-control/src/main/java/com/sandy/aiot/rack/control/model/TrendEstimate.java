package com.sandy.aiot.rack.control.model;

import java.time.Instant;

/**
 * Short-term view of one metric: mean over the retained window and the least-squares
 * slope in units per second.
 */
public record TrendEstimate(double windowMean,
                            double rateOfChange,
                            int sampleCount,
                            Instant windowStart,
                            Instant windowEnd) {

    public double ratePerMinute() {
        return rateOfChange * 60.0;
    }
}
