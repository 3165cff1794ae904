package com.sandy.aiot.rack.control.config;

/**
 * Dual-threshold (Schmitt trigger) bands for one metric.
 *
 * <ul>
 *   <li><b>highThreshold</b> - activate ventilation at or above this value</li>
 *   <li><b>lowThreshold</b> - ventilation may be released at or below this value</li>
 *   <li><b>criticalThreshold</b> - escalate to an alert at or above this value</li>
 *   <li><b>criticalReset</b> - de-escalate only once below this value</li>
 * </ul>
 *
 * Must satisfy {@code low < high <= criticalReset < critical}.
 */
public record ThresholdConfig(double highThreshold,
                              double lowThreshold,
                              double criticalThreshold,
                              double criticalReset) {

    public ThresholdConfig {
        if (Double.isNaN(highThreshold) || Double.isNaN(lowThreshold)
                || Double.isNaN(criticalThreshold) || Double.isNaN(criticalReset)) {
            throw new IllegalArgumentException("thresholds must be numbers");
        }
        if (!(lowThreshold < highThreshold)) {
            throw new IllegalArgumentException("lowThreshold (" + lowThreshold + ") must be below highThreshold (" + highThreshold + ")");
        }
        if (!(highThreshold <= criticalReset)) {
            throw new IllegalArgumentException("highThreshold (" + highThreshold + ") must not exceed criticalReset (" + criticalReset + ")");
        }
        if (!(criticalReset < criticalThreshold)) {
            throw new IllegalArgumentException("criticalReset (" + criticalReset + ") must be below criticalThreshold (" + criticalThreshold + ")");
        }
    }

    public boolean isCritical(Double value) {
        return value != null && value >= criticalThreshold;
    }

    public boolean isHigh(Double value) {
        return value != null && value >= highThreshold;
    }

    public boolean isLow(Double value) {
        return value != null && value <= lowThreshold;
    }
}
