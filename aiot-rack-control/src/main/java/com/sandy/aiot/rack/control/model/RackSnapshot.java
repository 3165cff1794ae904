package com.sandy.aiot.rack.control.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Immutable copy of a rack's last confirmed state. Sensor readings are null until the
 * first sample of that metric arrives. {@code breakInLatched} stays set from a confirmed
 * break-in alarm until an operator confirms the alarm off, even while a higher cause
 * holds the alarm.
 */
@Builder(toBuilder = true)
public record RackSnapshot(String rackId,
                           Double temperature,
                           Double humidity,
                           boolean doorOpen,
                           boolean ventilationOn,
                           AlarmState alarmState,
                           boolean breakInLatched,
                           Double latitude,
                           Double longitude,
                           Instant lastTelemetryAt,
                           Instant lastAckAt) {

    public RackSnapshot {
        if (alarmState == null) alarmState = AlarmState.OFF;
    }

    public static RackSnapshot empty(String rackId) {
        return RackSnapshot.builder().rackId(rackId).alarmState(AlarmState.OFF).build();
    }
}
