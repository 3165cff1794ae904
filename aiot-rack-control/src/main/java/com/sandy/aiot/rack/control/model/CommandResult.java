package com.sandy.aiot.rack.control.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal result handed to the result sink. {@code achievedValue} is the value the
 * device reported, which may differ from the request when the hardware clamps it;
 * it is null for expired commands.
 */
@Builder
public record CommandResult(String commandId,
                            String rackId,
                            Actuator actuator,
                            int desiredValue,
                            CommandOutcome outcome,
                            Integer achievedValue,
                            Instant issuedAt,
                            Instant resolvedAt) {

    public boolean isAcknowledged() {
        return outcome == CommandOutcome.ACKNOWLEDGED;
    }

    public long latencyMs() {
        if (issuedAt == null || resolvedAt == null) return 0L;
        return Duration.between(issuedAt, resolvedAt).toMillis();
    }
}
