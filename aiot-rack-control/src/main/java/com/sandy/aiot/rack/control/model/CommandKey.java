package com.sandy.aiot.rack.control.model;

import java.util.Objects;

/** Correlation key for commands and acks: one in-flight command per (rack, actuator). */
public record CommandKey(String rackId, Actuator actuator) {
    public CommandKey {
        Objects.requireNonNull(rackId, "rackId");
        Objects.requireNonNull(actuator, "actuator");
    }

    @Override
    public String toString() {
        return rackId + "/" + actuator.segment();
    }
}
