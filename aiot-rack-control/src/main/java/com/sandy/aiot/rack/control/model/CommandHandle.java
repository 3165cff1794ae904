package com.sandy.aiot.rack.control.model;

import java.time.Instant;

public record CommandHandle(String commandId,
                            String rackId,
                            Actuator actuator,
                            int desiredValue,
                            Instant issuedAt,
                            Instant deadline) {
}
