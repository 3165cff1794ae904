package com.sandy.aiot.rack.control.service;

import lombok.Getter;

/**
 * A command for the same (rack, actuator) is still in flight. Not retried automatically;
 * the caller waits for the pending command to resolve and decides again.
 */
@Getter
public class CommandRejectedException extends RuntimeException {

    private final String blockingCommandId;

    public CommandRejectedException(String message, String blockingCommandId) {
        super(message);
        this.blockingCommandId = blockingCommandId;
    }
}
