package com.sandy.aiot.rack.control.model;

/** Lifecycle of a pending command: ISSUED, then exactly one of the terminal states. */
public enum CommandStatus {
    ISSUED,
    ACKNOWLEDGED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ISSUED;
    }
}
