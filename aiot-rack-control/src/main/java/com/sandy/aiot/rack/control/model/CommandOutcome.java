package com.sandy.aiot.rack.control.model;

/** Terminal outcome of an accepted command. */
public enum CommandOutcome {
    ACKNOWLEDGED,
    EXPIRED
}
