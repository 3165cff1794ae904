package com.sandy.aiot.rack.control.device;

/** What a full device queue does with one more command. */
public enum OverflowPolicy {
    /** evict the oldest queued command to make room */
    DROP_OLDEST,
    /** discard the incoming command */
    DROP_NEWEST
}
