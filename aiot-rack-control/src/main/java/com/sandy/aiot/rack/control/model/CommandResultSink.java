package com.sandy.aiot.rack.control.model;

/** Caller-supplied completion handle, invoked exactly once per accepted command. */
@FunctionalInterface
public interface CommandResultSink {
    void onResult(CommandResult result);
}
