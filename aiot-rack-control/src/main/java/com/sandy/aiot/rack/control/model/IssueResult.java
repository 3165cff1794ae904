package com.sandy.aiot.rack.control.model;

/**
 * Answer of the dispatcher to an issue request: either accepted with a handle, or
 * rejected because a command for the same key is still in flight.
 */
public record IssueResult(boolean accepted, CommandHandle handle, String blockingCommandId, String reason) {

    public static IssueResult accepted(CommandHandle handle) {
        return new IssueResult(true, handle, null, null);
    }

    public static IssueResult rejected(String blockingCommandId, String reason) {
        return new IssueResult(false, null, blockingCommandId, reason);
    }
}
