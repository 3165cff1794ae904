package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.CommandHandle;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.CommandResultSink;
import com.sandy.aiot.rack.control.model.IssueResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Issues actuator commands, correlates device acknowledgments by (rack, actuator) and
 * resolves every accepted command exactly once, as acknowledged or expired.
 *
 * <p>The dispatcher also owns the rack store. Confirmed actuator state changes only here,
 * on acknowledgment; sensor readings are written through the same locked API.</p>
 */
public interface CommandDispatcher {

    /**
     * @return accepted with a handle, or rejected when a command for the key is in flight
     * @throws IllegalArgumentException when the value is outside the actuator's range
     */
    IssueResult issue(String rackId, Actuator actuator, int desiredValue, CommandResultSink sink);

    /**
     * Future-based variant of {@link #issue(String, Actuator, int, CommandResultSink)}. The
     * future always completes with a result, never exceptionally.
     *
     * @throws CommandRejectedException when a command for the key is in flight
     */
    default CompletableFuture<CommandResult> issue(String rackId, Actuator actuator, int desiredValue) {
        CompletableFuture<CommandResult> future = new CompletableFuture<>();
        IssueResult result = issue(rackId, actuator, desiredValue, future::complete);
        if (!result.accepted()) {
            throw new CommandRejectedException(result.reason(), result.blockingCommandId());
        }
        return future;
    }

    /**
     * @return true when the ack resolved a pending command as acknowledged
     */
    boolean onAckReceived(String rackId, Actuator actuator, int achievedValue);

    /**
     * Resolves every pending command whose deadline is at or before {@code now}.
     *
     * @return number of commands expired
     */
    int sweepExpired(Instant now);

    void recordTelemetry(String rackId, Metric metric, double value, Instant at);

    void recordDoorStatus(String rackId, boolean doorOpen, Instant at);

    void recordLocation(String rackId, double latitude, double longitude, Instant at);

    Optional<RackSnapshot> rack(String rackId);

    List<RackSnapshot> racks();

    List<CommandHandle> pendingCommands();
}
