package com.sandy.aiot.rack.control.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * One in-flight command. Created ISSUED and moved to exactly one terminal state; a second
 * transition attempt fails loudly. Callers must hold the dispatcher lock while mutating.
 */
@Getter
public class PendingCommand {

    private final String commandId;
    private final String rackId;
    private final Actuator actuator;
    private final int desiredValue;
    private final Instant issuedAt;
    private final Instant deadline;
    private final CommandResultSink resultSink;

    private CommandStatus status = CommandStatus.ISSUED;
    private Integer achievedValue;
    private Instant resolvedAt;

    public PendingCommand(String commandId, String rackId, Actuator actuator, int desiredValue,
                          Instant issuedAt, Instant deadline, CommandResultSink resultSink) {
        this.commandId = Objects.requireNonNull(commandId, "commandId");
        this.rackId = Objects.requireNonNull(rackId, "rackId");
        this.actuator = Objects.requireNonNull(actuator, "actuator");
        this.desiredValue = desiredValue;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink");
    }

    public CommandKey key() {
        return new CommandKey(rackId, actuator);
    }

    public boolean isExpiredAt(Instant now) {
        return !deadline.isAfter(now);
    }

    public void acknowledge(int achievedValue, Instant at) {
        transition(CommandStatus.ACKNOWLEDGED, at);
        this.achievedValue = achievedValue;
    }

    public void expire(Instant at) {
        transition(CommandStatus.EXPIRED, at);
    }

    private void transition(CommandStatus target, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Command " + commandId + " already " + status + ", cannot move to " + target);
        }
        this.status = target;
        this.resolvedAt = at;
    }

    public CommandHandle toHandle() {
        return new CommandHandle(commandId, rackId, actuator, desiredValue, issuedAt, deadline);
    }

    public CommandResult toResult() {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Command " + commandId + " is still " + status);
        }
        return CommandResult.builder()
                .commandId(commandId)
                .rackId(rackId)
                .actuator(actuator)
                .desiredValue(desiredValue)
                .outcome(status == CommandStatus.ACKNOWLEDGED ? CommandOutcome.ACKNOWLEDGED : CommandOutcome.EXPIRED)
                .achievedValue(achievedValue)
                .issuedAt(issuedAt)
                .resolvedAt(resolvedAt)
                .build();
    }
}
