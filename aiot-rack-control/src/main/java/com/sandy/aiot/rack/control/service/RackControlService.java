package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.AlarmState;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Operator-facing rack commands. Every call goes through the dispatcher, so the rack
 * only changes once the device acknowledges; toggles read the last confirmed state.
 * A busy (rack, actuator) pair surfaces as {@link CommandRejectedException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RackControlService {

    private final CommandDispatcher dispatcher;

    public CompletableFuture<CommandResult> openDoor(String rackId) {
        return send(rackId, Actuator.DOOR, 1);
    }

    public CompletableFuture<CommandResult> closeDoor(String rackId) {
        return send(rackId, Actuator.DOOR, 0);
    }

    public CompletableFuture<CommandResult> toggleDoor(String rackId) {
        return confirmed(rackId).doorOpen() ? closeDoor(rackId) : openDoor(rackId);
    }

    public CompletableFuture<CommandResult> turnOnVentilation(String rackId) {
        return send(rackId, Actuator.VENTILATION, 1);
    }

    public CompletableFuture<CommandResult> turnOffVentilation(String rackId) {
        return send(rackId, Actuator.VENTILATION, 0);
    }

    public CompletableFuture<CommandResult> toggleVentilation(String rackId) {
        return confirmed(rackId).ventilationOn() ? turnOffVentilation(rackId) : turnOnVentilation(rackId);
    }

    public CompletableFuture<CommandResult> activateOverheatAlert(String rackId) {
        return send(rackId, Actuator.ALARM, AlarmState.OVERHEAT.code());
    }

    public CompletableFuture<CommandResult> activateDoorOpenAlert(String rackId) {
        return send(rackId, Actuator.ALARM, AlarmState.DOOR_OPEN.code());
    }

    /** Break-in is only ever raised here; the automation never sets or clears it. */
    public CompletableFuture<CommandResult> activateBreakInAlert(String rackId) {
        return send(rackId, Actuator.ALARM, AlarmState.BREAK_IN.code());
    }

    public CompletableFuture<CommandResult> silenceAlarm(String rackId) {
        return send(rackId, Actuator.ALARM, AlarmState.OFF.code());
    }

    public CompletableFuture<CommandResult> send(String rackId, Actuator actuator, int value) {
        log.info("Manual command rackId={} actuator={} value={}", rackId, actuator, value);
        return dispatcher.issue(rackId, actuator, value);
    }

    private RackSnapshot confirmed(String rackId) {
        return dispatcher.rack(rackId).orElseGet(() -> RackSnapshot.empty(rackId));
    }
}
