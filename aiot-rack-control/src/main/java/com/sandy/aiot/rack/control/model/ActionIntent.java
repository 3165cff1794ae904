package com.sandy.aiot.rack.control.model;

import java.util.Objects;

/**
 * What the decision engine wants a rack to do. Intents are requests, not state: the rack
 * only changes once the device acknowledges the resulting command.
 */
public record ActionIntent(IntentType type, AlarmState cause, String reason) {

    public ActionIntent {
        Objects.requireNonNull(type, "type");
        if (type == IntentType.ACTIVATE_ALARM && (cause == null || cause == AlarmState.OFF)) {
            throw new IllegalArgumentException("ACTIVATE_ALARM needs a cause");
        }
        if (type != IntentType.ACTIVATE_ALARM) {
            cause = null;
        }
    }

    public static ActionIntent activateVentilation(String reason) {
        return new ActionIntent(IntentType.ACTIVATE_VENTILATION, null, reason);
    }

    public static ActionIntent deactivateVentilation(String reason) {
        return new ActionIntent(IntentType.DEACTIVATE_VENTILATION, null, reason);
    }

    public static ActionIntent activateAlarm(AlarmState cause, String reason) {
        return new ActionIntent(IntentType.ACTIVATE_ALARM, cause, reason);
    }

    public static ActionIntent deactivateAlarm(String reason) {
        return new ActionIntent(IntentType.DEACTIVATE_ALARM, null, reason);
    }

    public Actuator actuator() {
        return type.actuator();
    }

    public int desiredValue() {
        return switch (type) {
            case ACTIVATE_VENTILATION -> 1;
            case DEACTIVATE_VENTILATION, DEACTIVATE_ALARM -> 0;
            case ACTIVATE_ALARM -> cause.code();
        };
    }
}
