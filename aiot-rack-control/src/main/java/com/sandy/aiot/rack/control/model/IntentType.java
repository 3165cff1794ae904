package com.sandy.aiot.rack.control.model;

public enum IntentType {
    ACTIVATE_VENTILATION(Actuator.VENTILATION),
    DEACTIVATE_VENTILATION(Actuator.VENTILATION),
    ACTIVATE_ALARM(Actuator.ALARM),
    DEACTIVATE_ALARM(Actuator.ALARM);

    private final Actuator actuator;

    IntentType(Actuator actuator) {
        this.actuator = actuator;
    }

    public Actuator actuator() {
        return actuator;
    }
}
