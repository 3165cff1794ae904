package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;

/** Parsed command as it sits in a device queue. */
public record DeviceCommand(Actuator actuator, int value) {
}
