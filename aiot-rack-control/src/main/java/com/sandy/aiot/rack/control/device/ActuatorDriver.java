package com.sandy.aiot.rack.control.device;

import com.sandy.aiot.rack.control.model.Actuator;

/**
 * Hardware access for one rack. Only the device worker thread calls {@link #apply}.
 */
public interface ActuatorDriver {

    /**
     * Drives the actuator towards {@code value}. Re-applying the current value leaves the
     * hardware untouched.
     *
     * @return the value the hardware actually holds afterwards
     * @throws RuntimeException when the actuator did not respond; no ack is sent then
     */
    int apply(Actuator actuator, int value);

    int currentValue(Actuator actuator);
}
