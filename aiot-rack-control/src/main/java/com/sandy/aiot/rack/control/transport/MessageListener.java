package com.sandy.aiot.rack.control.transport;

/**
 * Inbound delivery callback. Runs on the transport's own thread, so implementations must
 * return quickly and never block.
 */
@FunctionalInterface
public interface MessageListener {
    void onMessage(String topic, String payload);
}
