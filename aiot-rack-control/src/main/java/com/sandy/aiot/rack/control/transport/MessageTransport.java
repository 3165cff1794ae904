package com.sandy.aiot.rack.control.transport;

/**
 * Publish/subscribe channel shared by the controller and the rack devices. Delivery is
 * at-least-once and unordered; nothing bounds how long a message takes to arrive.
 */
public interface MessageTransport extends AutoCloseable {

    /**
     * @throws TransportException when the message could not be handed to the broker
     */
    void publish(String topic, String payload);

    /**
     * Registers a listener for an MQTT-style filter ({@code +} matches one level,
     * {@code #} the remaining levels).
     */
    void subscribe(String topicFilter, MessageListener listener);

    @Override
    void close();
}
