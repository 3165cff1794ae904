package com.sandy.aiot.rack.control.transport;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MQTT broker connection backed by the Paho v3 client. Subscriptions are remembered and
 * replayed after every reconnect because the session is clean. One listener per filter:
 * subscribing the same filter again replaces the previous listener.
 */
@Slf4j
public class MqttMessageTransport implements MessageTransport, MqttCallbackExtended {

    private final String serverUri;
    private final String username;
    private final String password;
    private final int qos;
    private final MqttClient client;
    private final Map<String, MessageListener> subscriptions = new ConcurrentHashMap<>();

    public MqttMessageTransport(String serverUri, String clientId, String username, String password, int qos) {
        if (qos < 0 || qos > 2) {
            throw new IllegalArgumentException("qos must be 0, 1 or 2");
        }
        this.serverUri = serverUri;
        this.username = username;
        this.password = password;
        this.qos = qos;
        try {
            this.client = new MqttClient(serverUri, clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new TransportException("Invalid MQTT client configuration uri=" + serverUri, e);
        }
        this.client.setCallback(this);
    }

    public void connect() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setConnectionTimeout(10);
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
            if (password != null) {
                options.setPassword(password.toCharArray());
            }
        }
        try {
            client.connect(options);
            log.info("MQTT connection established uri={} clientId={}", serverUri, client.getClientId());
        } catch (MqttException e) {
            throw new TransportException("MQTT connect failed uri=" + serverUri + " reason=" + e.getReasonCode(), e);
        }
    }

    @Override
    public void publish(String topic, String payload) {
        MqttMessage message = new MqttMessage(payload.getBytes(StandardCharsets.UTF_8));
        message.setQos(qos);
        message.setRetained(false);
        try {
            client.publish(topic, message);
        } catch (MqttException e) {
            throw new TransportException("MQTT publish failed topic=" + topic + " reason=" + e.getReasonCode(), e);
        }
    }

    @Override
    public void subscribe(String topicFilter, MessageListener listener) {
        subscriptions.put(topicFilter, listener);
        if (client.isConnected()) {
            doSubscribe(topicFilter, listener);
        }
    }

    private void doSubscribe(String topicFilter, MessageListener listener) {
        try {
            client.subscribe(topicFilter, qos, (topic, message) -> {
                // an exception escaping here makes Paho drop the connection
                try {
                    listener.onMessage(topic, new String(message.getPayload(), StandardCharsets.UTF_8));
                } catch (Exception e) {
                    log.warn("Listener failed filter={} topic={} error={}:{}", topicFilter, topic, e.getClass().getSimpleName(), e.getMessage());
                }
            });
            log.info("MQTT subscription registered filter={} qos={}", topicFilter, qos);
        } catch (MqttException e) {
            throw new TransportException("MQTT subscribe failed filter=" + topicFilter + " reason=" + e.getReasonCode(), e);
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        if (!reconnect) return;
        log.info("MQTT reconnected uri={}, restoring {} subscriptions", serverURI, subscriptions.size());
        subscriptions.forEach((filter, listener) -> {
            try {
                doSubscribe(filter, listener);
            } catch (TransportException e) {
                log.error("Failed to restore subscription filter={} error={}", filter, e.getMessage());
            }
        });
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("MQTT connection lost uri={} error={}", serverUri, cause == null ? "unknown" : cause.getMessage());
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        // per-subscription listeners handle delivery
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
    }

    @Override
    public void close() {
        try {
            if (client.isConnected()) {
                client.disconnect(3000);
            }
            client.close();
        } catch (MqttException e) {
            log.warn("MQTT shutdown failed uri={} reason={}", serverUri, e.getReasonCode());
        }
    }
}
