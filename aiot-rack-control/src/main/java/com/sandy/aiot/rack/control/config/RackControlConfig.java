package com.sandy.aiot.rack.control.config;

import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.transport.InMemoryMessageTransport;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import com.sandy.aiot.rack.control.transport.MqttMessageTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class RackControlConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TopicScheme topicScheme(@Value("${rack.transport.base-topic:racks}") String baseTopic) {
        TopicScheme scheme = new TopicScheme(baseTopic);
        log.info("Rack topic tree rooted at {}", scheme.base());
        return scheme;
    }

    @Bean
    public DecisionThresholds decisionThresholds(
            @Value("${rack.thresholds.temperature.high:35}") double tempHigh,
            @Value("${rack.thresholds.temperature.low:28}") double tempLow,
            @Value("${rack.thresholds.temperature.critical:45}") double tempCritical,
            @Value("${rack.thresholds.temperature.critical-reset:40}") double tempCriticalReset,
            @Value("${rack.thresholds.humidity.high:70}") double humHigh,
            @Value("${rack.thresholds.humidity.low:60}") double humLow,
            @Value("${rack.thresholds.humidity.critical:85}") double humCritical,
            @Value("${rack.thresholds.humidity.critical-reset:80}") double humCriticalReset,
            @Value("${rack.decision.trend-preemption.enabled:false}") boolean preemptionEnabled,
            @Value("${rack.decision.trend-preemption.rising-rate-per-minute:0.5}") double risingRatePerMinute) {
        DecisionThresholds thresholds = new DecisionThresholds(
                new ThresholdConfig(tempHigh, tempLow, tempCritical, tempCriticalReset),
                new ThresholdConfig(humHigh, humLow, humCritical, humCriticalReset),
                preemptionEnabled,
                risingRatePerMinute);
        log.info("Decision thresholds loaded: temperature={} humidity={} trendPreemption={} risingRatePerMinute={}",
                thresholds.temperature(), thresholds.humidity(), preemptionEnabled, risingRatePerMinute);
        return thresholds;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "rack.transport.type", havingValue = "in-memory", matchIfMissing = true)
    public MessageTransport inMemoryMessageTransport() {
        log.info("Using in-memory message transport");
        return new InMemoryMessageTransport();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "rack.transport.type", havingValue = "mqtt")
    public MessageTransport mqttMessageTransport(
            @Value("${rack.transport.mqtt.server-uri:tcp://localhost:1883}") String serverUri,
            @Value("${rack.transport.mqtt.client-id:rack-controller}") String clientId,
            @Value("${rack.transport.mqtt.username:}") String username,
            @Value("${rack.transport.mqtt.password:}") String password,
            @Value("${rack.transport.mqtt.qos:1}") int qos) {
        MqttMessageTransport transport = new MqttMessageTransport(serverUri, clientId, username, password, qos);
        transport.connect();
        return transport;
    }
}
