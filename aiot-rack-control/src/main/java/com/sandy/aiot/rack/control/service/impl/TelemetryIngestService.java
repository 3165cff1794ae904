package com.sandy.aiot.rack.control.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.service.CommandDispatcher;
import com.sandy.aiot.rack.control.service.TrendEstimatorService;
import com.sandy.aiot.rack.control.tools.PayloadParser;
import com.sandy.aiot.rack.control.tools.TopicScheme;
import com.sandy.aiot.rack.control.tools.TopicScheme.ParsedTopic;
import com.sandy.aiot.rack.control.transport.MessageTransport;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Inbound side of the controller: subscribes to rack telemetry and acknowledgments,
 * parses the payloads and routes them to the dispatcher, the trend estimator and the
 * automation loop. Runs on the transport's delivery thread, so nothing here blocks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelemetryIngestService {

    private static final String DOOR_SEGMENT = "door";

    private final MessageTransport transport;
    private final TopicScheme topics;
    private final CommandDispatcher dispatcher;
    private final TrendEstimatorService trendEstimator;
    private final RackAutomationService automation;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostConstruct
    public void subscribe() {
        transport.subscribe(topics.allEnvironmentFilter(), this::onMessage);
        transport.subscribe(topics.allStatusFilter(), this::onMessage);
        transport.subscribe(topics.allLocationFilter(), this::onMessage);
        transport.subscribe(topics.allAcksFilter(), this::onMessage);
        log.info("Telemetry ingestion subscribed base={}", topics.base());
    }

    public void onMessage(String topic, String payload) {
        Optional<ParsedTopic> parsed = topics.parse(topic);
        if (parsed.isEmpty()) {
            drop(topic, payload, "unrecognized topic");
            return;
        }
        ParsedTopic t = parsed.get();
        Instant now = clock.instant();
        try {
            switch (t.channel()) {
                case ENVIRONMENT -> onEnvironment(t, topic, payload, now);
                case STATUS -> onDoorStatus(t.rackId(), topic, payload, now);
                case LOCATION -> onLocation(t.rackId(), topic, payload, now);
                case ACK -> onAck(t, topic, payload);
                case COMMAND -> log.debug("Ignoring command echo topic={}", topic);
            }
        } catch (RuntimeException e) {
            log.error("Telemetry handling failed topic={} payload={} error={}", topic, payload, e.getMessage(), e);
        }
    }

    private void onEnvironment(ParsedTopic t, String topic, String payload, Instant now) {
        if (DOOR_SEGMENT.equalsIgnoreCase(t.segment())) {
            onDoorStatus(t.rackId(), topic, payload, now);
            return;
        }
        Optional<Metric> metric = Metric.fromSegment(t.segment());
        if (metric.isEmpty()) {
            drop(topic, payload, "unknown metric");
            return;
        }
        OptionalDouble value = PayloadParser.parseDecimal(payload);
        if (value.isEmpty()) {
            drop(topic, payload, "invalid number");
            return;
        }
        dispatcher.recordTelemetry(t.rackId(), metric.get(), value.getAsDouble(), now);
        trendEstimator.ingest(t.rackId(), metric.get(), value.getAsDouble(), now);
        log.debug("Telemetry rackId={} metric={} value={}", t.rackId(), metric.get(), value.getAsDouble());
        automation.onTelemetry(t.rackId());
    }

    private void onDoorStatus(String rackId, String topic, String payload, Instant now) {
        Optional<Boolean> open = PayloadParser.parseFlag(payload);
        if (open.isEmpty()) {
            drop(topic, payload, "invalid door status");
            return;
        }
        dispatcher.recordDoorStatus(rackId, open.get(), now);
        log.debug("Door status rackId={} open={}", rackId, open.get());
        automation.onTelemetry(rackId);
    }

    private void onLocation(String rackId, String topic, String payload, Instant now) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (Exception e) {
            drop(topic, payload, "invalid location json");
            return;
        }
        if (node == null || !node.path("latitude").isNumber() || !node.path("longitude").isNumber()) {
            drop(topic, payload, "location needs numeric latitude and longitude");
            return;
        }
        double lat = node.get("latitude").asDouble();
        double lon = node.get("longitude").asDouble();
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            drop(topic, payload, "location out of range");
            return;
        }
        dispatcher.recordLocation(rackId, lat, lon, now);
        log.info("Location rackId={} lat={} lon={}", rackId, lat, lon);
    }

    private void onAck(ParsedTopic t, String topic, String payload) {
        Optional<Actuator> actuator = Actuator.fromSegment(t.segment());
        OptionalInt value = PayloadParser.parseInteger(payload);
        if (actuator.isEmpty() || value.isEmpty()) {
            drop(topic, payload, "malformed ack");
            return;
        }
        dispatcher.onAckReceived(t.rackId(), actuator.get(), value.getAsInt());
    }

    private void drop(String topic, String payload, String why) {
        log.warn("Dropped message topic={} payload={} reason={}", topic, payload, why);
    }
}
