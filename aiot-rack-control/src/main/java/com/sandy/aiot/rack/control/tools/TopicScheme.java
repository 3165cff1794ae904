package com.sandy.aiot.rack.control.tools;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.Metric;

import java.util.Optional;

/**
 * Builds and parses the rack topic tree:
 * <pre>
 *   {base}/{rackId}/command/{actuator}
 *   {base}/{rackId}/ack/{actuator}
 *   {base}/{rackId}/environment/{metric}
 *   {base}/{rackId}/status
 *   {base}/{rackId}/location
 * </pre>
 */
public class TopicScheme {

    public enum Channel { COMMAND, ACK, ENVIRONMENT, STATUS, LOCATION }

    /**
     * A parsed topic. {@code segment} is the actuator or metric name for the channels that
     * carry one, otherwise null.
     */
    public record ParsedTopic(String rackId, Channel channel, String segment) {}

    private final String base;

    public TopicScheme(String base) {
        String b = base == null ? "" : base.trim();
        while (b.endsWith("/")) {
            b = b.substring(0, b.length() - 1);
        }
        if (b.isEmpty()) {
            throw new IllegalArgumentException("base topic must not be empty");
        }
        this.base = b;
    }

    public String base() {
        return base;
    }

    public String commandTopic(String rackId, Actuator actuator) {
        return base + "/" + checkRackId(rackId) + "/command/" + actuator.segment();
    }

    public String ackTopic(String rackId, Actuator actuator) {
        return base + "/" + checkRackId(rackId) + "/ack/" + actuator.segment();
    }

    public String environmentTopic(String rackId, Metric metric) {
        return base + "/" + checkRackId(rackId) + "/environment/" + metric.segment();
    }

    public String statusTopic(String rackId) {
        return base + "/" + checkRackId(rackId) + "/status";
    }

    public String locationTopic(String rackId) {
        return base + "/" + checkRackId(rackId) + "/location";
    }

    public String allCommandsFilter() {
        return base + "/+/command/+";
    }

    public String allAcksFilter() {
        return base + "/+/ack/+";
    }

    public String allEnvironmentFilter() {
        return base + "/+/environment/+";
    }

    public String allStatusFilter() {
        return base + "/+/status";
    }

    public String allLocationFilter() {
        return base + "/+/location";
    }

    public Optional<ParsedTopic> parse(String topic) {
        if (topic == null || !topic.startsWith(base + "/")) return Optional.empty();
        String[] parts = topic.substring(base.length() + 1).split("/", -1);
        if (parts.length < 2 || parts[0].isEmpty()) return Optional.empty();
        String rackId = parts[0];
        switch (parts[1]) {
            case "command":
                return parts.length == 3 ? Optional.of(new ParsedTopic(rackId, Channel.COMMAND, parts[2])) : Optional.empty();
            case "ack":
                return parts.length == 3 ? Optional.of(new ParsedTopic(rackId, Channel.ACK, parts[2])) : Optional.empty();
            case "environment":
                return parts.length == 3 ? Optional.of(new ParsedTopic(rackId, Channel.ENVIRONMENT, parts[2])) : Optional.empty();
            case "status":
                return parts.length == 2 ? Optional.of(new ParsedTopic(rackId, Channel.STATUS, null)) : Optional.empty();
            case "location":
                return parts.length == 2 ? Optional.of(new ParsedTopic(rackId, Channel.LOCATION, null)) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static String checkRackId(String rackId) {
        if (rackId == null || rackId.isBlank() || rackId.contains("/") || rackId.contains("+") || rackId.contains("#")) {
            throw new IllegalArgumentException("Invalid rack id: " + rackId);
        }
        return rackId;
    }
}
