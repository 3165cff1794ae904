package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.config.DecisionThresholds;
import com.sandy.aiot.rack.control.config.ThresholdConfig;
import com.sandy.aiot.rack.control.model.ActionIntent;
import com.sandy.aiot.rack.control.model.AlarmState;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.model.TrendEstimate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a confirmed rack snapshot plus trends into action intents using dual thresholds
 * per metric. Stateless: the only memory is the confirmed actuator state carried by the
 * snapshot, which is what makes the dead-bands hold.
 *
 * <p>Ventilation is switched on when any metric reaches its high threshold (or its
 * critical threshold) and released only when every metric with a reading is at or below
 * its low threshold. The alarm follows {@link AlarmState} priority; a cause is only
 * cleared by its own release condition:
 * <ul>
 *   <li>OVERHEAT - temperature below criticalReset</li>
 *   <li>DOOR_OPEN - door reported closed</li>
 *   <li>BREAK_IN - never cleared here, only by an operator; stays latched while a
 *   higher cause holds the alarm</li>
 * </ul>
 */
@Service
public class HysteresisDecisionEngine {

    public List<ActionIntent> evaluate(RackSnapshot rack, Map<Metric, TrendEstimate> trends, DecisionThresholds thresholds) {
        List<ActionIntent> intents = new ArrayList<>(2);
        evaluateAlarm(rack, thresholds.temperature()).ifPresent(intents::add);
        evaluateVentilation(rack, trends == null ? Map.of() : trends, thresholds).ifPresent(intents::add);
        return intents;
    }

    Optional<ActionIntent> evaluateAlarm(RackSnapshot rack, ThresholdConfig temperature) {
        Double t = rack.temperature();
        AlarmState current = rack.alarmState();

        Set<AlarmState> active = EnumSet.noneOf(AlarmState.class);
        boolean overheatLatched = current == AlarmState.OVERHEAT && (t == null || t >= temperature.criticalReset());
        if (temperature.isCritical(t) || overheatLatched) {
            active.add(AlarmState.OVERHEAT);
        }
        if (current == AlarmState.BREAK_IN || rack.breakInLatched()) {
            active.add(AlarmState.BREAK_IN);
        }
        if (rack.doorOpen()) {
            active.add(AlarmState.DOOR_OPEN);
        }

        AlarmState target = AlarmState.highest(active);
        if (target == current) {
            return Optional.empty();
        }
        if (target.outranks(current)) {
            return Optional.of(ActionIntent.activateAlarm(target, raiseReason(target, t, temperature)));
        }
        // current cause released by its own condition; fall back to the next active cause
        String released = current == AlarmState.OVERHEAT
                ? "temperature " + t + " below critical reset " + temperature.criticalReset()
                : "door closed";
        if (target == AlarmState.OFF) {
            return Optional.of(ActionIntent.deactivateAlarm(released));
        }
        return Optional.of(ActionIntent.activateAlarm(target, released + ", " + target + " still active"));
    }

    private String raiseReason(AlarmState target, Double t, ThresholdConfig temperature) {
        if (target == AlarmState.OVERHEAT) {
            return "temperature " + t + " at or above critical " + temperature.criticalThreshold();
        }
        if (target == AlarmState.BREAK_IN) {
            return "break-in still latched";
        }
        return "door open";
    }

    Optional<ActionIntent> evaluateVentilation(RackSnapshot rack, Map<Metric, TrendEstimate> trends, DecisionThresholds thresholds) {
        ThresholdConfig tc = thresholds.temperature();
        ThresholdConfig hc = thresholds.humidity();
        Double t = rack.temperature();
        Double h = rack.humidity();

        boolean critical = tc.isCritical(t) || hc.isCritical(h) || rack.alarmState() == AlarmState.OVERHEAT;
        boolean risingFast = isRisingFast(trends.get(Metric.TEMPERATURE), thresholds);

        if (!rack.ventilationOn()) {
            if (critical) {
                return Optional.of(ActionIntent.activateVentilation("critical condition temperature=" + t + " humidity=" + h));
            }
            if (tc.isHigh(t)) {
                return Optional.of(ActionIntent.activateVentilation("temperature " + t + " at or above " + tc.highThreshold()));
            }
            if (hc.isHigh(h)) {
                return Optional.of(ActionIntent.activateVentilation("humidity " + h + " at or above " + hc.highThreshold()));
            }
            if (risingFast && t != null && t > tc.lowThreshold()) {
                return Optional.of(ActionIntent.activateVentilation(String.format(
                        "temperature rising %.2f/min at %s", trends.get(Metric.TEMPERATURE).ratePerMinute(), t)));
            }
            return Optional.empty();
        }

        if (critical || risingFast) {
            return Optional.empty();
        }
        boolean anyReading = t != null || h != null;
        boolean temperatureReleased = t == null || tc.isLow(t);
        boolean humidityReleased = h == null || hc.isLow(h);
        if (anyReading && temperatureReleased && humidityReleased) {
            return Optional.of(ActionIntent.deactivateVentilation("temperature=" + t + " humidity=" + h + " at or below low thresholds"));
        }
        return Optional.empty();
    }

    private boolean isRisingFast(TrendEstimate trend, DecisionThresholds thresholds) {
        return thresholds.trendPreemptionEnabled()
                && trend != null
                && trend.ratePerMinute() > thresholds.risingRatePerMinute();
    }
}
