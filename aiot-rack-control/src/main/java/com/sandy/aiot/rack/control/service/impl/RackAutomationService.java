package com.sandy.aiot.rack.control.service.impl;

import com.sandy.aiot.rack.control.config.DecisionThresholds;
import com.sandy.aiot.rack.control.model.ActionIntent;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.IssueResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.model.TrendEstimate;
import com.sandy.aiot.rack.control.service.CommandDispatcher;
import com.sandy.aiot.rack.control.service.HysteresisDecisionEngine;
import com.sandy.aiot.rack.control.service.TrendEstimatorService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Closes the loop between telemetry and actuators: runs the decision engine on every
 * known rack at a fixed tick and, optionally, right after each telemetry update. Intents
 * become dispatcher commands; a busy actuator just waits for the next evaluation.
 */
@Service
@Slf4j
public class RackAutomationService {

    private final CommandDispatcher dispatcher;
    private final HysteresisDecisionEngine decisionEngine;
    private final TrendEstimatorService trendEstimator;
    private final DecisionThresholds thresholds;
    private final boolean enabled;
    private final boolean evaluateOnTelemetry;

    public RackAutomationService(CommandDispatcher dispatcher,
                                 HysteresisDecisionEngine decisionEngine,
                                 TrendEstimatorService trendEstimator,
                                 DecisionThresholds thresholds,
                                 @Value("${rack.automation.enabled:true}") boolean enabled,
                                 @Value("${rack.automation.evaluate-on-telemetry:true}") boolean evaluateOnTelemetry) {
        this.dispatcher = dispatcher;
        this.decisionEngine = decisionEngine;
        this.trendEstimator = trendEstimator;
        this.thresholds = thresholds;
        this.enabled = enabled;
        this.evaluateOnTelemetry = evaluateOnTelemetry;
    }

    private ExecutorService evaluator;

    @PostConstruct
    public void init() {
        evaluator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rack-automation");
            t.setDaemon(true);
            return t;
        });
        log.info("Rack automation initialized: enabled={} evaluateOnTelemetry={}", enabled, evaluateOnTelemetry);
    }

    @PreDestroy
    public void shutdown() {
        evaluator.shutdownNow();
        try {
            if (!evaluator.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Rack automation executor did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Scheduled(fixedDelayString = "${rack.automation.tick-interval-ms:1000}")
    public void scheduledTick() {
        if (!enabled) return;
        try { evaluateAll(); } catch (Exception e) { log.error("Scheduled rack evaluation failed: {}", e.getMessage(), e); }
    }

    /**
     * Hands the rack to the evaluation thread; called from transport delivery, so it must
     * not do the evaluation inline.
     */
    public void onTelemetry(String rackId) {
        if (!enabled || !evaluateOnTelemetry) return;
        try {
            evaluator.execute(() -> {
                try {
                    evaluateRack(rackId);
                } catch (Exception e) {
                    log.error("Telemetry-triggered evaluation failed rackId={} error={}", rackId, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Evaluation skipped, automation stopping rackId={}", rackId);
        }
    }

    /**
     * Public entry point for tests / manual trigger; runs regardless of the enabled flag.
     *
     * @return number of commands accepted by the dispatcher
     */
    public int evaluateAll() {
        int issued = 0;
        List<RackSnapshot> racks = dispatcher.racks();
        for (RackSnapshot rack : racks) {
            issued += evaluate(rack);
        }
        log.debug("Rack evaluation finished racks={} issued={}", racks.size(), issued);
        return issued;
    }

    public int evaluateRack(String rackId) {
        return dispatcher.rack(rackId).map(this::evaluate).orElse(0);
    }

    private int evaluate(RackSnapshot rack) {
        Map<Metric, TrendEstimate> trends = trendEstimator.estimates(rack.rackId());
        List<ActionIntent> intents = decisionEngine.evaluate(rack, trends, thresholds);
        int issued = 0;
        for (ActionIntent intent : intents) {
            IssueResult result = dispatcher.issue(rack.rackId(), intent.actuator(), intent.desiredValue(), this::onResult);
            if (result.accepted()) {
                issued++;
                log.info("Automation intent issued rackId={} intent={} value={} reason={} commandId={}",
                        rack.rackId(), intent.type(), intent.desiredValue(), intent.reason(), result.handle().commandId());
            } else {
                log.debug("Automation intent skipped rackId={} intent={} blockedBy={}",
                        rack.rackId(), intent.type(), result.blockingCommandId());
            }
        }
        return issued;
    }

    private void onResult(CommandResult result) {
        if (!result.isAcknowledged()) {
            log.warn("Automation command expired rackId={} actuator={} desired={} commandId={}, will re-evaluate",
                    result.rackId(), result.actuator(), result.desiredValue(), result.commandId());
        }
    }
}
